package com.mythos.api.service.ratelimit;

/**
 * 클라이언트별 고정 윈도우 카운터 저장소
 *
 * 단일 프로세스는 {@link InMemoryQuotaStore}, 다중 인스턴스 배포는 공유 저장소 구현으로 교체.
 * 구현체는 identity 단위로 검사+증가를 원자적으로 수행해야 함.
 */
public interface QuotaStore {

    /**
     * 검사 후 허용 시 카운트 증가 (identity 단위 원자적 연산)
     */
    AdmissionDecision check(String identity, int ceiling, long windowMs, long now);

    /**
     * 윈도우가 끝난 항목 삭제
     * @return 삭제된 항목 수
     */
    int sweep(long now);

    void clear();

    long size();
}
