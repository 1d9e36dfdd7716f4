package com.mythos.api.service.ratelimit;

/**
 * Rate limiter별 저장소 생성 (저장소 구현 교체 지점)
 */
public interface QuotaStoreFactory {

    QuotaStore create(String limiterName);
}
