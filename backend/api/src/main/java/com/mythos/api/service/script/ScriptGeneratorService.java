package com.mythos.api.service.script;

import com.mythos.common.enums.SceneCategory;
import lombok.Builder;
import lombok.Getter;

/**
 * 스크립트 생성 서비스
 * 장면 설명을 만화 패널 스크립트(JSON 텍스트)로 변환
 */
public interface ScriptGeneratorService {

    /**
     * 생성 결과 (파싱 전 원문 + 실제 사용된 모델)
     */
    @Getter
    @Builder
    class ScriptCompletion {
        private String rawText;
        private String model;
        private boolean fallbackModelUsed;
    }

    /**
     * 텍스트 완성 호출
     * 주 모델이 없거나 사용 불가하면 fallback 모델로 정확히 한 번 재시도
     *
     * @param scene 사용자 장면 설명
     * @param category 장면 분류
     * @throws com.mythos.api.service.provider.ProviderException 생성 실패
     */
    ScriptCompletion generate(String scene, SceneCategory category);
}
