package com.mythos.api.service.image;

import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.Builder;
import lombok.Getter;

/**
 * 이미지 생성 서비스
 * 시각 묘사를 스타일 프롬프트로 확장하여 이미지 참조(URL) 생성
 */
public interface ImageGeneratorService {

    @Getter
    @Builder
    class ImageResult {
        private String imageRef;
        private String prompt;      // 실제 사용된 최종 프롬프트
    }

    /**
     * @throws com.mythos.api.service.provider.ProviderException 생성 실패
     */
    ImageResult generate(String visualDescription, StyleCategory style, SceneCategory category);
}
