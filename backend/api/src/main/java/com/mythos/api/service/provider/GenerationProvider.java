package com.mythos.api.service.provider;

import com.mythos.common.enums.StyleCategory;

/**
 * 외부 생성 모델 어댑터
 * 모드(live/synthetic)는 기동 시 한 번 결정되며 모든 실패는 {@link ProviderException}
 */
public interface GenerationProvider {

    ProviderMode getMode();

    /**
     * 텍스트 완성 (JSON 응답 형식 요청)
     * @return 모델이 돌려준 원문 텍스트
     */
    String completeText(ScriptPrompt prompt, String model);

    /**
     * 이미지 생성
     * @return 이미지 참조 (URL)
     */
    String synthesizeImage(ImagePrompt prompt, StyleCategory style);

    ModerationResult moderate(String text);
}
