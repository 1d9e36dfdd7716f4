package com.mythos.api.service.provider;

import com.mythos.common.enums.SceneCategory;
import lombok.Builder;
import lombok.Getter;

/**
 * 스크립트 생성 요청 (원본 장면 + 렌더링된 프롬프트)
 */
@Getter
@Builder
public class ScriptPrompt {

    private final String scene;
    private final SceneCategory sceneCategory;
    private final String systemPrompt;
    private final String userPrompt;
}
