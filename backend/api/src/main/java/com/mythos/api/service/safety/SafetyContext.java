package com.mythos.api.service.safety;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 안전성 평가 대상 텍스트의 종류
 * 종류별로 허용 최대 단어 수가 다름
 */
@Getter
@RequiredArgsConstructor
public enum SafetyContext {

    SCENE_INPUT(50),
    VISUAL_DESCRIPTION(120),
    GENERATED_NARRATIVE(120);

    public static final int MIN_WORDS = 3;

    private final int maxWords;
}
