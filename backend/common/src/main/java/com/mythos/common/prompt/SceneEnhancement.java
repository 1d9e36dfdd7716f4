package com.mythos.common.prompt;

import com.mythos.common.enums.SceneCategory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 장면 분류별 이미지 강조 문구
 */
@Getter
@RequiredArgsConstructor
public enum SceneEnhancement {

    ACTION(SceneCategory.ACTION, "dynamic action lines, impact effects, heroic proportions"),
    SPIRITUAL(SceneCategory.SPIRITUAL, "divine radiance, ethereal lighting, cosmic background"),
    GENERAL(SceneCategory.GENERAL, "mythological grandeur, cultural authenticity, emotional depth");

    private final SceneCategory category;
    private final String promptText;

    public static SceneEnhancement forCategory(SceneCategory category) {
        for (SceneEnhancement enhancement : values()) {
            if (enhancement.category == category) {
                return enhancement;
            }
        }
        return GENERAL;
    }
}
