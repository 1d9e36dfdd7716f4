package com.mythos.common.prompt;

import com.mythos.common.enums.StyleCategory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 스타일 분류별 색상 팔레트 프롬프트
 */
@Getter
@RequiredArgsConstructor
public enum ColorPalette {

    VIBRANT(StyleCategory.VIBRANT, "rich jewel tones, golden highlights, deep saturated colors"),
    EARTH(StyleCategory.EARTH, "warm earth tones, ochre and vermillion, natural pigment colors"),
    DIVINE(StyleCategory.DIVINE, "ethereal blues and golds, divine radiance, celestial color palette");

    private final StyleCategory style;
    private final String promptText;

    public static ColorPalette forStyle(StyleCategory style) {
        for (ColorPalette palette : values()) {
            if (palette.style == style) {
                return palette;
            }
        }
        return VIBRANT;
    }
}
