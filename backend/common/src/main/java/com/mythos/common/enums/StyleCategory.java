package com.mythos.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 이미지 색상 팔레트 분류
 */
@Getter
@RequiredArgsConstructor
public enum StyleCategory {

    VIBRANT("vibrant", "선명한 보석 톤"),
    EARTH("earth", "흙빛 자연 안료"),
    DIVINE("divine", "천상의 푸른빛과 금빛");

    private final String code;
    private final String displayName;

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StyleCategory fromCode(String code) {
        if (code == null) {
            return VIBRANT;
        }
        for (StyleCategory style : values()) {
            if (style.code.equalsIgnoreCase(code.trim())) {
                return style;
            }
        }
        return VIBRANT;
    }
}
