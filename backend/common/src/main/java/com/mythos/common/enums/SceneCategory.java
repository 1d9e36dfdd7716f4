package com.mythos.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 장면 분류 힌트
 * 스크립트 프롬프트 프레이밍과 이미지 장면 강조 문구 선택에 사용
 */
@Getter
@RequiredArgsConstructor
public enum SceneCategory {

    GENERAL("general", "일반"),
    ACTION("action", "액션/전투"),
    SPIRITUAL("spiritual", "영적/깨달음");

    private final String code;
    private final String displayName;

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 코드 문자열 → enum (null 또는 알 수 없는 값은 GENERAL)
     */
    @JsonCreator
    public static SceneCategory fromCode(String code) {
        if (code == null) {
            return GENERAL;
        }
        for (SceneCategory category : values()) {
            if (category.code.equalsIgnoreCase(code.trim())) {
                return category;
            }
        }
        return GENERAL;
    }
}
