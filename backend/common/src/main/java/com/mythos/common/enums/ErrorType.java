package com.mythos.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 통합 파이프라인 실패 단계 구분자
 */
@Getter
@RequiredArgsConstructor
public enum ErrorType {

    SCRIPT_GENERATION_ERROR("script_generation_error"),
    IMAGE_GENERATION_ERROR("image_generation_error"),
    GENERAL_ERROR("general_error");

    @JsonValue
    private final String code;
}
