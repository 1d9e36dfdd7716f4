package com.mythos.api.service.pipeline;

import com.mythos.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 거부 사유 (클라이언트에 노출되는 안정적인 코드)
 */
@Getter
@RequiredArgsConstructor
public enum RejectReason {

    INVALID_SCENE("invalid_scene", ErrorCode.INVALID_SCENE),
    INVALID_DESCRIPTION("invalid_description", ErrorCode.INVALID_VISUAL_DESCRIPTION),
    RATE_LIMITED("rate_limited", ErrorCode.RATE_LIMITED),
    UNSAFE_INPUT("unsafe_input", ErrorCode.UNSAFE_INPUT),
    GENERATION_FAILED("generation_failed", ErrorCode.SCRIPT_GENERATION_FAILED),
    INVALID_STRUCTURE("invalid_structure", ErrorCode.SCRIPT_INVALID_STRUCTURE),
    IMAGE_FAILED("image_failed", ErrorCode.IMAGE_GENERATION_FAILED);

    private final String code;
    private final ErrorCode errorCode;
}
