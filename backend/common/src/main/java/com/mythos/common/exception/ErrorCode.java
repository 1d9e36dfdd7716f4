package com.mythos.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "Something went wrong. Please try again."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "Invalid request."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C004", "This operation is not permitted."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "Resource not found."),

    // Generation - 입력 검증
    INVALID_SCENE(HttpStatus.BAD_REQUEST, "G001", "Scene description should be 3-20 words for optimal results."),
    UNSAFE_INPUT(HttpStatus.BAD_REQUEST, "G002", "Scene description contains inappropriate content. Please modify your request."),
    INVALID_VISUAL_DESCRIPTION(HttpStatus.BAD_REQUEST, "G003", "Image description is required."),

    // Generation - rate limit
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "R001", "Rate limit exceeded. Please try again later."),

    // Generation - 스크립트
    SCRIPT_GENERATION_FAILED(HttpStatus.BAD_GATEWAY, "S001", "Failed to generate script. Please try again."),
    SCRIPT_INVALID_STRUCTURE(HttpStatus.BAD_GATEWAY, "S002", "The script service returned an unexpected result. Please try again later."),

    // Generation - 이미지
    IMAGE_GENERATION_FAILED(HttpStatus.BAD_GATEWAY, "I001", "Failed to generate image. Please try again."),

    // Gallery
    PANEL_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "Saved panel not found.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
