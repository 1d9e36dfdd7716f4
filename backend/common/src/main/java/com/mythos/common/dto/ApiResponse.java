package com.mythos.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mythos.common.enums.ErrorType;
import com.mythos.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private String code;
    private String message;
    private T data;

    // 실패 시에만 채워짐 (파이프라인 단계 구분, 재시도 가능 시각)
    private String errorType;
    private Long resetAt;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .code("SUCCESS")
                .message("OK")
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .code("SUCCESS")
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorCode errorCode) {
        return ApiResponse.<T>builder()
                .success(false)
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorCode errorCode, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .code(errorCode.getCode())
                .message(message)
                .build();
    }

    /**
     * 생성 파이프라인 거부 응답 (단계 구분 + rate limit 리셋 시각 포함)
     */
    public static <T> ApiResponse<T> rejected(ErrorCode errorCode, String message, ErrorType errorType, Long resetAt) {
        return ApiResponse.<T>builder()
                .success(false)
                .code(errorCode.getCode())
                .message(message)
                .errorType(errorType != null ? errorType.getCode() : null)
                .resetAt(resetAt)
                .build();
    }
}
