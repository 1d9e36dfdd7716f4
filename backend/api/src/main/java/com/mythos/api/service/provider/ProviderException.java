package com.mythos.api.service.provider;

import lombok.Getter;

/**
 * 외부 생성 모델 호출 실패
 * 상세 메시지는 로그용이며 클라이언트 응답에 그대로 노출하지 않음
 */
@Getter
public class ProviderException extends RuntimeException {

    private final ProviderErrorType type;
    private final int statusCode;  // HTTP 응답이 없으면 0

    public ProviderException(ProviderErrorType type, String message) {
        this(type, message, 0, null);
    }

    public ProviderException(ProviderErrorType type, String message, Throwable cause) {
        this(type, message, 0, cause);
    }

    public ProviderException(ProviderErrorType type, String message, int statusCode, Throwable cause) {
        super("[" + type + "] " + message, cause);
        this.type = type;
        this.statusCode = statusCode;
    }

    public boolean isModelNotFound() {
        return type == ProviderErrorType.MODEL_NOT_FOUND;
    }

    /**
     * 전송 계층 재시도 대상 여부 (타임아웃, 연결 실패, 5xx, 429)
     */
    public boolean isRetryable() {
        if (type == ProviderErrorType.TIMEOUT) {
            return true;
        }
        if (type != ProviderErrorType.TRANSPORT) {
            return false;
        }
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
