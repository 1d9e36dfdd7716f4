package com.mythos.api.service.provider;

/**
 * Provider 호출 실패 유형
 */
public enum ProviderErrorType {
    MODEL_NOT_FOUND,    // 모델 미존재/사용 불가 → fallback 모델 대상
    TIMEOUT,
    TRANSPORT,          // 연결 실패, 5xx, 429, 응답 파싱 실패 등
    EMPTY_RESPONSE,
    CONTENT_POLICY,
    UNAUTHORIZED
}
