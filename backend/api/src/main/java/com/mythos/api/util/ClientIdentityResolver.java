package com.mythos.api.util;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Rate limit 식별자 추출
 * X-Forwarded-For 첫 번째 값 → remote address → "unknown"
 */
public final class ClientIdentityResolver {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    public static final String UNKNOWN = "unknown";

    private ClientIdentityResolver() {}

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return UNKNOWN;
    }
}
