package com.mythos.api.service.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Rate limit 검사 결과
 */
@Getter
@ToString
@RequiredArgsConstructor
public class AdmissionDecision {

    private final boolean allowed;
    private final int remaining;
    private final long resetAt;  // epoch millis

    public static AdmissionDecision allowed(int remaining, long resetAt) {
        return new AdmissionDecision(true, remaining, resetAt);
    }

    public static AdmissionDecision denied(long resetAt) {
        return new AdmissionDecision(false, 0, resetAt);
    }
}
