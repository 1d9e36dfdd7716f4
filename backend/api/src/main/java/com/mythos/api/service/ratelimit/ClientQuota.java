package com.mythos.api.service.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 클라이언트별 현재 윈도우 사용량 (불변, 갱신 시 새 인스턴스로 교체)
 */
@Getter
@RequiredArgsConstructor
public class ClientQuota {

    private final int count;
    private final long windowEnd;  // epoch millis

    public static ClientQuota startWindow(long now, long windowMs) {
        return new ClientQuota(1, now + windowMs);
    }

    public ClientQuota increment() {
        return new ClientQuota(count + 1, windowEnd);
    }

    /**
     * windowEnd(resetAt) 시각 자체는 아직 현재 윈도우에 포함
     */
    public boolean isExpired(long now) {
        return now > windowEnd;
    }
}
