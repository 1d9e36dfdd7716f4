package com.mythos.api.service.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 윈도우 Rate Limiter
 *
 * - 첫 요청(또는 윈도우 만료 후 첫 요청): count=1, resetAt=now+window
 * - 윈도우 내: count >= ceiling 이면 거부 (resetAt 유지), 아니면 count++
 * - 윈도우 경계에서 최대 2x ceiling 요청이 통과할 수 있음 (고정 윈도우 특성)
 */
@Slf4j
public class FixedWindowRateLimiter {

    @Getter
    private final String name;
    @Getter
    private final int ceiling;
    @Getter
    private final long windowMs;

    private final QuotaStore store;
    private final Clock clock;

    private final AtomicLong totalAllowed = new AtomicLong(0);
    private final AtomicLong totalDenied = new AtomicLong(0);

    public FixedWindowRateLimiter(String name, int ceiling, long windowMs, QuotaStore store, Clock clock) {
        if (ceiling <= 0) {
            throw new IllegalArgumentException("ceiling must be positive: " + ceiling);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive: " + windowMs);
        }
        this.name = name;
        this.ceiling = ceiling;
        this.windowMs = windowMs;
        this.store = store;
        this.clock = clock;

        log.info("[RateLimit] {} limiter initialized - ceiling: {}, window: {}ms", name, ceiling, windowMs);
    }

    /**
     * 검사 + 허용 시 카운트 증가
     */
    public AdmissionDecision check(String identity) {
        AdmissionDecision decision = store.check(identity, ceiling, windowMs, clock.millis());

        if (decision.isAllowed()) {
            totalAllowed.incrementAndGet();
            log.debug("[RateLimit] {} - allowed {} (remaining: {})", name, identity, decision.getRemaining());
        } else {
            totalDenied.incrementAndGet();
            log.warn("[RateLimit] {} - denied {} until {}", name, identity, decision.getResetAt());
        }
        return decision;
    }

    /**
     * 만료 항목 정리
     * @return 삭제된 항목 수
     */
    public int sweep() {
        return store.sweep(clock.millis());
    }

    public void reset() {
        store.clear();
        log.info("[RateLimit] {} - all quotas cleared", name);
    }

    public LimiterStats getStats() {
        return new LimiterStats(name, ceiling, windowMs, store.size(), totalAllowed.get(), totalDenied.get());
    }

    /**
     * Limiter 통계
     */
    public record LimiterStats(
            String name,
            int ceiling,
            long windowMs,
            long trackedIdentities,
            long totalAllowed,
            long totalDenied
    ) {}
}
