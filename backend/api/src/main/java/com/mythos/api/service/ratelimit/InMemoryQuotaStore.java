package com.mythos.api.service.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine 기반 인메모리 저장소
 * - compute()로 identity 단위 검사+증가를 원자적으로 처리
 * - maximumSize로 추적 identity 수 상한 (sweep과 별개)
 */
public class InMemoryQuotaStore implements QuotaStore {

    private final ConcurrentMap<String, ClientQuota> quotas;

    public InMemoryQuotaStore(long maxTrackedIdentities) {
        Cache<String, ClientQuota> cache = Caffeine.newBuilder()
                .maximumSize(maxTrackedIdentities)
                .build();
        this.quotas = cache.asMap();
    }

    @Override
    public AdmissionDecision check(String identity, int ceiling, long windowMs, long now) {
        AdmissionDecision[] decision = new AdmissionDecision[1];

        quotas.compute(identity, (key, current) -> {
            // 첫 요청 또는 윈도우 만료: 새 윈도우 시작
            if (current == null || current.isExpired(now)) {
                ClientQuota fresh = ClientQuota.startWindow(now, windowMs);
                decision[0] = AdmissionDecision.allowed(ceiling - 1, fresh.getWindowEnd());
                return fresh;
            }
            if (current.getCount() >= ceiling) {
                decision[0] = AdmissionDecision.denied(current.getWindowEnd());
                return current;
            }
            ClientQuota next = current.increment();
            decision[0] = AdmissionDecision.allowed(ceiling - next.getCount(), next.getWindowEnd());
            return next;
        });

        return decision[0];
    }

    @Override
    public int sweep(long now) {
        int before = quotas.size();
        quotas.values().removeIf(quota -> quota.isExpired(now));
        return Math.max(0, before - quotas.size());
    }

    @Override
    public void clear() {
        quotas.clear();
    }

    @Override
    public long size() {
        return quotas.size();
    }
}
