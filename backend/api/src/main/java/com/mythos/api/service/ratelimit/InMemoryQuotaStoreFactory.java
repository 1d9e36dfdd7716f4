package com.mythos.api.service.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class InMemoryQuotaStoreFactory implements QuotaStoreFactory {

    private final long maxTrackedIdentities;

    public InMemoryQuotaStoreFactory(@Value("${mythos.rate-limit.max-tracked-identities:100000}") long maxTrackedIdentities) {
        this.maxTrackedIdentities = maxTrackedIdentities;
    }

    @Override
    public QuotaStore create(String limiterName) {
        log.info("[RateLimit] Creating in-memory quota store for {} (max identities: {})", limiterName, maxTrackedIdentities);
        return new InMemoryQuotaStore(maxTrackedIdentities);
    }
}
