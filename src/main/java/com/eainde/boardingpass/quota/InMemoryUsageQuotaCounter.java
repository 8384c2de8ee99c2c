package com.eainde.boardingpass.quota;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local counter. Counts are lost on restart; multi-instance deployments need a shared store.
 */
public class InMemoryUsageQuotaCounter implements UsageQuotaCounter {

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final long limit;

    public InMemoryUsageQuotaCounter(long limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        this.limit = limit;
    }

    @Override
    public QuotaDecision checkAndIncrement(String key) {
        long count = counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        return new QuotaDecision(count <= limit, count);
    }

    public long current(String key) {
        AtomicLong counter = counters.get(key);
        return counter == null ? 0 : counter.get();
    }
}
