package com.eainde.boardingpass.quota;

/**
 * Shared usage counter with a hard limit per key. Implementations must check and increment
 * atomically, so concurrent callers never both see the last free slot.
 */
public interface UsageQuotaCounter {

    QuotaDecision checkAndIncrement(String key);
}
