package com.eainde.boardingpass.quota;

/**
 * @param currentCount usage count for the key after this request was counted
 */
public record QuotaDecision(boolean allowed, long currentCount) {
}
