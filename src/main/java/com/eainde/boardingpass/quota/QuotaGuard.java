package com.eainde.boardingpass.quota;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.YearMonth;

/**
 * Monthly hard cap on AI extraction calls. The counter enforces the cap; its key embeds the month,
 * so usage resets when the month rolls over. Admins are alerted once when usage reaches the warning threshold and once
 * when the cap is first exceeded.
 */
@Slf4j
public class QuotaGuard {

    static final String KEY_PREFIX = "ai-extraction:usage:";

    private final UsageQuotaCounter counter;
    private final AdminNotifier notifier;
    private final Clock clock;
    private final long monthlyLimit;
    private final long warningThreshold;

    public QuotaGuard(UsageQuotaCounter counter, AdminNotifier notifier, Clock clock,
                      long monthlyLimit, long warningThreshold) {
        if (monthlyLimit < 1 || warningThreshold < 1 || warningThreshold > monthlyLimit) {
            throw new IllegalArgumentException("Require 1 <= warningThreshold <= monthlyLimit");
        }
        this.counter = counter;
        this.notifier = notifier;
        this.clock = clock;
        this.monthlyLimit = monthlyLimit;
        this.warningThreshold = warningThreshold;
    }

    public QuotaDecision tryAcquire() {
        String key = currentKey();
        QuotaDecision decision = counter.checkAndIncrement(key);
        long count = decision.currentCount();
        if (count == warningThreshold) {
            log.warn("AI extraction usage reached {} of {} for {}", count, monthlyLimit, key);
            alert("AI extraction usage warning",
                    "Usage reached " + count + " of " + monthlyLimit + " AI extractions this month (" + key + ").");
        }
        if (!decision.allowed() && count == monthlyLimit + 1) {
            log.warn("AI extraction monthly cap of {} exceeded for {}", monthlyLimit, key);
            alert("AI extraction quota exceeded",
                    "The monthly cap of " + monthlyLimit + " AI extractions is exhausted (" + key
                            + "). Requests fall back to OCR until the month rolls over.");
        }
        return decision;
    }

    public String currentKey() {
        return KEY_PREFIX + YearMonth.now(clock);
    }

    private void alert(String subject, String message) {
        try {
            notifier.sendAlert(subject, message);
        } catch (RuntimeException e) {
            log.error("Admin notification '{}' failed", subject, e);
        }
    }
}
