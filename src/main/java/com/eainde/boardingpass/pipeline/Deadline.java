package com.eainde.boardingpass.pipeline;

import java.time.Duration;

/**
 * Monotonic point in time bounding one extraction call. Strategies take the smaller of their own
 * budget and the time left.
 */
public final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public Duration budget(Duration strategyBudget) {
        Duration remaining = remaining();
        return strategyBudget.compareTo(remaining) < 0 ? strategyBudget : remaining;
    }
}
