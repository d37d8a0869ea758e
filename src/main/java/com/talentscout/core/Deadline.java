package com.talentscout.core;

import java.time.Duration;

/**
 * A fixed point in monotonic time shared by every task of one orchestration run.
 * Immutable and safe to hand to concurrent collectors.
 */
public final class Deadline {
    private final long deadlineNanos;
    private final long budgetMs;

    private Deadline(long deadlineNanos, long budgetMs) {
        this.deadlineNanos = deadlineNanos;
        this.budgetMs = budgetMs;
    }

    public static Deadline after(Duration budget) {
        long ms = budget == null ? 0L : Math.max(0L, budget.toMillis());
        return new Deadline(System.nanoTime() + ms * 1_000_000L, ms);
    }

    public static Deadline afterSeconds(int seconds) {
        return after(Duration.ofSeconds(Math.max(0, seconds)));
    }

    /**
     * A deadline that has already passed.
     */
    public static Deadline expired() {
        return new Deadline(System.nanoTime() - 1L, 0L);
    }

    public long budgetMs() {
        return budgetMs;
    }

    public long remainingMs() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0L ? 0L : left / 1_000_000L;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0L;
    }

    public boolean hasAtLeast(long millis) {
        return remainingMs() >= Math.max(0L, millis);
    }

    /**
     * Timeout for one outbound call: the configured cap, shortened to what is left of the budget.
     */
    public Duration boundedTimeout(Duration cap) {
        long capMs = cap == null ? Long.MAX_VALUE : cap.toMillis();
        return Duration.ofMillis(Math.max(1L, Math.min(capMs, remainingMs())));
    }

    @Override
    public String toString() {
        return "Deadline{budgetMs=" + budgetMs + ", remainingMs=" + remainingMs() + "}";
    }
}
