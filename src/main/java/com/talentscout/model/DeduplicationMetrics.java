package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Summary of one deduplication pass. {@code deduplicatedCount + duplicatesRemoved == originalCount} always holds.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeduplicationMetrics {
    public final int originalCount;
    public final int deduplicatedCount;
    public final int duplicatesRemoved;
    public final int mergeDecisions;
    public final double deduplicationRate;

    public static DeduplicationMetrics of(int originalCount, int deduplicatedCount, int mergeDecisions) {
        int original = Math.max(0, originalCount);
        int deduplicated = Math.min(original, Math.max(0, deduplicatedCount));
        int removed = original - deduplicated;
        double rate = original == 0 ? 0.0 : Math.round(removed * 10000.0 / original) / 100.0;
        return new DeduplicationMetrics(original, deduplicated, removed, Math.max(0, mergeDecisions), rate);
    }

    public static DeduplicationMetrics empty() {
        return of(0, 0, 0);
    }
}
