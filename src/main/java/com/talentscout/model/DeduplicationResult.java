package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class DeduplicationResult {
    public final List<CanonicalProfile> profiles;
    public final DeduplicationMetrics metrics;
    public final List<MergeDecision> decisions;

    public static DeduplicationResult empty() {
        return new DeduplicationResult(List.of(), DeduplicationMetrics.empty(), List.of());
    }
}
