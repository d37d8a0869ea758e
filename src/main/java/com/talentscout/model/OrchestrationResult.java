package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Collected, capped and deduplicated output of one orchestration. {@link #outcomes} keeps request order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class OrchestrationResult {
    public final List<CanonicalProfile> profiles;
    public final Map<String, SourceOutcome> outcomes;
    public final DeduplicationResult deduplication;
    public final int rawRecordCount;
    public final long totalTimeMs;
}
