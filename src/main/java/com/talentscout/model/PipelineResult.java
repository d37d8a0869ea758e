package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineResult {
    public final SearchCriteria criteria;
    public final List<ScoredProfile> candidates;
    public final Map<String, SourceOutcome> results;
    public final DeduplicationMetrics deduplicationMetrics;
    public final PerformanceMetrics performance;
    public final QualitySummary quality;
    public final List<SourceError> errors;
}
