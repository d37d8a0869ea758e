package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PerformanceMetrics {
    public final long totalTimeMs;
    /** Percentage of requested sources that finished without error. */
    public final double successRate;
    public final Map<String, Long> perSourceTimeMs;
    public final double averageTimePerSource;
    public final double timeoutRate;
    public final double candidatesPerSuccessfulSource;
}
