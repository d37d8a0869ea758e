package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the caller needs to tell "no matches" from "nothing worked".
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class QualitySummary {
    public static final String ALL_SOURCES_FAILED = "all_sources_failed";

    public final double completionRate;
    public final boolean gracefulDegradation;
    public final List<SourceError> failedSources;
    public final boolean degraded;
    public final String degradedReason;
}
