package com.talentscout.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-source result. Present for every requested source; {@link #error} is empty on success.
 * A rate-limited source is a partial success: records are kept and no error is set.
 */
@Value
public final class SourceOutcome {
    public static final String TIMEOUT_ERROR = "timeout";

    public final String source;
    public final List<RawCandidateRecord> records;
    public final int totalFound;
    public final String error;
    public final SourceFailureReason failureReason;
    public final long elapsedMs;
    public final boolean rateLimited;

    @Builder(toBuilder = true)
    public SourceOutcome(
            String source,
            List<RawCandidateRecord> records,
            int totalFound,
            String error,
            SourceFailureReason failureReason,
            long elapsedMs,
            boolean rateLimited
    ) {
        this.source = source == null ? "" : source;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.totalFound = Math.max(totalFound, this.records.size());
        this.error = error == null ? "" : error;
        this.failureReason = failureReason == null
                ? (this.error.isEmpty() ? SourceFailureReason.NONE : SourceFailureReason.OTHER)
                : failureReason;
        this.elapsedMs = Math.max(0L, elapsedMs);
        this.rateLimited = rateLimited;
    }

    public static SourceOutcome success(String source, List<RawCandidateRecord> records, long elapsedMs, boolean rateLimited) {
        return new SourceOutcome(source, records, records == null ? 0 : records.size(), "",
                SourceFailureReason.NONE, elapsedMs, rateLimited);
    }

    public static SourceOutcome failure(
            String source,
            SourceFailureReason reason,
            String error,
            List<RawCandidateRecord> partial,
            long elapsedMs
    ) {
        String message = error == null || error.isBlank() ? reason.label() : error;
        return new SourceOutcome(source, partial, partial == null ? 0 : partial.size(), message, reason, elapsedMs, false);
    }

    public static SourceOutcome timeout(String source, long elapsedMs) {
        return new SourceOutcome(source, List.of(), 0, TIMEOUT_ERROR, SourceFailureReason.TIMEOUT, elapsedMs, false);
    }

    public boolean hasError() {
        return !error.isEmpty();
    }
}
