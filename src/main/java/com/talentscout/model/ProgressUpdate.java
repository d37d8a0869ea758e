package com.talentscout.model;

/**
 * Coarse phase transition emitted on the progress channel.
 */
public record ProgressUpdate(
        String phase,
        String detail,
        int completedSources,
        int totalSources,
        int candidatesFound,
        long elapsedMs,
        long remainingMs
) {
    public static final String VALIDATING = "validating";
    public static final String COLLECTING = "collecting";
    public static final String SOURCE_COMPLETED = "source_completed";
    public static final String DEDUPLICATING = "deduplicating";
    public static final String SCORING = "scoring";
    public static final String ASSEMBLING = "assembling";
    public static final String COMPLETE = "complete";
}
