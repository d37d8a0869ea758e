package com.talentscout.model;

/**
 * One fold of a record into a group. {@code confidence} is the similarity that justified it (1.0 for exact keys).
 */
public record MergeDecision(String survivorKey, String mergedKey, String reason, double confidence) {
    public static final String SHARED_IDENTIFIER = "shared_identifier";
    public static final String NAME_LOCATION = "name_location";
    public static final String FUZZY_MATCH = "fuzzy_match";
}
