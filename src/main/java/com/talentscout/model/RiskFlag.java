package com.talentscout.model;

/**
 * Data-quality or suitability concerns. Each carries a default penalty; the scoring config may override it.
 */
public enum RiskFlag {
    INACTIVE("inactive", "Inactive for >2 years", "risk.penalty.inactive", 15.0),
    FEW_SKILLS("few_skills", "Incomplete skill information", "risk.penalty.few_skills", 10.0),
    SHORT_SUMMARY("short_summary", "Minimal profile description", "risk.penalty.short_summary", 8.0),
    LIMITED_EXPERIENCE("limited_experience", "Limited experience", "risk.penalty.limited_experience", 12.0),
    NO_LOCATION("no_location", "Location not specified", "risk.penalty.no_location", 5.0),
    LOW_SCORE("low_score", "Low overall score", "risk.penalty.low_score", 20.0);

    private final String code;
    private final String label;
    private final String penaltyKey;
    private final double defaultPenalty;

    RiskFlag(String code, String label, String penaltyKey, double defaultPenalty) {
        this.code = code;
        this.label = label;
        this.penaltyKey = penaltyKey;
        this.defaultPenalty = defaultPenalty;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public String penaltyKey() {
        return penaltyKey;
    }

    public double defaultPenalty() {
        return defaultPenalty;
    }
}
