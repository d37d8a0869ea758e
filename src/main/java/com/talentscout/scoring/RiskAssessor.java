package com.talentscout.scoring;

import com.talentscout.config.Config;
import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.RiskFlag;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Weighted risk table: each raised flag subtracts its own penalty from the weighted total.
 */
public final class RiskAssessor {
    private static final long INACTIVE_DAYS = 730L;
    private static final int MIN_SKILLS = 3;
    private static final int MIN_SUMMARY_CHARS = 50;
    private static final double LOW_SCORE_THRESHOLD = 30.0;

    private final Config config;

    public RiskAssessor(Config config) {
        this.config = config;
    }

    public RiskAssessment evaluate(CanonicalProfile profile, double weightedTotal, Instant now) {
        List<RiskFlag> flags = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        if (profile.lastActive != null && Duration.between(profile.lastActive, now).toDays() > INACTIVE_DAYS) {
            flags.add(RiskFlag.INACTIVE);
            reasons.add("last activity " + Duration.between(profile.lastActive, now).toDays() + " days ago");
        }
        if (profile.skills.size() < MIN_SKILLS) {
            flags.add(RiskFlag.FEW_SKILLS);
            reasons.add("only " + profile.skills.size() + " skills listed");
        }
        if (profile.summary.length() < MIN_SUMMARY_CHARS) {
            flags.add(RiskFlag.SHORT_SUMMARY);
            reasons.add("summary has " + profile.summary.length() + " chars");
        }
        // Zero means the platform gave no estimate.
        if (profile.experienceYears > 0.0 && profile.experienceYears < 1.0) {
            flags.add(RiskFlag.LIMITED_EXPERIENCE);
            reasons.add(String.format(Locale.US, "%.1f years of experience", profile.experienceYears));
        }
        if (profile.location.isBlank()) {
            flags.add(RiskFlag.NO_LOCATION);
            reasons.add("no location");
        }
        if (weightedTotal < LOW_SCORE_THRESHOLD) {
            flags.add(RiskFlag.LOW_SCORE);
            reasons.add(String.format(Locale.US, "weighted total %.2f below %.0f", weightedTotal, LOW_SCORE_THRESHOLD));
        }

        double penalty = 0.0;
        for (RiskFlag flag : flags) {
            penalty += penaltyFor(flag);
        }
        return new RiskAssessment(flags, penalty, reasons);
    }

    public double penaltyFor(RiskFlag flag) {
        return Math.max(0.0, config.getDouble(flag.penaltyKey(), flag.defaultPenalty()));
    }
}
