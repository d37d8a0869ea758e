package com.talentscout.scoring;

import com.talentscout.config.Config;
import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.ScoreBreakdown;
import com.talentscout.model.SearchCriteria;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Five-component weighted score minus the weighted risk penalties, clamped to 0..100.
 */
public final class ScoringEngine {
    private static final int NO_TERMS_SKILL_SCORE = 50;
    private static final int EXPERIENCE_CAP = 90;
    private static final double MIN_YEARS = 1.0;
    private static final double MAX_YEARS = 15.0;

    private final Config config;
    private final RiskAssessor riskAssessor;
    private final Clock clock;

    public ScoringEngine(Config config) {
        this(config, Clock.systemUTC());
    }

    public ScoringEngine(Config config, Clock clock) {
        this.config = config;
        this.riskAssessor = new RiskAssessor(config);
        this.clock = clock;
    }

    public ScoreBreakdown score(CanonicalProfile profile, SearchCriteria criteria) {
        double wSkill = Math.max(0.0, config.getDouble("score.weight.skill_match", 40.0));
        double wExperience = Math.max(0.0, config.getDouble("score.weight.experience", 20.0));
        double wReputation = Math.max(0.0, config.getDouble("score.weight.reputation", 15.0));
        double wFreshness = Math.max(0.0, config.getDouble("score.weight.freshness", 10.0));
        double wSocial = Math.max(0.0, config.getDouble("score.weight.social_proof", 5.0));
        double wSum = wSkill + wExperience + wReputation + wFreshness + wSocial;
        if (wSum <= 0.0001) {
            wSum = 100.0;
        }

        Instant now = clock.instant();
        int skillMatch = scoreSkillMatch(profile.skills, criteria.terms());
        int experience = scoreExperience(profile.experienceYears, profile.repoCount);
        int reputation = scoreReputation(profile);
        int freshness = scoreFreshness(profile.lastActive, now);
        int socialProof = scoreSocialProof(profile);

        double weighted = round2((skillMatch * wSkill
                + experience * wExperience
                + reputation * wReputation
                + freshness * wFreshness
                + socialProof * wSocial) / wSum);

        RiskAssessment risk = riskAssessor.evaluate(profile, weighted, now);
        double finalScore = round2(clamp(weighted - risk.penalty, 0.0, 100.0));

        return ScoreBreakdown.builder()
                .skillMatch(skillMatch)
                .experience(experience)
                .reputation(reputation)
                .freshness(freshness)
                .socialProof(socialProof)
                .weightedTotal(weighted)
                .riskFlags(risk.flags)
                .riskPenalty(round2(risk.penalty))
                .finalScore(finalScore)
                .build();
    }

    /**
     * Share of criteria terms matched directly or through {@link SkillSynonyms}. Each term counts once.
     */
    int scoreSkillMatch(List<String> skills, List<String> terms) {
        if (terms.isEmpty()) {
            return NO_TERMS_SKILL_SCORE;
        }
        List<String> normalizedSkills = new ArrayList<>();
        for (String s : skills) {
            normalizedSkills.add(SkillSynonyms.normalize(s));
        }
        int matched = 0;
        for (String term : terms) {
            if (matchesAny(term, skills, normalizedSkills)) {
                matched++;
            }
        }
        return (int) Math.round(Math.min(100.0, matched * 100.0 / terms.size()));
    }

    int scoreExperience(double years, int repoCount) {
        double boundedYears = clamp(years, MIN_YEARS, MAX_YEARS);
        double volume = Math.min(25.0, Math.max(0, repoCount) * 0.5);
        return (int) Math.round(Math.min(EXPERIENCE_CAP, boundedYears * 5.0 + volume));
    }

    int scoreReputation(CanonicalProfile p) {
        double raw = p.followers * 2.0 + p.stars * 0.5 + p.reputationPoints / 50.0 + p.connections / 10.0;
        return (int) Math.round(Math.min(100.0, raw));
    }

    int scoreFreshness(Instant lastActive, Instant now) {
        if (lastActive == null) {
            return 20;
        }
        long days = Duration.between(lastActive, now).toDays();
        if (days < 7) {
            return 100;
        }
        if (days < 30) {
            return 80;
        }
        if (days < 90) {
            return 60;
        }
        if (days < 180) {
            return 40;
        }
        return 20;
    }

    int scoreSocialProof(CanonicalProfile p) {
        double raw = p.followers / 5.0 + p.forks / 2.0 + p.connections / 20.0;
        return (int) Math.round(Math.min(100.0, raw));
    }

    private boolean matchesAny(String term, List<String> skills, List<String> normalizedSkills) {
        String normalizedTerm = SkillSynonyms.normalize(term);
        if (normalizedTerm.isEmpty()) {
            return false;
        }
        for (int i = 0; i < skills.size(); i++) {
            String skill = skills.get(i);
            if (normalizedTerm.equals(normalizedSkills.get(i))
                    || tokens(skill).contains(normalizedTerm)
                    || tokens(term).contains(normalizedSkills.get(i))
                    || SkillSynonyms.related(term, skill)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        for (String part : text.split("[\\s/,()]+")) {
            String n = SkillSynonyms.normalize(part);
            if (!n.isEmpty()) {
                out.add(n);
            }
        }
        return out;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
