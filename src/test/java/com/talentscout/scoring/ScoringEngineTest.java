package com.talentscout.scoring;

import com.talentscout.config.Config;
import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.RiskFlag;
import com.talentscout.model.ScoreBreakdown;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceReference;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringEngineTest {
    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");
    private static final String LONG_SUMMARY = "Frontend engineer building React and Node.js products for fintech teams since 2019.";

    private final ScoringEngine engine = new ScoringEngine(
            Config.fromMap(Path.of("."), Map.of()),
            Clock.fixed(NOW, ZoneOffset.UTC)
    );

    @Test
    void score_shouldWeightComponentsAndStayWithinRange() {
        CanonicalProfile profile = profile()
                .skills(List.of("React", "Node.js", "JavaScript"))
                .summary(LONG_SUMMARY)
                .location("Berlin, Germany")
                .lastActive(NOW.minus(Duration.ofDays(3)))
                .experienceYears(6)
                .repoCount(40)
                .followers(120)
                .stars(300)
                .forks(60)
                .build();
        SearchCriteria criteria = SearchCriteria.builder()
                .query("react developer")
                .skills(List.of("React", "Node.js"))
                .build();

        ScoreBreakdown score = engine.score(profile, criteria);

        assertEquals(100, score.skillMatch);
        assertEquals(50, score.experience);
        assertEquals(100, score.reputation);
        assertEquals(100, score.freshness);
        assertEquals(54, score.socialProof);
        assertEquals(86.33, score.weightedTotal, 1e-9);
        assertTrue(score.riskFlags.isEmpty());
        assertEquals(86.33, score.finalScore, 1e-9);
    }

    @Test
    void score_shouldRaiseEveryFlagAndClampAtZero() {
        CanonicalProfile profile = profile()
                .lastActive(NOW.minus(Duration.ofDays(3 * 365)))
                .experienceYears(0.5)
                .build();
        SearchCriteria criteria = SearchCriteria.builder().query("rust").skills(List.of("Rust")).build();

        ScoreBreakdown score = engine.score(profile, criteria);

        assertEquals(List.of(RiskFlag.INACTIVE, RiskFlag.FEW_SKILLS, RiskFlag.SHORT_SUMMARY,
                RiskFlag.LIMITED_EXPERIENCE, RiskFlag.NO_LOCATION, RiskFlag.LOW_SCORE), score.riskFlags);
        assertEquals(70.0, score.riskPenalty, 1e-9);
        assertEquals(3.33, score.weightedTotal, 1e-9);
        assertEquals(0.0, score.finalScore, 1e-9);
    }

    @Test
    void skillMatch_shouldUseSynonymsAndNeutralScoreWithoutTerms() {
        assertEquals(50, engine.scoreSkillMatch(List.of("Go"), List.of()));
        assertEquals(100, engine.scoreSkillMatch(List.of("TensorFlow"), List.of("machine learning")));
        assertEquals(50, engine.scoreSkillMatch(List.of("Django"), List.of("python", "kubernetes")));
        assertEquals(0, engine.scoreSkillMatch(List.of(), List.of("python")));
    }

    @Test
    void freshness_shouldStepDownWithAge() {
        assertEquals(100, engine.scoreFreshness(NOW.minus(Duration.ofDays(6)), NOW));
        assertEquals(80, engine.scoreFreshness(NOW.minus(Duration.ofDays(20)), NOW));
        assertEquals(60, engine.scoreFreshness(NOW.minus(Duration.ofDays(60)), NOW));
        assertEquals(40, engine.scoreFreshness(NOW.minus(Duration.ofDays(120)), NOW));
        assertEquals(20, engine.scoreFreshness(NOW.minus(Duration.ofDays(400)), NOW));
        assertEquals(20, engine.scoreFreshness(null, NOW));
    }

    @Test
    void experience_shouldClampYearsAndCapTotal() {
        assertEquals(5, engine.scoreExperience(0.0, 0));
        assertEquals(90, engine.scoreExperience(30.0, 500));
        assertEquals(35, engine.scoreExperience(5.0, 20));
    }

    @Test
    void penaltiesShouldFollowConfig() {
        ScoringEngine strict = new ScoringEngine(
                Config.fromMap(Path.of("."), Map.of("risk", Map.of("penalty", Map.of("no_location", 25)))),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        CanonicalProfile profile = profile()
                .skills(List.of("Java", "Spring", "Kafka"))
                .summary(LONG_SUMMARY)
                .lastActive(NOW)
                .experienceYears(8)
                .repoCount(50)
                .followers(80)
                .build();

        ScoreBreakdown score = strict.score(profile, SearchCriteria.builder().query("java").skills(List.of("Java")).build());

        assertEquals(List.of(RiskFlag.NO_LOCATION), score.riskFlags);
        assertEquals(25.0, score.riskPenalty, 1e-9);
        assertEquals(Math.round((score.weightedTotal - 25.0) * 100.0) / 100.0, score.finalScore, 1e-9);
    }

    private static CanonicalProfile.CanonicalProfileBuilder profile() {
        return CanonicalProfile.builder()
                .id("github:dev")
                .name("Dev Person")
                .sources(List.of(new SourceReference("github", "dev", "https://github.com/dev")));
    }
}
