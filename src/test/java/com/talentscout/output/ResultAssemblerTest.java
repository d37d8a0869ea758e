package com.talentscout.output;

import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.DeduplicationMetrics;
import com.talentscout.model.DeduplicationResult;
import com.talentscout.model.EmailConfidence;
import com.talentscout.model.OrchestrationResult;
import com.talentscout.model.PipelineResult;
import com.talentscout.model.QualitySummary;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.ScoreBreakdown;
import com.talentscout.model.ScoredProfile;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;
import com.talentscout.model.SourceReference;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultAssemblerTest {
    private final ResultAssembler assembler = new ResultAssembler();

    @Test
    void assemble_shouldRankByFinalThenWeightedThenId() {
        List<ScoredProfile> scored = List.of(
                scored("github:c", 70.0, 80.0),
                scored("github:b", 70.0, 80.0),
                scored("github:a", 70.0, 75.0),
                scored("github:d", 90.0, 60.0)
        );

        PipelineResult result = assembler.assemble(criteria(10), orchestration(outcomes(ok("github", 4))), scored, 1200L);

        assertEquals(List.of("github:d", "github:b", "github:c", "github:a"), ids(result.candidates));
    }

    @Test
    void assemble_shouldTruncateToLimit() {
        List<ScoredProfile> scored = List.of(
                scored("x:1", 10.0, 10.0),
                scored("x:2", 30.0, 30.0),
                scored("x:3", 20.0, 20.0)
        );

        PipelineResult result = assembler.assemble(criteria(2), orchestration(outcomes(ok("github", 3))), scored, 5L);

        assertEquals(List.of("x:2", "x:3"), ids(result.candidates));
    }

    @Test
    void partialFailureShouldDegradeGracefully() {
        Map<String, SourceOutcome> outcomes = outcomes(
                ok("github", 3),
                SourceOutcome.timeout("linkedin", 60_000L),
                SourceOutcome.failure("google", SourceFailureReason.NOT_CONFIGURED, "missing key", null, 0L),
                ok("stackoverflow", 1)
        );

        PipelineResult result = assembler.assemble(criteria(10), orchestration(outcomes), List.of(), 61_000L);

        assertEquals(2, result.errors.size());
        assertEquals("linkedin", result.errors.get(0).source());
        assertEquals(SourceFailureReason.TIMEOUT, result.errors.get(0).reason());
        assertEquals(50.0, result.performance.successRate, 1e-9);
        assertEquals(25.0, result.performance.timeoutRate, 1e-9);
        assertEquals(2.0, result.performance.candidatesPerSuccessfulSource, 1e-9);
        assertEquals(60_000L, result.performance.perSourceTimeMs.get("linkedin"));
        assertEquals(50.0, result.quality.completionRate, 1e-9);
        assertTrue(result.quality.gracefulDegradation);
        assertFalse(result.quality.degraded);
        assertEquals("", result.quality.degradedReason);
    }

    @Test
    void allSourcesFailingWithNoRecordsShouldBeDegraded() {
        Map<String, SourceOutcome> outcomes = outcomes(
                SourceOutcome.timeout("github", 5L),
                SourceOutcome.timeout("devto", 5L)
        );

        QualitySummary quality = assembler.assemble(criteria(10), orchestration(outcomes), List.of(), 10L).quality;

        assertTrue(quality.degraded);
        assertEquals(QualitySummary.ALL_SOURCES_FAILED, quality.degradedReason);
        assertFalse(quality.gracefulDegradation);
        assertEquals(0.0, quality.completionRate, 1e-9);
    }

    @Test
    void failedSourcesThatStillReturnedRecordsAreNotDegraded() {
        RawCandidateRecord partial = RawCandidateRecord.builder().platform("github").platformId("p").build();
        Map<String, SourceOutcome> outcomes = outcomes(
                SourceOutcome.failure("github", SourceFailureReason.HTTP_ERROR, "HTTP 502", List.of(partial), 40L)
        );

        QualitySummary quality = assembler.assemble(criteria(10),
                new OrchestrationResult(List.of(), outcomes, DeduplicationResult.empty(), 1, 40L), List.of(), 40L).quality;

        assertFalse(quality.degraded);
        assertFalse(quality.gracefulDegradation);
        assertEquals(1, quality.failedSources.size());
    }

    static ScoredProfile scored(String id, double finalScore, double weightedTotal) {
        String[] parts = id.split(":", 2);
        CanonicalProfile profile = CanonicalProfile.builder()
                .id(id)
                .name("Person " + parts[1])
                .sources(List.of(new SourceReference(parts[0], parts[1], "https://example.com/" + parts[1])))
                .build();
        ScoreBreakdown score = ScoreBreakdown.builder()
                .skillMatch(50)
                .experience(50)
                .reputation(50)
                .freshness(50)
                .socialProof(50)
                .weightedTotal(weightedTotal)
                .riskFlags(List.of())
                .riskPenalty(0.0)
                .finalScore(finalScore)
                .build();
        return new ScoredProfile(profile, score, new EmailConfidence(0, EmailConfidence.Level.LOW, EmailConfidence.Type.GENERIC));
    }

    static SearchCriteria criteria(int limit) {
        return SearchCriteria.builder()
                .query("developer")
                .sources(List.of("github"))
                .timeBudgetSeconds(60)
                .limit(limit)
                .build();
    }

    static SourceOutcome ok(String source, int records) {
        List<RawCandidateRecord> out = new ArrayList<>();
        for (int i = 0; i < records; i++) {
            out.add(RawCandidateRecord.builder().platform(source).platformId(source + i).build());
        }
        return SourceOutcome.success(source, out, 100L, false);
    }

    static Map<String, SourceOutcome> outcomes(SourceOutcome... outcomes) {
        Map<String, SourceOutcome> out = new LinkedHashMap<>();
        for (SourceOutcome o : outcomes) {
            out.put(o.source, o);
        }
        return out;
    }

    static OrchestrationResult orchestration(Map<String, SourceOutcome> outcomes) {
        int raw = 0;
        for (SourceOutcome o : outcomes.values()) {
            raw += o.records.size();
        }
        DeduplicationResult dedup = new DeduplicationResult(List.of(), DeduplicationMetrics.of(raw, raw, 0), List.of());
        return new OrchestrationResult(List.of(), outcomes, dedup, raw, 100L);
    }

    private static List<String> ids(List<ScoredProfile> profiles) {
        List<String> out = new ArrayList<>();
        for (ScoredProfile sp : profiles) {
            out.add(sp.profile.id);
        }
        return out;
    }
}
