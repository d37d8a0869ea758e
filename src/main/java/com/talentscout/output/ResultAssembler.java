package com.talentscout.output;

import com.talentscout.model.OrchestrationResult;
import com.talentscout.model.PerformanceMetrics;
import com.talentscout.model.PipelineResult;
import com.talentscout.model.QualitySummary;
import com.talentscout.model.ScoredProfile;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceError;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorts, truncates and packages scored profiles together with per-source outcomes and run metrics.
 */
public final class ResultAssembler {

    static final Comparator<ScoredProfile> RANKING = Comparator
            .comparingDouble((ScoredProfile sp) -> sp.score.finalScore).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredProfile sp) -> sp.score.weightedTotal).reversed())
            .thenComparing(sp -> sp.profile.id);

    /**
     * @param criteria resolved criteria; {@code limit} caps the candidate list
     * @param totalTimeMs wall time of the whole run, assembly excluded
     */
    public PipelineResult assemble(
            SearchCriteria criteria,
            OrchestrationResult orchestration,
            List<ScoredProfile> scored,
            long totalTimeMs
    ) {
        List<ScoredProfile> ranked = new ArrayList<>(scored == null ? List.of() : scored);
        ranked.sort(RANKING);
        if (criteria.limit > 0 && ranked.size() > criteria.limit) {
            ranked = ranked.subList(0, criteria.limit);
        }

        Map<String, SourceOutcome> outcomes = orchestration.outcomes;
        List<SourceError> errors = new ArrayList<>();
        for (SourceOutcome outcome : outcomes.values()) {
            if (outcome.hasError()) {
                errors.add(new SourceError(outcome.source, outcome.error, outcome.failureReason));
            }
        }

        return PipelineResult.builder()
                .criteria(criteria)
                .candidates(List.copyOf(ranked))
                .results(outcomes)
                .deduplicationMetrics(orchestration.deduplication.metrics)
                .performance(performance(outcomes, totalTimeMs))
                .quality(quality(outcomes, errors, orchestration.rawRecordCount))
                .errors(List.copyOf(errors))
                .build();
    }

    PerformanceMetrics performance(Map<String, SourceOutcome> outcomes, long totalTimeMs) {
        int requested = outcomes.size();
        int succeeded = 0;
        int timedOut = 0;
        long elapsedSum = 0L;
        long successfulRecords = 0L;
        Map<String, Long> perSource = new LinkedHashMap<>();
        for (SourceOutcome outcome : outcomes.values()) {
            perSource.put(outcome.source, outcome.elapsedMs);
            elapsedSum += outcome.elapsedMs;
            if (!outcome.hasError()) {
                succeeded++;
                successfulRecords += outcome.records.size();
            }
            if (outcome.failureReason == SourceFailureReason.TIMEOUT) {
                timedOut++;
            }
        }
        return PerformanceMetrics.builder()
                .totalTimeMs(Math.max(0L, totalTimeMs))
                .successRate(percent(succeeded, requested))
                .perSourceTimeMs(perSource)
                .averageTimePerSource(requested == 0 ? 0.0 : round2((double) elapsedSum / requested))
                .timeoutRate(percent(timedOut, requested))
                .candidatesPerSuccessfulSource(succeeded == 0 ? 0.0 : round2((double) successfulRecords / succeeded))
                .build();
    }

    QualitySummary quality(Map<String, SourceOutcome> outcomes, List<SourceError> errors, int rawRecordCount) {
        int requested = outcomes.size();
        int failed = errors.size();
        boolean allFailed = requested > 0 && failed == requested;
        boolean degraded = allFailed && rawRecordCount == 0;
        return QualitySummary.builder()
                .completionRate(percent(requested - failed, requested))
                .gracefulDegradation(failed > 0 && failed < requested)
                .failedSources(List.copyOf(errors))
                .degraded(degraded)
                .degradedReason(degraded ? QualitySummary.ALL_SOURCES_FAILED : "")
                .build();
    }

    private static double percent(int part, int whole) {
        return whole == 0 ? 0.0 : round2(part * 100.0 / whole);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
