package com.talentscout.pipeline;

import com.talentscout.collect.SourceCollector;
import com.talentscout.collect.SourceCollectors;
import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.core.RunTelemetry;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.dedup.DeduplicationEngine;
import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.OrchestrationResult;
import com.talentscout.model.PipelineResult;
import com.talentscout.model.ProgressUpdate;
import com.talentscout.model.ScoredProfile;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceOutcome;
import com.talentscout.orchestrator.CollectionOrchestrator;
import com.talentscout.orchestrator.CriteriaValidator;
import com.talentscout.orchestrator.ProgressListener;
import com.talentscout.output.JsonLinesProfileSink;
import com.talentscout.output.ProfileSink;
import com.talentscout.output.ResultAssembler;
import com.talentscout.scoring.EmailConfidenceClassifier;
import com.talentscout.scoring.ScoringEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One end-to-end sourcing run: validate, collect and deduplicate, score, assemble, then hand off to the sink.
 * <p>
 * Only criteria validation throws. Every source failure ends up in the result instead.
 */
public final class CandidatePipeline {
    private static final Logger LOG = LogManager.getLogger(CandidatePipeline.class);

    private final CriteriaValidator validator;
    private final CollectionOrchestrator orchestrator;
    private final ScoringEngine scoringEngine;
    private final EmailConfidenceClassifier emailClassifier;
    private final ResultAssembler assembler;
    private final ProfileSink sink;
    private final ProgressListener progress;

    public CandidatePipeline(
            Config config,
            Map<String, SourceCollector> collectors,
            ScoringEngine scoringEngine,
            ProfileSink sink,
            ProgressListener progress
    ) {
        this.progress = progress == null ? ProgressListener.NOOP : progress;
        this.validator = new CriteriaValidator(config);
        this.orchestrator = new CollectionOrchestrator(config, collectors, new DeduplicationEngine(config), this.progress);
        this.scoringEngine = scoringEngine;
        this.emailClassifier = new EmailConfidenceClassifier();
        this.assembler = new ResultAssembler();
        this.sink = sink;
    }

    /**
     * Wires the default collectors over one shared HTTP client.
     *
     * @param withSink persist returned candidates under {@code <outputs.dir>/profiles}
     */
    public static CandidatePipeline create(Config config, ProgressListener progress, boolean withSink) {
        HttpClientEx http = new HttpClientEx();
        ProfileSink sink = withSink ? new JsonLinesProfileSink(config.getPath("outputs.dir").resolve("profiles")) : null;
        return new CandidatePipeline(config, SourceCollectors.defaults(config, http), new ScoringEngine(config), sink, progress);
    }

    public PipelineResult run(SearchCriteria criteria) {
        RunTelemetry telemetry = new RunTelemetry(UUID.randomUUID().toString().substring(0, 8), "search", Instant.now());
        long startedNanos = System.nanoTime();

        telemetry.startStep(RunTelemetry.STEP_VALIDATE);
        emit(ProgressUpdate.VALIDATING, 0, 0, 0, startedNanos, null);
        SearchCriteria resolved;
        try {
            resolved = validator.resolve(criteria);
        } finally {
            telemetry.endStep(RunTelemetry.STEP_VALIDATE, 1, 1, 0);
        }
        Deadline deadline = Deadline.afterSeconds(resolved.timeBudgetSeconds);
        LOG.info("run {} query=\"{}\" sources={} budget_sec={} limit={}",
                telemetry.runId(), resolved.query, resolved.sources, resolved.timeBudgetSeconds, resolved.limit);

        telemetry.startStep(RunTelemetry.STEP_COLLECT);
        OrchestrationResult orchestration = orchestrator.orchestrate(resolved, deadline);
        int failedSources = 0;
        for (SourceOutcome outcome : orchestration.outcomes.values()) {
            telemetry.recordSource(outcome.source, outcome.elapsedMs, outcome.records.size(),
                    outcome.hasError() ? outcome.failureReason.label() : "ok");
            if (outcome.hasError()) {
                failedSources++;
            }
        }
        telemetry.endStep(RunTelemetry.STEP_COLLECT, orchestration.rawRecordCount, orchestration.profiles.size(),
                failedSources, "merges=" + orchestration.deduplication.metrics.mergeDecisions);

        int sourceCount = orchestration.outcomes.size();
        telemetry.startStep(RunTelemetry.STEP_SCORE);
        emit(ProgressUpdate.SCORING, sourceCount, sourceCount, orchestration.profiles.size(), startedNanos, deadline);
        List<ScoredProfile> scored = new ArrayList<>(orchestration.profiles.size());
        for (CanonicalProfile profile : orchestration.profiles) {
            scored.add(new ScoredProfile(
                    profile,
                    scoringEngine.score(profile, resolved),
                    emailClassifier.classify(profile.email, profile.primaryPlatform(), profile.name)
            ));
        }
        telemetry.endStep(RunTelemetry.STEP_SCORE, orchestration.profiles.size(), scored.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_ASSEMBLE);
        emit(ProgressUpdate.ASSEMBLING, sourceCount, sourceCount, scored.size(), startedNanos, deadline);
        PipelineResult result = assembler.assemble(resolved, orchestration, scored, elapsedMs(startedNanos));
        telemetry.endStep(RunTelemetry.STEP_ASSEMBLE, scored.size(), result.candidates.size(), 0,
                result.quality.degraded ? result.quality.degradedReason : "");

        if (sink != null && !result.candidates.isEmpty()) {
            telemetry.startStep(RunTelemetry.STEP_SINK);
            long errors = 0;
            int written = 0;
            try {
                written = sink.upsert(result.candidates);
            } catch (IOException e) {
                errors = 1;
                LOG.warn("profile sink failed err={}", e.getMessage());
            }
            telemetry.endStep(RunTelemetry.STEP_SINK, result.candidates.size(), written, errors);
        }

        telemetry.setCounts(orchestration.rawRecordCount, orchestration.profiles.size(), result.candidates.size());
        telemetry.finish();
        emit(ProgressUpdate.COMPLETE, sourceCount, sourceCount, result.candidates.size(), startedNanos, deadline);
        if (result.quality.degraded) {
            LOG.warn("run {} degraded reason={}", telemetry.runId(), result.quality.degradedReason);
        }
        LOG.info("\n{}", telemetry.getSummary());
        return result;
    }

    private void emit(String phase, int completed, int total, int candidates, long startedNanos, Deadline deadline) {
        try {
            progress.onProgress(new ProgressUpdate(phase, "", completed, total, candidates,
                    elapsedMs(startedNanos), deadline == null ? 0L : deadline.remainingMs()));
        } catch (RuntimeException e) {
            LOG.warn("progress listener failed phase={} err={}", phase, e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }
}
