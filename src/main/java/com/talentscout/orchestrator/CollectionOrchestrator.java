package com.talentscout.orchestrator;

import com.talentscout.collect.SourceCollector;
import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.dedup.DeduplicationEngine;
import com.talentscout.model.DeduplicationResult;
import com.talentscout.model.OrchestrationResult;
import com.talentscout.model.ProgressUpdate;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every requested collector in parallel against one shared deadline.
 * <p>
 * The wait is bounded by the deadline: a collector that has not answered by then is cancelled and
 * reported as {@code "timeout"}, while collectors that finished keep their records. The outcome map
 * always has exactly one entry per requested source, in request order.
 */
public final class CollectionOrchestrator {
    private static final Logger LOG = LogManager.getLogger(CollectionOrchestrator.class);

    private final Map<String, SourceCollector> collectors;
    private final DeduplicationEngine deduplicationEngine;
    private final CriteriaValidator validator;
    private final ProgressListener progress;
    private final int maxSources;
    private final int maxRecordsPerSource;

    public CollectionOrchestrator(
            Config config,
            Map<String, SourceCollector> collectors,
            DeduplicationEngine deduplicationEngine,
            ProgressListener progress
    ) {
        this.collectors = Map.copyOf(collectors);
        this.deduplicationEngine = deduplicationEngine;
        this.validator = new CriteriaValidator(config);
        this.progress = progress == null ? ProgressListener.NOOP : progress;
        this.maxSources = Math.max(1, config.getInt("orchestrator.max_sources", 4));
        this.maxRecordsPerSource = Math.max(1, config.getInt("orchestrator.max_records_per_source", 20));
    }

    public OrchestrationResult orchestrate(SearchCriteria criteria) {
        SearchCriteria resolved = validator.resolve(criteria);
        return orchestrate(resolved, Deadline.afterSeconds(resolved.timeBudgetSeconds));
    }

    /**
     * Orchestrates against an explicit deadline. Criteria must already be resolved.
     */
    public OrchestrationResult orchestrate(SearchCriteria criteria, Deadline deadline) {
        long startedNanos = System.nanoTime();
        List<String> requested = criteria.sources == null ? List.of() : criteria.sources;

        Map<String, SourceOutcome> settled = new HashMap<>();
        List<String> runnable = new ArrayList<>();
        for (String source : requested) {
            SourceCollector collector = collectors.get(source);
            if (collector == null) {
                settled.put(source, SourceOutcome.failure(source, SourceFailureReason.UNSUPPORTED_SOURCE,
                        "unsupported source: " + source, null, 0L));
            } else if (runnable.size() >= maxSources) {
                settled.put(source, SourceOutcome.failure(source, SourceFailureReason.SOURCE_LIMIT,
                        "skipped: at most " + maxSources + " sources per request", null, 0L));
            } else {
                runnable.add(source);
            }
        }

        emit(ProgressUpdate.COLLECTING, "", 0, runnable.size(), 0, startedNanos, deadline);
        settled.putAll(runCollectors(runnable, criteria, deadline, startedNanos));

        Map<String, SourceOutcome> outcomes = new LinkedHashMap<>();
        List<RawCandidateRecord> records = new ArrayList<>();
        for (String source : requested) {
            SourceOutcome outcome = cap(settled.getOrDefault(source, SourceOutcome.timeout(source, elapsedMs(startedNanos))));
            outcomes.put(source, outcome);
            records.addAll(outcome.records);
        }

        emit(ProgressUpdate.DEDUPLICATING, "", runnable.size(), runnable.size(), records.size(), startedNanos, deadline);
        DeduplicationResult dedup = deduplicationEngine.deduplicate(records);

        long totalMs = elapsedMs(startedNanos);
        LOG.info("orchestration sources={} records={} profiles={} elapsed_ms={}",
                requested.size(), records.size(), dedup.profiles.size(), totalMs);
        return new OrchestrationResult(dedup.profiles, outcomes, dedup, records.size(), totalMs);
    }

    private Map<String, SourceOutcome> runCollectors(
            List<String> sources,
            SearchCriteria criteria,
            Deadline deadline,
            long startedNanos
    ) {
        Map<String, SourceOutcome> out = new HashMap<>();
        if (sources.isEmpty()) {
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(sources.size(), new CollectorThreadFactory());
        CompletionService<SourceOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<SourceOutcome>, String> sourceByFuture = new LinkedHashMap<>();
        int candidates = 0;
        try {
            for (String source : sources) {
                SourceCollector collector = collectors.get(source);
                sourceByFuture.put(completion.submit(() -> runCollector(source, collector, criteria, deadline)), source);
            }
            int pending = sourceByFuture.size();
            while (pending > 0) {
                long waitMs = deadline.remainingMs();
                Future<SourceOutcome> done = waitMs <= 0L
                        ? completion.poll()
                        : completion.poll(waitMs, TimeUnit.MILLISECONDS);
                if (done == null) {
                    break;
                }
                pending--;
                String source = sourceByFuture.get(done);
                SourceOutcome outcome = settle(source, done, startedNanos);
                out.put(source, outcome);
                candidates += outcome.records.size();
                emit(ProgressUpdate.SOURCE_COMPLETED, source, out.size(), sources.size(), candidates, startedNanos, deadline);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("orchestration interrupted with {} sources pending", sources.size() - out.size());
            for (String source : sources) {
                out.putIfAbsent(source, SourceOutcome.failure(source, SourceFailureReason.INTERRUPTED,
                        "interrupted", null, elapsedMs(startedNanos)));
            }
        } finally {
            for (Map.Entry<Future<SourceOutcome>, String> e : sourceByFuture.entrySet()) {
                if (!out.containsKey(e.getValue())) {
                    e.getKey().cancel(true);
                    out.put(e.getValue(), SourceOutcome.timeout(e.getValue(), elapsedMs(startedNanos)));
                    LOG.warn("source={} abandoned at deadline", e.getValue());
                }
            }
            pool.shutdownNow();
        }
        return out;
    }

    private SourceOutcome runCollector(String source, SourceCollector collector, SearchCriteria criteria, Deadline deadline) {
        long started = System.nanoTime();
        try {
            SourceOutcome outcome = collector.collect(criteria, deadline);
            if (outcome == null) {
                return SourceOutcome.failure(source, SourceFailureReason.OTHER, "collector returned no outcome",
                        null, elapsedMs(started));
            }
            return source.equals(outcome.source) ? outcome : outcome.toBuilder().source(source).build();
        } catch (RuntimeException e) {
            LOG.warn("source={} collector failed err={}", source, e.toString());
            return SourceOutcome.failure(source, SourceFailureReason.OTHER,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), null, elapsedMs(started));
        }
    }

    private SourceOutcome settle(String source, Future<SourceOutcome> done, long startedNanos) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("source={} task failed err={}", source, cause.toString());
            return SourceOutcome.failure(source, SourceFailureReason.OTHER, cause.toString(), null, elapsedMs(startedNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceOutcome.failure(source, SourceFailureReason.INTERRUPTED, "interrupted", null, elapsedMs(startedNanos));
        }
    }

    private SourceOutcome cap(SourceOutcome outcome) {
        if (outcome.records.size() <= maxRecordsPerSource) {
            return outcome;
        }
        return outcome.toBuilder()
                .records(outcome.records.subList(0, maxRecordsPerSource))
                .build();
    }

    private void emit(String phase, String detail, int completed, int total, int candidates, long startedNanos, Deadline deadline) {
        try {
            progress.onProgress(new ProgressUpdate(phase, detail, completed, total, candidates,
                    elapsedMs(startedNanos), deadline.remainingMs()));
        } catch (RuntimeException e) {
            LOG.warn("progress listener failed phase={} err={}", phase, e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static final class CollectorThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "collector-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
