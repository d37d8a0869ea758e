package com.talentscout.orchestrator;

import com.talentscout.collect.SourceCollector;
import com.talentscout.collect.SourceCollectors;
import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.dedup.DeduplicationEngine;
import com.talentscout.model.OrchestrationResult;
import com.talentscout.model.ProgressUpdate;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectionOrchestratorTest {
    private final Config config = Config.fromMap(Path.of("."), Map.of(
            "orchestrator", Map.of("max_sources", 3, "max_records_per_source", 5)
    ));

    @Test
    void hungSourceShouldTimeOutWhileOthersKeepRecords() {
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new FixedCollector("github", records("github", 2)),
                new HangingCollector("linkedin"),
                new FixedCollector("stackoverflow", records("stackoverflow", 1))
        ), ProgressListener.NOOP);

        long started = System.nanoTime();
        OrchestrationResult result = orchestrator.orchestrate(criteria("github", "linkedin", "stackoverflow"),
                Deadline.after(Duration.ofMillis(800)));
        long tookMs = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(tookMs < 5_000L, "took " + tookMs + "ms");
        assertEquals(List.of("github", "linkedin", "stackoverflow"), new ArrayList<>(result.outcomes.keySet()));
        SourceOutcome hung = result.outcomes.get("linkedin");
        assertEquals(SourceOutcome.TIMEOUT_ERROR, hung.error);
        assertEquals(SourceFailureReason.TIMEOUT, hung.failureReason);
        assertTrue(hung.records.isEmpty());
        assertEquals(2, result.outcomes.get("github").records.size());
        assertEquals(1, result.outcomes.get("stackoverflow").records.size());
        assertEquals(3, result.rawRecordCount);
        assertEquals(3, result.profiles.size());
    }

    @Test
    void expiredDeadlineShouldReportEverySourceWithoutThrowing() {
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new HangingCollector("github"),
                new HangingCollector("devto")
        ), ProgressListener.NOOP);

        OrchestrationResult result = orchestrator.orchestrate(criteria("github", "devto"), Deadline.expired());

        assertEquals(2, result.outcomes.size());
        for (SourceOutcome outcome : result.outcomes.values()) {
            assertEquals(SourceOutcome.TIMEOUT_ERROR, outcome.error);
        }
        assertTrue(result.profiles.isEmpty());
    }

    @Test
    void unknownAndExcessSourcesShouldGetOutcomesToo() {
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new FixedCollector("github", records("github", 1)),
                new FixedCollector("stackoverflow", records("stackoverflow", 1)),
                new FixedCollector("linkedin", records("linkedin", 1)),
                new FixedCollector("google", records("google", 1))
        ), ProgressListener.NOOP);

        OrchestrationResult result = orchestrator.orchestrate(
                criteria("github", "myspace", "stackoverflow", "linkedin", "google"),
                Deadline.after(Duration.ofSeconds(5)));

        assertEquals(5, result.outcomes.size());
        assertEquals(SourceFailureReason.UNSUPPORTED_SOURCE, result.outcomes.get("myspace").failureReason);
        assertEquals(SourceFailureReason.SOURCE_LIMIT, result.outcomes.get("google").failureReason);
        assertTrue(result.outcomes.get("google").records.isEmpty());
        assertEquals(3, result.rawRecordCount);
    }

    @Test
    void recordsShouldBeCappedPerSource() {
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new FixedCollector("github", records("github", 9))
        ), ProgressListener.NOOP);

        OrchestrationResult result = orchestrator.orchestrate(criteria("github"), Deadline.after(Duration.ofSeconds(5)));

        SourceOutcome github = result.outcomes.get("github");
        assertEquals(5, github.records.size());
        assertEquals(9, github.totalFound);
        assertEquals(5, result.rawRecordCount);
    }

    @Test
    void throwingCollectorShouldBecomeFailedOutcome() {
        SourceCollector broken = new SourceCollector() {
            @Override
            public String name() {
                return "devto";
            }

            @Override
            public SourceOutcome collect(SearchCriteria criteria, Deadline deadline) {
                throw new IllegalStateException("boom");
            }
        };
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                broken,
                new FixedCollector("github", records("github", 1))
        ), ProgressListener.NOOP);

        OrchestrationResult result = orchestrator.orchestrate(criteria("devto", "github"), Deadline.after(Duration.ofSeconds(5)));

        SourceOutcome devto = result.outcomes.get("devto");
        assertEquals(SourceFailureReason.OTHER, devto.failureReason);
        assertTrue(devto.error.contains("boom"));
        assertEquals(1, result.outcomes.get("github").records.size());
    }

    @Test
    void progressShouldReportPhasesAndSurviveFailingListener() {
        List<String> phases = Collections.synchronizedList(new ArrayList<>());
        ProgressListener listener = update -> {
            phases.add(update.phase());
            if (ProgressUpdate.SOURCE_COMPLETED.equals(update.phase())) {
                throw new IllegalStateException("listener bug");
            }
        };
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new FixedCollector("github", records("github", 1))
        ), listener);

        OrchestrationResult result = orchestrator.orchestrate(criteria("github"), Deadline.after(Duration.ofSeconds(5)));

        assertEquals(List.of(ProgressUpdate.COLLECTING, ProgressUpdate.SOURCE_COMPLETED, ProgressUpdate.DEDUPLICATING), phases);
        assertEquals(1, result.profiles.size());
    }

    @Test
    void orchestrate_shouldResolveDefaultsBeforeRunning() {
        CollectionOrchestrator orchestrator = orchestrator(List.of(
                new FixedCollector("github", records("github", 1))
        ), ProgressListener.NOOP);
        SearchCriteria criteria = SearchCriteria.builder()
                .query("go developer")
                .sources(List.of("GitHub"))
                .timeBudgetSeconds(5)
                .build();

        OrchestrationResult result = orchestrator.orchestrate(criteria);

        assertEquals(List.of("github"), new ArrayList<>(result.outcomes.keySet()));
    }

    private CollectionOrchestrator orchestrator(List<? extends SourceCollector> collectors, ProgressListener listener) {
        return new CollectionOrchestrator(config, SourceCollectors.of(collectors), new DeduplicationEngine(config), listener);
    }

    private static SearchCriteria criteria(String... sources) {
        return SearchCriteria.builder()
                .query("developer")
                .sources(List.of(sources))
                .timeBudgetSeconds(5)
                .limit(10)
                .build();
    }

    private static List<RawCandidateRecord> records(String platform, int count) {
        List<RawCandidateRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(RawCandidateRecord.builder()
                    .platform(platform)
                    .platformId(platform + "-" + i)
                    .name(platform + " Person " + (char) ('A' + i))
                    .build());
        }
        return out;
    }

    private static final class FixedCollector implements SourceCollector {
        private final String name;
        private final List<RawCandidateRecord> records;

        private FixedCollector(String name, List<RawCandidateRecord> records) {
            this.name = name;
            this.records = records;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public SourceOutcome collect(SearchCriteria criteria, Deadline deadline) {
            return SourceOutcome.success(name, records, 3L, false);
        }
    }

    /**
     * Ignores the deadline and blocks until interrupted.
     */
    private static final class HangingCollector implements SourceCollector {
        private final String name;

        private HangingCollector(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public SourceOutcome collect(SearchCriteria criteria, Deadline deadline) {
            try {
                Thread.sleep(60_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SourceOutcome.success(name, records(name, 1), 60_000L, false);
        }
    }
}
