package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.data.http.HttpStatusException;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for platform collectors: deadline checks before every call, one retry per
 * failed call, rate-limit detection, and conversion of whatever happened into a {@link SourceOutcome}.
 */
public abstract class AbstractSourceCollector implements SourceCollector {
    protected final Logger log = LogManager.getLogger(getClass());

    protected final Config config;
    protected final HttpClientEx http;
    protected final Clock clock;

    private final long retryBackoffMs;
    private final Duration requestTimeout;
    private final long deadlineReserveMs;

    protected AbstractSourceCollector(Config config, HttpClientEx http, Clock clock) {
        this.config = config;
        this.http = http;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.retryBackoffMs = Math.max(0L, config.getLong("collector.retry_backoff_ms", 400L));
        this.requestTimeout = Duration.ofSeconds(Math.max(1, config.getInt("collector.request_timeout_sec", 15)));
        this.deadlineReserveMs = Math.max(0L, config.getLong("collector.deadline_reserve_ms", 750L));
    }

    @Override
    public final SourceOutcome collect(SearchCriteria criteria, Deadline deadline) {
        long startedNanos = System.nanoTime();
        CollectionRun run = new CollectionRun(name());
        if (deadline.isExpired()) {
            return SourceOutcome.timeout(name(), 0L);
        }
        String problem = configurationProblem();
        if (!problem.isEmpty()) {
            log.warn("source={} skipped: {}", name(), problem);
            return SourceOutcome.failure(name(), SourceFailureReason.NOT_CONFIGURED, problem, null, elapsedMs(startedNanos));
        }
        try {
            gather(criteria, deadline, run);
        } catch (SourceFetchException e) {
            if (e.reason() == SourceFailureReason.RATE_LIMIT) {
                run.markRateLimited();
                log.warn("source={} rate limited, keeping {} records: {}", name(), run.size(), e.getMessage());
            } else {
                run.fail(e.reason(), e.getMessage());
                log.warn("source={} stopped reason={} records={} err={}", name(), e.reason().label(), run.size(), e.getMessage());
            }
        } catch (JSONException e) {
            run.fail(SourceFailureReason.PARSE_ERROR, "unexpected response: " + e.getMessage());
            log.warn("source={} parse failure err={}", name(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.fail(SourceFailureReason.INTERRUPTED, "interrupted");
        }
        SourceOutcome outcome = run.toOutcome(elapsedMs(startedNanos));
        log.info("source={} records={} found={} elapsed_ms={} rate_limited={} detail_failures={}{}",
                name(), outcome.records.size(), outcome.totalFound, outcome.elapsedMs, outcome.rateLimited,
                run.detailFailures(), outcome.hasError() ? " err=" + outcome.error : "");
        return outcome;
    }

    /**
     * Platform-specific collection. Adds records to {@code run}; may stop early by throwing
     * {@link SourceFetchException} from the fetch helpers.
     */
    protected abstract void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run)
            throws InterruptedException;

    /**
     * Non-empty when the collector cannot run at all, e.g. a missing API key.
     */
    protected String configurationProblem() {
        return "";
    }

    /**
     * Hook for platforms that signal throttling outside the usual status codes.
     */
    protected boolean isRateLimited(HttpStatusException e) {
        return e.isRateLimited();
    }

    protected String fetch(String url, Map<String, String> headers, Deadline deadline) throws InterruptedException {
        return call(url, null, headers, deadline);
    }

    protected String post(String url, String json, Map<String, String> headers, Deadline deadline)
            throws InterruptedException {
        return call(url, json, headers, deadline);
    }

    /**
     * Like {@link #fetch} but a plain failure only skips the one item. Rate limits and the deadline still stop the run.
     */
    protected Optional<String> fetchOptional(String url, Map<String, String> headers, Deadline deadline, CollectionRun run)
            throws InterruptedException {
        try {
            return Optional.of(fetch(url, headers, deadline));
        } catch (SourceFetchException e) {
            if (e.reason() == SourceFailureReason.RATE_LIMIT || e.reason() == SourceFailureReason.TIMEOUT) {
                throw e;
            }
            run.countDetailFailure();
            log.debug("source={} detail fetch skipped url={} err={}", name(), HttpClientEx.maskUrl(url), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stops the run with a timeout when too little of the budget is left to start another call.
     */
    protected void ensureTime(Deadline deadline) {
        if (!deadline.hasAtLeast(deadlineReserveMs)) {
            throw new SourceFetchException(SourceFailureReason.TIMEOUT, SourceOutcome.TIMEOUT_ERROR);
        }
    }

    private String call(String url, String json, Map<String, String> headers, Deadline deadline)
            throws InterruptedException {
        String masked = HttpClientEx.maskUrl(url);
        for (int attempt = 1; ; attempt++) {
            ensureTime(deadline);
            try {
                Duration timeout = deadline.boundedTimeout(requestTimeout);
                return json == null
                        ? http.getText(url, timeout, headers)
                        : http.postJson(url, json, timeout, headers);
            } catch (HttpStatusException e) {
                if (isRateLimited(e)) {
                    throw new SourceFetchException(SourceFailureReason.RATE_LIMIT, e.getMessage(), e);
                }
                if (attempt >= 2) {
                    throw new SourceFetchException(SourceFailureReason.HTTP_ERROR, e.getMessage(), e);
                }
                log.debug("source={} retrying url={} status={}", name(), masked, e.statusCode());
            } catch (IOException e) {
                if (attempt >= 2) {
                    throw new SourceFetchException(SourceFailureReason.HTTP_ERROR,
                            "request failed for " + masked + ": " + e.getMessage(), e);
                }
                log.debug("source={} retrying url={} err={}", name(), masked, e.getMessage());
            }
            backoff(deadline);
        }
    }

    private void backoff(Deadline deadline) throws InterruptedException {
        long sleepMs = Math.min(retryBackoffMs, Math.max(0L, deadline.remainingMs() - deadlineReserveMs));
        if (sleepMs > 0L) {
            Thread.sleep(sleepMs);
        }
    }

    protected Instant now() {
        return clock.instant();
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    protected static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank() || "null".equals(raw)) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    protected static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String t = text.trim();
        return t.length() <= max ? t : t.substring(0, max).trim();
    }

    protected static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank() && !"null".equals(v)) {
                return v.trim();
            }
        }
        return "";
    }

    /**
     * Shared screen: a non-trivial bio, at least one skill, or activity within the last year.
     */
    protected boolean looksLikeActiveDeveloper(String bio, int skillCount, Instant lastActivity) {
        if (bio != null && bio.trim().length() > 10) {
            return true;
        }
        if (skillCount > 0) {
            return true;
        }
        return lastActivity != null && Duration.between(lastActivity, now()).toDays() <= 365L;
    }

    /**
     * Criteria terms present in the extracted skills; feeds the source-local ranking.
     */
    protected static int termHits(SearchCriteria criteria, List<String> skills) {
        int hits = 0;
        for (String term : criteria.terms()) {
            for (String skill : skills) {
                if (skill.equalsIgnoreCase(term) || SkillExtractor.canonical(term).equalsIgnoreCase(skill)) {
                    hits++;
                    break;
                }
            }
        }
        return hits;
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }
}
