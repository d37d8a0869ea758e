package com.talentscout.collect;

import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * State of one collector invocation. Owned by a single task and never shared.
 */
final class CollectionRun {
    private final String source;
    private final Set<String> seen = new HashSet<>();
    private final List<RawCandidateRecord> records = new ArrayList<>();
    private int screened;
    private int detailFailures;
    private boolean rateLimited;
    private String error = "";
    private SourceFailureReason reason = SourceFailureReason.NONE;

    CollectionRun(String source) {
        this.source = source;
    }

    /**
     * @return true the first time an id is offered in this run
     */
    boolean markSeen(String platformId) {
        if (platformId == null || platformId.isBlank()) {
            return false;
        }
        return seen.add(platformId.trim().toLowerCase(Locale.ROOT));
    }

    void add(RawCandidateRecord record) {
        if (record != null) {
            records.add(record);
        }
    }

    void countScreened() {
        screened++;
    }

    void countDetailFailure() {
        detailFailures++;
    }

    int detailFailures() {
        return detailFailures;
    }

    int size() {
        return records.size();
    }

    boolean isFull(int max) {
        return records.size() >= max;
    }

    void markRateLimited() {
        rateLimited = true;
    }

    boolean rateLimited() {
        return rateLimited;
    }

    void fail(SourceFailureReason failureReason, String message) {
        if (error.isEmpty()) {
            reason = failureReason;
            error = message == null || message.isBlank() ? failureReason.label() : message;
        }
    }

    /**
     * Records ordered by the platform-local rank, highest first. Equal ranks keep discovery order.
     */
    SourceOutcome toOutcome(long elapsedMs) {
        List<RawCandidateRecord> ranked = new ArrayList<>(records);
        ranked.sort(Comparator.comparingDouble((RawCandidateRecord r) -> r.sourceRank).reversed());
        int total = Math.max(screened, ranked.size());
        if (error.isEmpty()) {
            return new SourceOutcome(source, ranked, total, "", SourceFailureReason.NONE, elapsedMs, rateLimited);
        }
        return new SourceOutcome(source, ranked, total, error, reason, elapsedMs, rateLimited);
    }
}
