package com.talentscout.collect;

import com.talentscout.core.Deadline;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceOutcome;

/**
 * One external platform. Implementations never throw: failures, rate limits and deadline
 * expiry all end up in the returned outcome.
 */
public interface SourceCollector {

    /**
     * Stable lower-case source name used in requests and result maps, e.g. "github".
     */
    String name();

    SourceOutcome collect(SearchCriteria criteria, Deadline deadline);
}
