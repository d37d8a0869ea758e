package com.talentscout.orchestrator;

import com.talentscout.config.Config;
import com.talentscout.model.SearchCriteria;

import java.util.List;

/**
 * Rejects unusable criteria and fills caller omissions from config.
 */
public final class CriteriaValidator {
    private final Config config;

    public CriteriaValidator(Config config) {
        this.config = config;
    }

    /**
     * @return criteria with sources, time budget and limit resolved; the budget is clamped to the configured maximum
     * @throws InvalidCriteriaException when the query is blank, no source is selected, or a number is negative
     */
    public SearchCriteria resolve(SearchCriteria criteria) {
        if (criteria == null || criteria.query.isEmpty()) {
            throw new InvalidCriteriaException("Valid query is required");
        }
        List<String> sources = criteria.sourcesSpecified()
                ? criteria.sources
                : config.getList("pipeline.default_sources");
        if (sources.isEmpty()) {
            throw new InvalidCriteriaException("At least one source must be specified");
        }
        if (criteria.timeBudgetSeconds < 0) {
            throw new InvalidCriteriaException("time budget must not be negative");
        }
        if (criteria.limit < 0) {
            throw new InvalidCriteriaException("limit must not be negative");
        }

        // Zero means the caller left the value out.
        int maxBudget = Math.max(1, config.getInt("orchestrator.max_time_budget_sec", 70));
        int budget = criteria.timeBudgetSeconds == 0
                ? config.getInt("pipeline.default_time_budget_sec", 60)
                : criteria.timeBudgetSeconds;
        int limit = criteria.limit == 0 ? Math.max(1, config.getInt("pipeline.default_limit", 50)) : criteria.limit;

        return criteria.toBuilder()
                .sources(sources)
                .timeBudgetSeconds(Math.max(1, Math.min(maxBudget, budget)))
                .limit(limit)
                .build();
    }
}
