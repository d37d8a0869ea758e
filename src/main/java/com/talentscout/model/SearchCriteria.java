package com.talentscout.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structured search input. Immutable once handed to the orchestrator.
 */
@Value
public final class SearchCriteria {
    public final String query;
    public final String location;
    public final List<String> skills;
    public final List<String> keywords;
    public final List<String> roleTypes;
    public final List<String> sources;
    public final int timeBudgetSeconds;
    public final int limit;

    @Builder(toBuilder = true)
    public SearchCriteria(
            String query,
            String location,
            List<String> skills,
            List<String> keywords,
            List<String> roleTypes,
            List<String> sources,
            int timeBudgetSeconds,
            int limit
    ) {
        this.query = query == null ? "" : query.trim();
        this.location = location == null ? "" : location.trim();
        this.skills = cleanList(skills, false);
        this.keywords = cleanList(keywords, false);
        this.roleTypes = cleanList(roleTypes, false);
        this.sources = sources == null ? null : cleanList(sources, true);
        this.timeBudgetSeconds = timeBudgetSeconds;
        this.limit = limit;
    }

    /**
     * Skills followed by keywords, lower-cased, without repeats.
     */
    public List<String> terms() {
        Set<String> out = new LinkedHashSet<>();
        for (String s : skills) {
            out.add(s.toLowerCase(Locale.ROOT));
        }
        for (String k : keywords) {
            out.add(k.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(out);
    }

    public boolean hasLocation() {
        return !location.isEmpty();
    }

    /**
     * Sources as requested; {@code null} means the caller did not choose and defaults apply.
     */
    public boolean sourcesSpecified() {
        return sources != null;
    }

    private static List<String> cleanList(List<String> raw, boolean lowerCase) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String item : raw) {
            if (item == null || item.trim().isEmpty()) {
                continue;
            }
            String value = lowerCase ? item.trim().toLowerCase(Locale.ROOT) : item.trim();
            if (seen.add(value.toLowerCase(Locale.ROOT))) {
                out.add(value);
            }
        }
        return List.copyOf(out);
    }
}
