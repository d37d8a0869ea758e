package com.talentscout.collect;

import com.talentscout.model.SearchCriteria;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns criteria into GitHub user-search qualifiers: language, technology stack, role,
 * and a catch-all when none of those apply.
 */
public final class GitHubQueryBuilder {
    private static final List<String> LANGUAGES = List.of(
            "python", "javascript", "typescript", "java", "go", "rust", "php", "ruby", "c++", "kotlin", "swift"
    );
    private static final List<List<String>> TECH_STACKS = List.of(
            List.of("react", "node.js"),
            List.of("django", "python"),
            List.of("spring", "java"),
            List.of("rails", "ruby"),
            List.of("laravel", "php"),
            List.of("vue", "javascript")
    );
    private static final int MAX_LANGUAGE_QUERIES = 2;

    private GitHubQueryBuilder() {
    }

    public static List<String> build(SearchCriteria criteria, int maxQueries) {
        Set<String> queries = new LinkedHashSet<>();
        String location = criteria.hasLocation() ? " location:\"" + criteria.location + "\"" : "";
        List<String> terms = criteria.terms();

        int languageQueries = 0;
        for (String term : terms) {
            String language = term.toLowerCase(Locale.ROOT);
            if ("golang".equals(language)) {
                language = "go";
            }
            if (LANGUAGES.contains(language) && languageQueries < MAX_LANGUAGE_QUERIES) {
                queries.add("language:" + language + location + " repos:>=5 followers:>=10");
                languageQueries++;
            }
        }

        for (List<String> stack : TECH_STACKS) {
            if (terms.contains(stack.get(0))) {
                queries.add(String.join(" ", stack) + " in:bio" + location + " repos:>=3");
                break;
            }
        }

        if (!criteria.roleTypes.isEmpty()) {
            List<String> roles = new ArrayList<>();
            for (String role : criteria.roleTypes) {
                roles.add(role.contains(" ") ? "\"" + role + "\"" : role);
            }
            queries.add(String.join(" OR ", roles) + " in:bio" + location + " repos:>=5 followers:>=10");
        }

        if (queries.isEmpty()) {
            String text = criteria.query.isEmpty() ? "developer" : criteria.query.replace("\"", "");
            queries.add("\"" + text + "\" in:bio,name type:user" + location + " repos:>=2");
        }

        List<String> out = new ArrayList<>(queries);
        return out.size() > maxQueries ? List.copyOf(out.subList(0, Math.max(1, maxQueries))) : List.copyOf(out);
    }
}
