package com.talentscout.collect;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Criteria terms to Stack Overflow tag names.
 */
public final class StackOverflowTagMapper {
    private static final List<String> DEFAULT_TAGS = List.of("javascript", "python", "java", "reactjs", "node.js");

    private static final Map<String, List<String>> SKILL_TAGS = Map.ofEntries(
            Map.entry("react", List.of("reactjs")),
            Map.entry("reactjs", List.of("reactjs")),
            Map.entry("vue", List.of("vue.js")),
            Map.entry("angular", List.of("angular")),
            Map.entry("node", List.of("node.js")),
            Map.entry("node.js", List.of("node.js")),
            Map.entry("nodejs", List.of("node.js")),
            Map.entry("javascript", List.of("javascript")),
            Map.entry("typescript", List.of("typescript")),
            Map.entry("python", List.of("python")),
            Map.entry("django", List.of("django")),
            Map.entry("flask", List.of("flask")),
            Map.entry("java", List.of("java")),
            Map.entry("spring", List.of("spring", "spring-boot")),
            Map.entry("go", List.of("go")),
            Map.entry("golang", List.of("go")),
            Map.entry("rust", List.of("rust")),
            Map.entry("c++", List.of("c++")),
            Map.entry("c#", List.of("c#")),
            Map.entry("php", List.of("php")),
            Map.entry("laravel", List.of("laravel")),
            Map.entry("ruby", List.of("ruby")),
            Map.entry("rails", List.of("ruby-on-rails")),
            Map.entry("kotlin", List.of("kotlin")),
            Map.entry("swift", List.of("swift")),
            Map.entry("docker", List.of("docker")),
            Map.entry("kubernetes", List.of("kubernetes")),
            Map.entry("aws", List.of("amazon-web-services")),
            Map.entry("machine learning", List.of("machine-learning")),
            Map.entry("ml", List.of("machine-learning")),
            Map.entry("ai", List.of("machine-learning", "artificial-intelligence")),
            Map.entry("tensorflow", List.of("tensorflow")),
            Map.entry("pytorch", List.of("pytorch")),
            Map.entry("sql", List.of("sql")),
            Map.entry("postgresql", List.of("postgresql")),
            Map.entry("mongodb", List.of("mongodb")),
            Map.entry("frontend", List.of("javascript", "reactjs", "css")),
            Map.entry("backend", List.of("node.js", "java", "python")),
            Map.entry("devops", List.of("docker", "kubernetes"))
    );

    private StackOverflowTagMapper() {
    }

    /**
     * Mapped tags in term order, or the default tag set when nothing maps.
     */
    public static List<String> tagsFor(List<String> terms, int maxTags) {
        Set<String> tags = new LinkedHashSet<>();
        for (String term : terms) {
            List<String> mapped = SKILL_TAGS.get(term.toLowerCase(Locale.ROOT).trim());
            if (mapped != null) {
                tags.addAll(mapped);
            }
        }
        List<String> out = new ArrayList<>(tags.isEmpty() ? DEFAULT_TAGS : tags);
        int limit = Math.max(1, maxTags);
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : List.copyOf(out);
    }
}
