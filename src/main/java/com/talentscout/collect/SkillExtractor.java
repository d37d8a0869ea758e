package com.talentscout.collect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based skill recognition over free text (bios, snippets, repo names) and language names.
 */
public final class SkillExtractor {
    private static final Map<String, Pattern> SKILLS = buildPatterns();

    private SkillExtractor() {
    }

    /**
     * Canonical skill names found in any of the texts, in catalogue order.
     */
    public static List<String> extract(String... texts) {
        StringBuilder joined = new StringBuilder();
        for (String t : texts) {
            if (t != null && !t.isBlank()) {
                joined.append(' ').append(t);
            }
        }
        if (joined.length() == 0) {
            return List.of();
        }
        String haystack = joined.toString();
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : SKILLS.entrySet()) {
            if (e.getValue().matcher(haystack).find()) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    /**
     * Maps a platform language label ("C++", "Jupyter Notebook", "typescript") to a skill name.
     */
    public static String canonical(String language) {
        if (language == null || language.isBlank()) {
            return "";
        }
        String trimmed = language.trim();
        for (String skill : SKILLS.keySet()) {
            if (skill.equalsIgnoreCase(trimmed)) {
                return skill;
            }
        }
        List<String> found = extract(trimmed);
        return found.isEmpty() ? trimmed : found.get(0);
    }

    /**
     * Concatenates skill lists without case-insensitive repeats, keeping at most {@code max}.
     */
    @SafeVarargs
    public static List<String> merge(int max, List<String>... lists) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (List<String> list : lists) {
            for (String s : list) {
                if (out.size() >= max) {
                    return out;
                }
                if (s != null && !s.isBlank() && seen.add(s.toLowerCase(Locale.ROOT))) {
                    out.add(s);
                }
            }
        }
        return out;
    }

    private static Map<String, Pattern> buildPatterns() {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        aliases.put("JavaScript", List.of("javascript", "js", "ecmascript"));
        aliases.put("TypeScript", List.of("typescript"));
        aliases.put("Python", List.of("python"));
        aliases.put("Java", List.of("java"));
        aliases.put("Go", List.of("golang"));
        aliases.put("Rust", List.of("rust"));
        aliases.put("C++", List.of("c++", "cpp"));
        aliases.put("C#", List.of("c#", "csharp", ".net"));
        aliases.put("PHP", List.of("php"));
        aliases.put("Ruby", List.of("ruby"));
        aliases.put("Kotlin", List.of("kotlin"));
        aliases.put("Swift", List.of("swift"));
        aliases.put("Scala", List.of("scala"));
        aliases.put("React", List.of("react", "reactjs", "react.js"));
        aliases.put("Vue", List.of("vue", "vuejs", "vue.js"));
        aliases.put("Angular", List.of("angular"));
        aliases.put("Svelte", List.of("svelte"));
        aliases.put("Node.js", List.of("node.js", "nodejs", "node"));
        aliases.put("Next.js", List.of("next.js", "nextjs"));
        aliases.put("Django", List.of("django"));
        aliases.put("Flask", List.of("flask"));
        aliases.put("FastAPI", List.of("fastapi"));
        aliases.put("Spring", List.of("spring", "spring boot"));
        aliases.put("Rails", List.of("rails", "ruby on rails"));
        aliases.put("Laravel", List.of("laravel"));
        aliases.put("Express", List.of("express", "expressjs"));
        aliases.put("GraphQL", List.of("graphql"));
        aliases.put("PostgreSQL", List.of("postgresql", "postgres"));
        aliases.put("MySQL", List.of("mysql"));
        aliases.put("MongoDB", List.of("mongodb", "mongo"));
        aliases.put("Redis", List.of("redis"));
        aliases.put("Kafka", List.of("kafka"));
        aliases.put("Docker", List.of("docker"));
        aliases.put("Kubernetes", List.of("kubernetes", "k8s"));
        aliases.put("AWS", List.of("aws", "amazon web services"));
        aliases.put("GCP", List.of("gcp", "google cloud"));
        aliases.put("Azure", List.of("azure"));
        aliases.put("Terraform", List.of("terraform"));
        aliases.put("Machine Learning", List.of("machine learning", "ml"));
        aliases.put("Deep Learning", List.of("deep learning"));
        aliases.put("Data Science", List.of("data science", "data scientist"));
        aliases.put("TensorFlow", List.of("tensorflow"));
        aliases.put("PyTorch", List.of("pytorch"));
        aliases.put("DevOps", List.of("devops"));
        aliases.put("Microservices", List.of("microservices", "microservice"));
        aliases.put("Android", List.of("android"));
        aliases.put("iOS", List.of("ios"));
        aliases.put("Flutter", List.of("flutter"));
        aliases.put("React Native", List.of("react native", "react-native"));

        Map<String, Pattern> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : aliases.entrySet()) {
            List<String> quoted = new ArrayList<>();
            for (String alias : e.getValue()) {
                quoted.add(Pattern.quote(alias));
            }
            String regex = "(?<![\\w+#.])(?:" + String.join("|", quoted) + ")(?![\\w+#])";
            out.put(e.getKey(), Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return out;
    }
}
