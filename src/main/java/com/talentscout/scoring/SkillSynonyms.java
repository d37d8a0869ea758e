package com.talentscout.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Small semantic map between umbrella terms and the concrete skills that imply them.
 */
public final class SkillSynonyms {
    private static final Map<String, List<String>> GROUPS = buildGroups();

    private SkillSynonyms() {
    }

    /**
     * True when one term is an umbrella the other falls under, in either direction.
     */
    public static boolean related(String term, String skill) {
        String a = normalize(term);
        String b = normalize(skill);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        List<String> underA = GROUPS.get(a);
        if (underA != null && underA.contains(b)) {
            return true;
        }
        List<String> underB = GROUPS.get(b);
        return underB != null && underB.contains(a);
    }

    /**
     * Lower-cases and drops separators so "Node.js", "node js" and "nodejs" compare equal.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s._\\-]+", "");
    }

    static Map<String, List<String>> groups() {
        return GROUPS;
    }

    private static Map<String, List<String>> buildGroups() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("ai", List.of("machine learning", "ml", "tensorflow", "pytorch", "deep learning", "artificial intelligence"));
        raw.put("machine learning", List.of("ml", "ai", "artificial intelligence", "deep learning", "data science",
                "tensorflow", "pytorch", "scikit-learn"));
        raw.put("backend", List.of("api", "server", "django", "flask", "spring", "node.js", "express", "rails"));
        raw.put("frontend", List.of("react", "vue", "angular", "ui", "ux", "svelte", "next.js"));
        raw.put("devops", List.of("docker", "kubernetes", "aws", "cloud", "terraform", "ci/cd"));
        raw.put("javascript", List.of("js", "node.js", "typescript", "ecmascript"));
        raw.put("python", List.of("py", "django", "flask", "fastapi", "pandas"));
        raw.put("java", List.of("spring", "spring boot", "jvm", "kotlin"));
        raw.put("mobile", List.of("android", "ios", "swift", "kotlin", "react native", "flutter"));

        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : raw.entrySet()) {
            out.put(normalize(e.getKey()), e.getValue().stream().map(SkillSynonyms::normalize).toList());
        }
        return Map.copyOf(out);
    }
}
