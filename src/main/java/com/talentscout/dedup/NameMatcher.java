package com.talentscout.dedup;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalization and string similarity used for cross-platform identity matching.
 */
public final class NameMatcher {

    private NameMatcher() {
    }

    /**
     * Lower-case, punctuation replaced by spaces, whitespace collapsed. "A. Smith" becomes "a smith".
     */
    public static String normalizeName(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Normalized name with spaces removed, so a login like "asmith" lines up with "A Smith".
     */
    public static String compactName(String raw) {
        return normalizeName(raw).replace(" ", "");
    }

    public static String normalizeLocation(String raw) {
        return normalizeName(raw);
    }

    /**
     * Levenshtein distance scaled to 0..1, where 1 means identical.
     */
    public static double similarity(String a, String b) {
        String s = a == null ? "" : a;
        String t = b == null ? "" : b;
        if (s.equals(t)) {
            return 1.0;
        }
        int longest = Math.max(s.length(), t.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(s, t) / longest;
    }

    /**
     * Shared words of three or more letters over the larger word set, 0..1.
     * Two-letter state and country codes never count.
     */
    public static double tokenOverlap(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(left);
        common.retainAll(right);
        return (double) common.size() / Math.max(left.size(), right.size());
    }

    /**
     * Both present and one containing the other, all words of one found in the other,
     * or word overlap or edit similarity reaching the threshold.
     */
    public static boolean locationsOverlap(String a, String b, double threshold) {
        String left = normalizeLocation(a);
        String right = normalizeLocation(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        if (containsPhrase(left, right) || containsPhrase(right, left)) {
            return true;
        }
        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        if (!leftTokens.isEmpty() && !rightTokens.isEmpty()
                && (leftTokens.containsAll(rightTokens) || rightTokens.containsAll(leftTokens))) {
            return true;
        }
        return tokenOverlap(left, right) >= threshold || similarity(left, right) >= threshold;
    }

    public static double locationSimilarity(String a, String b) {
        String left = normalizeLocation(a);
        String right = normalizeLocation(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (containsPhrase(left, right) || containsPhrase(right, left)) {
            return 1.0;
        }
        return Math.max(similarity(left, right), tokenOverlap(left, right));
    }

    private static boolean containsPhrase(String text, String phrase) {
        return (" " + text + " ").contains(" " + phrase + " ");
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new HashSet<>();
        for (String t : List.of(normalizeName(text).split(" "))) {
            if (t.length() > 2) {
                out.add(t);
            }
        }
        return out;
    }

    private static int levenshtein(String s, String t) {
        int[] prev = new int[t.length() + 1];
        int[] curr = new int[t.length() + 1];
        for (int j = 0; j <= t.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= s.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= t.length(); j++) {
                int cost = s.charAt(i - 1) == t.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[t.length()];
    }
}
