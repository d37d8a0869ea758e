package com.talentscout.dedup;

import com.talentscout.config.Config;
import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.DeduplicationMetrics;
import com.talentscout.model.DeduplicationResult;
import com.talentscout.model.MergeDecision;
import com.talentscout.model.MergeProvenance;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SourceReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses raw records that denote the same person into canonical profiles.
 * <p>
 * Three passes over the input, in input order so the outcome is deterministic:
 * exact identifiers (GitHub login, LinkedIn slug, Stack Overflow id, email, record key),
 * then the normalized name + location key, then pairwise fuzzy matching.
 * Groups that carry different values for the same platform identifier are never joined.
 */
public final class DeduplicationEngine {
    private static final Logger LOG = LogManager.getLogger(DeduplicationEngine.class);

    private static final Pattern LINKEDIN_SLUG = Pattern.compile("linkedin\\.com/in/([^/?#]+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> PLATFORM_ID_KINDS = List.of("github", "linkedin", "stackoverflow");

    private static final double NAME_WEIGHT = 0.4;
    private static final double EMAIL_WEIGHT = 0.3;
    private static final double USERNAME_WEIGHT = 0.2;
    private static final double LOCATION_WEIGHT = 0.1;

    private final double nameThreshold;
    private final double locationThreshold;
    private final double overallThreshold;

    public DeduplicationEngine(Config config) {
        this.nameThreshold = config.getDouble("dedup.name_similarity", 0.85);
        this.locationThreshold = config.getDouble("dedup.location_similarity", 0.75);
        this.overallThreshold = config.getDouble("dedup.overall_similarity", 0.8);
    }

    public DeduplicationResult deduplicate(List<RawCandidateRecord> records) {
        if (records == null || records.isEmpty()) {
            return DeduplicationResult.empty();
        }
        Groups groups = new Groups(records);
        List<MergeDecision> decisions = new ArrayList<>();

        mergeOnIdentifiers(records, groups, decisions);
        mergeOnNameAndLocation(records, groups, decisions);
        mergeFuzzy(records, groups, decisions);

        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            members.computeIfAbsent(groups.find(i), ignored -> new ArrayList<>()).add(i);
        }
        Map<Integer, Set<String>> reasonsByRoot = new HashMap<>();
        Map<String, Integer> indexByKey = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            indexByKey.putIfAbsent(records.get(i).key(), i);
        }
        for (MergeDecision d : decisions) {
            Integer idx = indexByKey.get(d.mergedKey());
            if (idx != null) {
                reasonsByRoot.computeIfAbsent(groups.find(idx), ignored -> new LinkedHashSet<>()).add(d.reason());
            }
        }

        List<CanonicalProfile> profiles = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> e : members.entrySet()) {
            List<RawCandidateRecord> group = new ArrayList<>();
            for (int idx : e.getValue()) {
                group.add(records.get(idx));
            }
            profiles.add(merge(group, reasonsByRoot.getOrDefault(e.getKey(), Set.of())));
        }

        DeduplicationMetrics metrics = DeduplicationMetrics.of(records.size(), profiles.size(), decisions.size());
        LOG.debug("dedup original={} deduplicated={} merges={}", records.size(), profiles.size(), decisions.size());
        return new DeduplicationResult(profiles, metrics, decisions);
    }

    private void mergeOnIdentifiers(List<RawCandidateRecord> records, Groups groups, List<MergeDecision> decisions) {
        Map<String, Integer> firstByKey = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            for (String key : identityKeys(records.get(i))) {
                Integer first = firstByKey.putIfAbsent(key, i);
                if (first != null && groups.find(first) != groups.find(i) && !groups.conflict(first, i)) {
                    groups.union(first, i);
                    decisions.add(new MergeDecision(records.get(first).key(), records.get(i).key(),
                            MergeDecision.SHARED_IDENTIFIER, 1.0));
                }
            }
        }
    }

    private void mergeOnNameAndLocation(List<RawCandidateRecord> records, Groups groups, List<MergeDecision> decisions) {
        Map<String, Integer> firstByKey = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            String key = secondaryKey(records.get(i));
            if (key.isEmpty()) {
                continue;
            }
            Integer first = firstByKey.putIfAbsent(key, i);
            if (first != null && groups.find(first) != groups.find(i) && !groups.conflict(first, i)) {
                groups.union(first, i);
                decisions.add(new MergeDecision(records.get(first).key(), records.get(i).key(),
                        MergeDecision.NAME_LOCATION, 1.0));
            }
        }
    }

    private void mergeFuzzy(List<RawCandidateRecord> records, Groups groups, List<MergeDecision> decisions) {
        for (int i = 0; i < records.size(); i++) {
            for (int j = i + 1; j < records.size(); j++) {
                if (groups.find(i) == groups.find(j) || groups.conflict(i, j)) {
                    continue;
                }
                RawCandidateRecord a = records.get(i);
                RawCandidateRecord b = records.get(j);
                String compactA = NameMatcher.compactName(a.name);
                String compactB = NameMatcher.compactName(b.name);
                if (compactA.isEmpty() || compactB.isEmpty()) {
                    continue;
                }
                if (compactA.equals(compactB) && NameMatcher.locationsOverlap(a.location, b.location, locationThreshold)) {
                    groups.union(i, j);
                    double confidence = (1.0 + NameMatcher.locationSimilarity(a.location, b.location)) / 2.0;
                    decisions.add(new MergeDecision(a.key(), b.key(), MergeDecision.NAME_LOCATION, round2(confidence)));
                    continue;
                }
                double composite = compositeSimilarity(a, b);
                if (composite >= overallThreshold) {
                    groups.union(i, j);
                    decisions.add(new MergeDecision(a.key(), b.key(), MergeDecision.FUZZY_MATCH, round2(composite)));
                }
            }
        }
    }

    /**
     * Weighted similarity over the signals both records carry. Needs a close name and at least one other signal.
     */
    double compositeSimilarity(RawCandidateRecord a, RawCandidateRecord b) {
        double nameSim = NameMatcher.similarity(NameMatcher.normalizeName(a.name), NameMatcher.normalizeName(b.name));
        if (nameSim < nameThreshold) {
            return 0.0;
        }
        double weighted = nameSim * NAME_WEIGHT;
        double weights = NAME_WEIGHT;
        int signals = 1;

        if (!a.email.isEmpty() && !b.email.isEmpty()) {
            weighted += (a.email.equalsIgnoreCase(b.email) ? 1.0 : 0.0) * EMAIL_WEIGHT;
            weights += EMAIL_WEIGHT;
            signals++;
        }
        if (!a.githubUsername.isEmpty() && !b.githubUsername.isEmpty()) {
            weighted += NameMatcher.similarity(a.githubUsername.toLowerCase(Locale.ROOT),
                    b.githubUsername.toLowerCase(Locale.ROOT)) * USERNAME_WEIGHT;
            weights += USERNAME_WEIGHT;
            signals++;
        }
        if (!a.location.isEmpty() && !b.location.isEmpty()) {
            double locSim = NameMatcher.locationSimilarity(a.location, b.location);
            if (locSim < locationThreshold) {
                return 0.0;
            }
            weighted += locSim * LOCATION_WEIGHT;
            weights += LOCATION_WEIGHT;
            signals++;
        }
        if (signals < 2) {
            return 0.0;
        }
        return weighted / weights;
    }

    /**
     * Field precedence: non-empty wins; among non-empty values the most recently active record wins.
     * Counters take the maximum, skills and source references are unioned in input order.
     */
    private CanonicalProfile merge(List<RawCandidateRecord> group, Set<String> reasons) {
        List<RawCandidateRecord> byRecency = new ArrayList<>(group);
        byRecency.sort(Comparator.comparing(
                (RawCandidateRecord r) -> r.lastActive == null ? Instant.MIN : r.lastActive).reversed());

        Set<String> seenSkills = new LinkedHashSet<>();
        List<String> skills = new ArrayList<>();
        Map<String, SourceReference> refs = new LinkedHashMap<>();
        List<String> keys = new ArrayList<>();
        Instant lastActive = null;
        double years = 0.0;
        int followers = 0;
        int stars = 0;
        int forks = 0;
        int repos = 0;
        int reputation = 0;
        int connections = 0;
        for (RawCandidateRecord r : group) {
            for (String s : r.skills) {
                if (seenSkills.add(s.toLowerCase(Locale.ROOT))) {
                    skills.add(s);
                }
            }
            refs.putIfAbsent(r.key(), new SourceReference(r.platform, r.platformId, r.profileUrl));
            keys.add(r.key());
            if (r.lastActive != null && (lastActive == null || r.lastActive.isAfter(lastActive))) {
                lastActive = r.lastActive;
            }
            years = Math.max(years, r.experienceYears);
            followers = Math.max(followers, r.followers);
            stars = Math.max(stars, r.stars);
            forks = Math.max(forks, r.forks);
            repos = Math.max(repos, r.repoCount);
            reputation = Math.max(reputation, r.reputationPoints);
            connections = Math.max(connections, r.connections);
        }

        return CanonicalProfile.builder()
                .id(group.get(0).key())
                .name(pick(byRecency, r -> r.name))
                .title(pick(byRecency, r -> r.title))
                .location(pick(byRecency, r -> r.location))
                .avatarUrl(pick(byRecency, r -> r.avatarUrl))
                .email(pick(byRecency, r -> r.email))
                .summary(pick(byRecency, r -> r.summary))
                .githubUsername(pick(byRecency, r -> r.githubUsername))
                .linkedinUrl(pick(byRecency, r -> r.linkedinUrl))
                .stackoverflowId(pick(byRecency, r -> r.stackoverflowId))
                .skills(skills)
                .lastActive(lastActive)
                .experienceYears(years)
                .followers(followers)
                .stars(stars)
                .forks(forks)
                .repoCount(repos)
                .reputationPoints(reputation)
                .connections(connections)
                .sources(new ArrayList<>(refs.values()))
                .provenance(new MergeProvenance(group.size(), keys, List.copyOf(reasons)))
                .build();
    }

    private static String pick(List<RawCandidateRecord> byRecency, Function<RawCandidateRecord, String> field) {
        for (RawCandidateRecord r : byRecency) {
            String value = field.apply(r);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    static List<String> identityKeys(RawCandidateRecord r) {
        List<String> keys = new ArrayList<>();
        keys.add("record:" + r.key());
        Map<String, String> ids = platformIds(r);
        for (Map.Entry<String, String> e : ids.entrySet()) {
            keys.add(e.getKey() + ":" + e.getValue());
        }
        if (!r.email.isEmpty()) {
            keys.add("email:" + r.email.toLowerCase(Locale.ROOT));
        }
        return keys;
    }

    static String secondaryKey(RawCandidateRecord r) {
        String name = NameMatcher.compactName(r.name);
        String location = NameMatcher.normalizeLocation(r.location);
        if (name.isEmpty() || location.isEmpty()) {
            return "";
        }
        return name + "|" + location;
    }

    private static Map<String, String> platformIds(RawCandidateRecord r) {
        Map<String, String> ids = new LinkedHashMap<>();
        if (!r.githubUsername.isEmpty()) {
            ids.put("github", r.githubUsername.toLowerCase(Locale.ROOT));
        }
        String slug = linkedinSlug(r.linkedinUrl);
        if (!slug.isEmpty()) {
            ids.put("linkedin", slug);
        }
        if (!r.stackoverflowId.isEmpty()) {
            ids.put("stackoverflow", r.stackoverflowId);
        }
        return ids;
    }

    static String linkedinSlug(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        Matcher m = LINKEDIN_SLUG.matcher(url);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Union-find over record indexes. The smaller index is always the root, and each root
     * tracks the platform identifiers its members carry.
     */
    private static final class Groups {
        private final int[] parent;
        private final List<Map<String, Set<String>>> idsByRoot = new ArrayList<>();

        private Groups(List<RawCandidateRecord> records) {
            parent = new int[records.size()];
            for (int i = 0; i < parent.length; i++) {
                parent[i] = i;
                Map<String, Set<String>> ids = new HashMap<>();
                for (Map.Entry<String, String> e : platformIds(records.get(i)).entrySet()) {
                    ids.computeIfAbsent(e.getKey(), ignored -> new LinkedHashSet<>()).add(e.getValue());
                }
                idsByRoot.add(ids);
            }
        }

        private int find(int i) {
            while (parent[i] != i) {
                parent[i] = parent[parent[i]];
                i = parent[i];
            }
            return i;
        }

        private boolean conflict(int a, int b) {
            Map<String, Set<String>> left = idsByRoot.get(find(a));
            Map<String, Set<String>> right = idsByRoot.get(find(b));
            for (String kind : PLATFORM_ID_KINDS) {
                Set<String> l = left.get(kind);
                Set<String> r = right.get(kind);
                if (l != null && r != null && !l.equals(r)) {
                    return true;
                }
            }
            return false;
        }

        private void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra == rb) {
                return;
            }
            int root = Math.min(ra, rb);
            int child = Math.max(ra, rb);
            parent[child] = root;
            Map<String, Set<String>> target = idsByRoot.get(root);
            for (Map.Entry<String, Set<String>> e : idsByRoot.get(child).entrySet()) {
                target.computeIfAbsent(e.getKey(), ignored -> new LinkedHashSet<>()).addAll(e.getValue());
            }
        }
    }
}
