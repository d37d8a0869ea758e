package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.data.http.HttpStatusException;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import org.json.JSONArray;
import org.json.JSONObject;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Q&A profiles from the Stack Exchange API: top answerers per tag, their user records, and top answer tags.
 */
public final class StackOverflowCollector extends AbstractSourceCollector {
    public static final String NAME = "stackoverflow";

    private static final int MIN_REPUTATION = 25;
    private static final int MIN_ACCOUNT_DAYS = 7;
    private static final int MAX_SKILLS = 8;
    private static final Pattern GITHUB_USER = Pattern.compile("github\\.com/([A-Za-z0-9-]+)/?$", Pattern.CASE_INSENSITIVE);

    private final String apiBase;
    private final String key;
    private final int pageSize;
    private final int maxTags;
    private final int maxCandidates;

    public StackOverflowCollector(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    public StackOverflowCollector(Config config, HttpClientEx http, Clock clock) {
        super(config, http, clock);
        this.apiBase = config.getString("stackoverflow.api_base", "https://api.stackexchange.com/2.3");
        this.key = config.getSecret("stackoverflow.key", "STACKEXCHANGE_KEY");
        this.pageSize = Math.max(1, config.getInt("stackoverflow.page_size", 30));
        this.maxTags = Math.max(1, config.getInt("stackoverflow.max_tags", 3));
        this.maxCandidates = Math.max(1, config.getInt("stackoverflow.max_candidates", 20));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean isRateLimited(HttpStatusException e) {
        return e.isRateLimited() || e.body().contains("throttle_violation");
    }

    @Override
    protected void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run) throws InterruptedException {
        for (String tag : StackOverflowTagMapper.tagsFor(criteria.terms(), maxTags)) {
            if (run.isFull(maxCandidates)) {
                return;
            }
            String url = apiBase + "/tags/" + encode(tag) + "/top-answerers/all_time?site=stackoverflow&pagesize="
                    + pageSize + keyParam();
            JSONObject body = new JSONObject(fetch(url, Map.of(), deadline));
            boolean throttled = isThrottled(body);

            Map<String, Integer> postCounts = new LinkedHashMap<>();
            JSONArray items = body.optJSONArray("items");
            for (int i = 0; items != null && i < items.length(); i++) {
                JSONObject item = items.optJSONObject(i);
                JSONObject user = item == null ? null : item.optJSONObject("user");
                if (user == null || "does_not_exist".equals(user.optString("user_type"))) {
                    continue;
                }
                String userId = String.valueOf(user.optLong("user_id", 0L));
                if ("0".equals(userId) || !run.markSeen(userId)) {
                    continue;
                }
                run.countScreened();
                postCounts.put(userId, item.optInt("post_count", 0));
            }
            if (throttled) {
                run.markRateLimited();
                log.warn("source={} quota exhausted after tag={}", NAME, tag);
            }
            if (postCounts.isEmpty()) {
                if (throttled) {
                    return;
                }
                continue;
            }

            for (JSONObject user : fetchUsers(postCounts.keySet(), deadline, run)) {
                if (run.isFull(maxCandidates)) {
                    break;
                }
                String userId = String.valueOf(user.optLong("user_id", 0L));
                int posts = postCounts.getOrDefault(userId, 0);
                if (!passesAccountScreen(user, posts)) {
                    continue;
                }
                List<String> skills = throttled ? List.of(tag) : topTags(userId, tag, deadline, run);
                RawCandidateRecord record = toRecord(user, tag, posts, skills, criteria);
                if (record != null) {
                    run.add(record);
                }
            }
            if (throttled) {
                return;
            }
        }
    }

    private List<JSONObject> fetchUsers(Iterable<String> ids, Deadline deadline, CollectionRun run)
            throws InterruptedException {
        String url = apiBase + "/users/" + String.join(";", ids) + "?site=stackoverflow&pagesize=100" + keyParam();
        Optional<String> body = fetchOptional(url, Map.of(), deadline, run);
        List<JSONObject> out = new ArrayList<>();
        if (body.isEmpty()) {
            return out;
        }
        JSONObject parsed = new JSONObject(body.get());
        if (isThrottled(parsed)) {
            run.markRateLimited();
        }
        JSONArray items = parsed.optJSONArray("items");
        Map<String, JSONObject> byId = new HashMap<>();
        for (int i = 0; items != null && i < items.length(); i++) {
            JSONObject user = items.optJSONObject(i);
            if (user != null) {
                byId.put(String.valueOf(user.optLong("user_id", 0L)), user);
            }
        }
        // Keep top-answerer order; the users endpoint sorts by reputation.
        for (String id : ids) {
            JSONObject user = byId.get(id);
            if (user != null) {
                out.add(user);
            }
        }
        return out;
    }

    private List<String> topTags(String userId, String searchTag, Deadline deadline, CollectionRun run)
            throws InterruptedException {
        if (run.rateLimited()) {
            return List.of(searchTag);
        }
        String url = apiBase + "/users/" + userId + "/top-answer-tags?site=stackoverflow&pagesize=10" + keyParam();
        Optional<String> body = fetchOptional(url, Map.of(), deadline, run);
        List<String> tags = new ArrayList<>();
        if (body.isPresent()) {
            JSONObject parsed = new JSONObject(body.get());
            if (isThrottled(parsed)) {
                run.markRateLimited();
            }
            JSONArray items = parsed.optJSONArray("items");
            List<JSONObject> sorted = new ArrayList<>();
            for (int i = 0; items != null && i < items.length(); i++) {
                JSONObject item = items.optJSONObject(i);
                if (item != null) {
                    sorted.add(item);
                }
            }
            sorted.sort((a, b) -> Integer.compare(b.optInt("answer_score", 0), a.optInt("answer_score", 0)));
            for (JSONObject item : sorted) {
                tags.add(item.optString("tag_name", ""));
            }
        }
        List<String> skills = new ArrayList<>();
        for (String t : tags) {
            String canonical = SkillExtractor.canonical(t.replace('-', ' '));
            skills.add(canonical.isEmpty() ? t : canonical);
        }
        return SkillExtractor.merge(MAX_SKILLS, List.of(SkillExtractor.canonical(searchTag)), skills);
    }

    boolean passesAccountScreen(JSONObject user, int postCount) {
        if (user.optInt("reputation", 0) < MIN_REPUTATION) {
            return false;
        }
        long created = user.optLong("creation_date", 0L);
        if (created > 0L && Duration.between(Instant.ofEpochSecond(created), now()).toDays() < MIN_ACCOUNT_DAYS) {
            return false;
        }
        return postCount > 0;
    }

    /**
     * Returns null when the account shows neither profile text, skills nor activity within a year.
     */
    RawCandidateRecord toRecord(JSONObject user, String tag, int posts, List<String> skills, SearchCriteria criteria) {
        String userId = String.valueOf(user.optLong("user_id", 0L));
        String name = unescape(user.optString("display_name", ""));
        int reputation = user.optInt("reputation", 0);
        long lastAccess = user.optLong("last_access_date", 0L);
        Instant lastActive = lastAccess > 0L ? Instant.ofEpochSecond(lastAccess) : null;
        String aboutMe = Jsoup.parse(user.optString("about_me", "")).text();
        if (!looksLikeActiveDeveloper(aboutMe, skills.size(), lastActive)) {
            return null;
        }
        String summary = String.format(Locale.US,
                "Stack Overflow contributor with %,d reputation and %d answers in [%s].", reputation, posts, tag);
        long created = user.optLong("creation_date", 0L);
        double ageYears = created > 0L ? Duration.between(Instant.ofEpochSecond(created), now()).toDays() / 365.25 : 0.0;
        String website = user.optString("website_url", "");
        return RawCandidateRecord.builder()
                .platform(NAME)
                .platformId(userId)
                .profileUrl(user.optString("link", "https://stackoverflow.com/users/" + userId))
                .name(name)
                .title(skills.isEmpty() ? "Software Developer" : skills.get(0) + " Developer")
                .location(unescape(user.optString("location", "")))
                .avatarUrl(user.optString("profile_image", ""))
                .summary(summary)
                .stackoverflowId(userId)
                .githubUsername(githubUser(website))
                .linkedinUrl(website.toLowerCase(Locale.ROOT).contains("linkedin.com/in/") ? website : "")
                .skills(skills)
                .lastActive(lastActive)
                .experienceYears(Math.max(1.0, Math.min(15.0, Math.floor(ageYears))))
                .reputationPoints(reputation)
                .sourceRank(termHits(criteria, skills) * 15.0 + Math.min(reputation / 1000.0, 100.0))
                .build();
    }

    private static boolean isThrottled(JSONObject body) {
        return body.has("backoff") || (body.has("quota_remaining") && body.optInt("quota_remaining", 1) <= 0);
    }

    private String keyParam() {
        return key.isEmpty() ? "" : "&key=" + encode(key);
    }

    static String unescape(String html) {
        return html == null ? "" : Parser.unescapeEntities(html, false).trim();
    }

    private static String githubUser(String website) {
        if (website == null || website.isBlank()) {
            return "";
        }
        Matcher m = GITHUB_USER.matcher(website.trim());
        return m.find() ? m.group(1) : "";
    }
}
