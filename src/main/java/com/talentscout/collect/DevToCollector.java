package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Developer-community authors: top articles per tag on dev.to, then each author's profile.
 */
public final class DevToCollector extends AbstractSourceCollector {
    public static final String NAME = "devto";

    private static final List<String> DEFAULT_TAGS = List.of("javascript", "python", "webdev");
    private static final int MAX_SKILLS = 10;
    private static final int MAX_SUMMARY = 350;

    private final String apiBase;
    private final int perPage;
    private final int maxTags;
    private final int maxCandidates;

    public DevToCollector(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    public DevToCollector(Config config, HttpClientEx http, Clock clock) {
        super(config, http, clock);
        this.apiBase = config.getString("devto.api_base", "https://dev.to/api");
        this.perPage = Math.max(1, config.getInt("devto.per_page", 30));
        this.maxTags = Math.max(1, config.getInt("devto.max_tags", 3));
        this.maxCandidates = Math.max(1, config.getInt("devto.max_candidates", 20));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run) throws InterruptedException {
        for (String tag : tags(criteria, maxTags)) {
            if (run.isFull(maxCandidates)) {
                return;
            }
            String url = apiBase + "/articles?tag=" + encode(tag) + "&per_page=" + perPage + "&top=7";
            JSONArray articles = new JSONArray(fetch(url, Map.of(), deadline));

            Map<String, AuthorActivity> authors = new LinkedHashMap<>();
            for (int i = 0; i < articles.length(); i++) {
                JSONObject article = articles.optJSONObject(i);
                JSONObject user = article == null ? null : article.optJSONObject("user");
                if (user == null) {
                    continue;
                }
                String username = user.optString("username", "");
                if (username.isEmpty()) {
                    continue;
                }
                AuthorActivity activity = authors.computeIfAbsent(username, ignored -> new AuthorActivity());
                activity.addArticle(article);
            }

            for (Map.Entry<String, AuthorActivity> e : authors.entrySet()) {
                if (run.isFull(maxCandidates)) {
                    break;
                }
                if (!run.markSeen(e.getKey())) {
                    continue;
                }
                run.countScreened();
                Optional<String> body = fetchOptional(apiBase + "/users/by_username?url=" + encode(e.getKey()),
                        Map.of(), deadline, run);
                if (body.isEmpty()) {
                    continue;
                }
                RawCandidateRecord record = toRecord(new JSONObject(body.get()), e.getValue(), criteria);
                if (record != null) {
                    run.add(record);
                }
            }
        }
    }

    static List<String> tags(SearchCriteria criteria, int max) {
        List<String> out = new ArrayList<>();
        for (String term : criteria.terms()) {
            String tag = term.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
            if (!tag.isEmpty() && !out.contains(tag)) {
                out.add(tag);
            }
        }
        if (out.isEmpty()) {
            out.addAll(DEFAULT_TAGS);
        }
        return out.size() > max ? List.copyOf(out.subList(0, max)) : List.copyOf(out);
    }

    RawCandidateRecord toRecord(JSONObject user, AuthorActivity activity, SearchCriteria criteria) {
        String username = user.optString("username", "");
        String summary = user.optString("summary", "");
        List<String> skills = SkillExtractor.merge(MAX_SKILLS, activity.tagSkills(), SkillExtractor.extract(summary));
        if (!looksLikeActiveDeveloper(summary, skills.size(), activity.lastPublished)) {
            return null;
        }
        String website = user.optString("website_url", "");
        return RawCandidateRecord.builder()
                .platform(NAME)
                .platformId(username)
                .profileUrl("https://dev.to/" + username)
                .name(firstNonBlank(user.optString("name", ""), username))
                .title(skills.isEmpty() ? "Software Developer" : skills.get(0) + " Developer")
                .location(user.optString("location", ""))
                .avatarUrl(user.optString("profile_image", ""))
                .summary(truncate(summary.isEmpty()
                        ? "Technical writer on dev.to with " + activity.articles + " top articles." : summary, MAX_SUMMARY))
                .githubUsername(user.optString("github_username", ""))
                .linkedinUrl(website.toLowerCase(Locale.ROOT).contains("linkedin.com/in/") ? website : "")
                .skills(skills)
                .lastActive(activity.lastPublished)
                .followers(activity.reactions / 10)
                .sourceRank(termHits(criteria, skills) * 15.0 + Math.min(activity.reactions / 10.0, 100.0))
                .build();
    }

    /**
     * What the tag listing tells us about one author before the profile fetch.
     */
    static final class AuthorActivity {
        private final List<String> tags = new ArrayList<>();
        private Instant lastPublished;
        private int reactions;
        private int articles;

        void addArticle(JSONObject article) {
            articles++;
            reactions += Math.max(0, article.optInt("public_reactions_count", article.optInt("positive_reactions_count", 0)));
            Instant published = parseInstant(article.optString("published_at", ""));
            if (published != null && (lastPublished == null || published.isAfter(lastPublished))) {
                lastPublished = published;
            }
            JSONArray tagList = article.optJSONArray("tag_list");
            for (int i = 0; tagList != null && i < tagList.length(); i++) {
                tags.add(tagList.optString(i, ""));
            }
        }

        List<String> tagSkills() {
            List<String> out = new ArrayList<>();
            for (String tag : tags) {
                if (!tag.isBlank()) {
                    out.add(SkillExtractor.canonical(tag));
                }
            }
            return out;
        }
    }
}
