package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Code-hosting profiles from the GitHub REST API: user search, then per-user detail and recent repositories.
 */
public final class GitHubCollector extends AbstractSourceCollector {
    public static final String NAME = "github";

    private static final int MAX_SKILLS = 12;
    private static final int MAX_SUMMARY = 350;

    private final String apiBase;
    private final String token;
    private final int perPage;
    private final int maxPages;
    private final int maxQueries;
    private final int maxCandidates;

    public GitHubCollector(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    public GitHubCollector(Config config, HttpClientEx http, Clock clock) {
        super(config, http, clock);
        this.apiBase = config.getString("github.api_base", "https://api.github.com");
        this.token = config.getSecret("github.token", "GITHUB_TOKEN");
        this.perPage = Math.max(1, config.getInt("github.per_page", 15));
        this.maxPages = Math.max(1, config.getInt("github.max_pages", 2));
        this.maxQueries = Math.max(1, config.getInt("github.max_queries", 4));
        this.maxCandidates = Math.max(1, config.getInt("github.max_candidates", 20));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run) throws InterruptedException {
        Map<String, String> headers = headers();
        for (String query : GitHubQueryBuilder.build(criteria, maxQueries)) {
            for (int page = 1; page <= maxPages; page++) {
                if (run.isFull(maxCandidates)) {
                    return;
                }
                String url = apiBase + "/search/users?q=" + encode(query)
                        + "&sort=followers&order=desc&per_page=" + perPage + "&page=" + page;
                JSONObject body = new JSONObject(fetch(url, headers, deadline));
                JSONArray items = body.optJSONArray("items");
                if (items == null || items.isEmpty()) {
                    break;
                }
                for (int i = 0; i < items.length() && !run.isFull(maxCandidates); i++) {
                    JSONObject item = items.optJSONObject(i);
                    if (item == null) {
                        continue;
                    }
                    String login = item.optString("login", "");
                    if (!run.markSeen(login)) {
                        continue;
                    }
                    run.countScreened();
                    if (!"User".equals(item.optString("type", "User")) || item.optBoolean("site_admin", false)) {
                        continue;
                    }
                    RawCandidateRecord record = enrich(login, criteria, headers, deadline, run);
                    if (record != null) {
                        run.add(record);
                    }
                }
                if (items.length() < perPage) {
                    break;
                }
            }
        }
    }

    private RawCandidateRecord enrich(
            String login,
            SearchCriteria criteria,
            Map<String, String> headers,
            Deadline deadline,
            CollectionRun run
    ) throws InterruptedException {
        Optional<String> detailBody = fetchOptional(apiBase + "/users/" + encode(login), headers, deadline, run);
        if (detailBody.isEmpty()) {
            return null;
        }
        JSONObject user = new JSONObject(detailBody.get());
        if (!passesAccountScreen(user)) {
            log.debug("github user={} rejected by account screen", login);
            return null;
        }

        JSONArray repos = fetchOptional(apiBase + "/users/" + encode(login) + "/repos?sort=updated&per_page=10",
                headers, deadline, run)
                .map(JSONArray::new)
                .orElseGet(JSONArray::new);

        String bio = user.optString("bio", "").trim();
        Map<String, Integer> languageCounts = new LinkedHashMap<>();
        List<String> repoText = new ArrayList<>();
        int stars = 0;
        int forks = 0;
        Instant lastPush = null;
        for (int i = 0; i < repos.length(); i++) {
            JSONObject repo = repos.optJSONObject(i);
            if (repo == null || repo.optBoolean("fork", false)) {
                continue;
            }
            String language = SkillExtractor.canonical(repo.optString("language", ""));
            if (!language.isEmpty()) {
                languageCounts.merge(language, 1, Integer::sum);
            }
            repoText.add(repo.optString("name", "").replace('-', ' ').replace('_', ' '));
            repoText.add(repo.optString("description", ""));
            JSONArray topics = repo.optJSONArray("topics");
            if (topics != null) {
                repoText.add(String.join(" ", topics.toList().stream().map(String::valueOf).toList()));
            }
            stars += Math.max(0, repo.optInt("stargazers_count", 0));
            forks += Math.max(0, repo.optInt("forks_count", 0));
            Instant pushed = parseInstant(repo.optString("pushed_at", ""));
            if (pushed != null && (lastPush == null || pushed.isAfter(lastPush))) {
                lastPush = pushed;
            }
        }

        List<String> languages = new ArrayList<>(languageCounts.keySet());
        languages.sort((a, b) -> Integer.compare(languageCounts.get(b), languageCounts.get(a)));
        List<String> skills = SkillExtractor.merge(MAX_SKILLS,
                SkillExtractor.extract(bio),
                languages,
                SkillExtractor.extract(repoText.toArray(new String[0])));

        Instant updatedAt = parseInstant(user.optString("updated_at", ""));
        Instant lastActive = latest(lastPush, updatedAt);
        if (!looksLikeActiveDeveloper(bio, skills.size(), lastPush)) {
            log.debug("github user={} rejected: no bio, skills or recent repos", login);
            return null;
        }

        int publicRepos = user.optInt("public_repos", 0);
        int followers = user.optInt("followers", 0);
        String topLanguage = languages.isEmpty() ? "" : languages.get(0);
        String title = topLanguage.isEmpty() ? "Software Developer" : topLanguage + " Developer";
        String summary = bio.isEmpty()
                ? String.format(Locale.US, "Developer with %d public repositories%s.", publicRepos,
                        topLanguage.isEmpty() ? "" : ", mostly " + topLanguage)
                : bio;

        return RawCandidateRecord.builder()
                .platform(NAME)
                .platformId(login)
                .profileUrl(user.optString("html_url", "https://github.com/" + login))
                .name(firstNonBlank(user.optString("name", ""), login))
                .title(title)
                .location(firstNonBlank(user.optString("location", "")))
                .avatarUrl(user.optString("avatar_url", ""))
                .email(firstNonBlank(user.optString("email", "")))
                .summary(truncate(summary, MAX_SUMMARY))
                .githubUsername(login)
                .linkedinUrl(linkedinFromBlog(user.optString("blog", "")))
                .skills(skills)
                .lastActive(lastActive)
                .experienceYears(experienceYears(parseInstant(user.optString("created_at", "")), publicRepos))
                .followers(followers)
                .stars(stars)
                .forks(forks)
                .repoCount(publicRepos)
                .sourceRank(termHits(criteria, skills) * 15.0 + Math.min(followers * 2.0, 100.0))
                .build();
    }

    /**
     * Rejects organizations, admins, empty or very new accounts, and follower-farm patterns.
     */
    boolean passesAccountScreen(JSONObject user) {
        if (!"User".equals(user.optString("type", "")) || user.optBoolean("site_admin", false)) {
            return false;
        }
        int repos = user.optInt("public_repos", 0);
        int followers = user.optInt("followers", 0);
        int following = user.optInt("following", 0);
        if (repos <= 0) {
            return false;
        }
        Instant created = parseInstant(user.optString("created_at", ""));
        if (created != null && Duration.between(created, now()).toDays() < 30) {
            return false;
        }
        if (followers > 1000 && repos < 5) {
            return false;
        }
        return !(following > 2000 && followers < 100);
    }

    double experienceYears(Instant createdAt, int publicRepos) {
        double ageYears = createdAt == null ? 0.0 : Duration.between(createdAt, now()).toDays() / 365.25;
        double estimate = Math.floor(ageYears + publicRepos / 10.0);
        return Math.max(1.0, Math.min(15.0, estimate));
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (!token.isEmpty()) {
            headers.put("Authorization", "Bearer " + token);
        }
        return headers;
    }

    private static String linkedinFromBlog(String blog) {
        return blog != null && blog.toLowerCase(Locale.ROOT).contains("linkedin.com/in/") ? blog.trim() : "";
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
