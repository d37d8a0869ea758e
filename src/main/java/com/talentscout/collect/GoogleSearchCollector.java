package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import org.json.JSONArray;
import org.json.JSONObject;
import org.jsoup.Jsoup;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Web search over public profile pages via the Custom Search JSON API.
 * Records carry no activity date; GitHub and LinkedIn links become cross-platform identifiers.
 */
public final class GoogleSearchCollector extends AbstractSourceCollector {
    public static final String NAME = "google";

    private static final int MAX_SUMMARY = 350;
    private static final int RESULTS_PER_PAGE = 10;
    private static final Pattern TITLE_SPLIT = Pattern.compile("\\s+[-|–—]\\s+");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern LOCATION = Pattern.compile(
            "(?:Location|Located in|Based in|Lives in)[:\\s]+"
                    + "([A-Z][\\p{L}'-]+(?: [A-Z][\\p{L}'-]+)*(?:,\\s*[A-Z][\\p{L}'-]+(?: [A-Z][\\p{L}'-]+)*)?)");
    private static final Pattern LINKEDIN_PROFILE = Pattern.compile("linkedin\\.com/in/([^/?#]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GITHUB_PROFILE = Pattern.compile("^https?://(?:www\\.)?github\\.com/([A-Za-z0-9-]+)/?$",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> GITHUB_RESERVED = Set.of(
            "topics", "orgs", "search", "features", "about", "pricing", "marketplace", "explore", "collections",
            "sponsors", "trending", "login", "join", "settings", "enterprise"
    );
    private static final List<String> NON_PERSON_WORDS = List.of("jobs", "hiring", "salary", "careers", "top ", "best ");

    private final String apiBase;
    private final String apiKey;
    private final String engineId;
    private final int maxQueries;
    private final int maxPages;

    public GoogleSearchCollector(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    public GoogleSearchCollector(Config config, HttpClientEx http, Clock clock) {
        super(config, http, clock);
        this.apiBase = config.getString("google.api_base", "https://www.googleapis.com/customsearch/v1");
        this.apiKey = config.getSecret("google.api_key", "GOOGLE_API_KEY");
        this.engineId = config.getSecret("google.search_engine_id", "GOOGLE_CSE_ID");
        this.maxQueries = Math.max(1, config.getInt("google.max_queries", 3));
        this.maxPages = Math.max(1, config.getInt("google.max_pages", 1));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String configurationProblem() {
        if (apiKey.isEmpty() || engineId.isEmpty()) {
            return "google search not configured (api key and search engine id required)";
        }
        return "";
    }

    @Override
    protected void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run) throws InterruptedException {
        int position = 0;
        for (String query : buildQueries(criteria, maxQueries)) {
            for (int page = 0; page < maxPages; page++) {
                String url = apiBase + "?key=" + encode(apiKey) + "&cx=" + encode(engineId)
                        + "&q=" + encode(query) + "&num=" + RESULTS_PER_PAGE + "&start=" + (1 + page * RESULTS_PER_PAGE);
                JSONObject body = new JSONObject(fetch(url, Map.of(), deadline));
                JSONArray items = body.optJSONArray("items");
                if (items == null || items.isEmpty()) {
                    break;
                }
                for (int i = 0; i < items.length(); i++) {
                    JSONObject item = items.optJSONObject(i);
                    if (item == null) {
                        continue;
                    }
                    String link = normalizeLink(item.optString("link", ""));
                    if (!run.markSeen(link)) {
                        continue;
                    }
                    run.countScreened();
                    position++;
                    RawCandidateRecord record = extract(item, link, criteria, position);
                    if (record != null) {
                        run.add(record);
                    }
                }
                if (items.length() < RESULTS_PER_PAGE) {
                    break;
                }
            }
        }
    }

    static List<String> buildQueries(SearchCriteria criteria, int max) {
        String text = criteria.query.isEmpty()
                ? String.join(" ", criteria.terms().subList(0, Math.min(3, criteria.terms().size())))
                : criteria.query;
        String q = "\"" + text.replace("\"", "") + "\"";
        String loc = criteria.hasLocation() ? " \"" + criteria.location.replace("\"", "") + "\"" : "";
        List<String> queries = new ArrayList<>();
        queries.add("site:linkedin.com/in " + q + loc + " -\"jobs\"");
        queries.add("site:github.com " + q + loc);
        queries.add(q + loc + " developer portfolio resume");
        if (!criteria.skills.isEmpty()) {
            queries.add(q + " " + String.join(" ", criteria.skills) + loc + " software engineer -jobs -hiring");
        }
        return queries.size() > max ? List.copyOf(queries.subList(0, max)) : List.copyOf(queries);
    }

    RawCandidateRecord extract(JSONObject item, String link, SearchCriteria criteria, int position) {
        String pageTitle = item.optString("title", "");
        String[] parts = TITLE_SPLIT.split(pageTitle);
        String name = parts.length == 0 ? "" : parts[0].trim();
        if (!looksLikePersonName(name)) {
            return null;
        }
        String headline = parts.length > 1 && !parts[1].toLowerCase(Locale.ROOT).contains("linkedin") ? parts[1].trim() : "";

        String snippet = item.optString("htmlSnippet", "");
        snippet = snippet.isEmpty() ? item.optString("snippet", "") : Jsoup.parse(snippet).text();
        snippet = snippet.replaceAll("\\s+", " ").trim();

        String location = "";
        Matcher loc = LOCATION.matcher(snippet);
        if (loc.find()) {
            location = loc.group(1).trim();
        } else if (criteria.hasLocation() && snippet.toLowerCase(Locale.ROOT).contains(criteria.location.toLowerCase(Locale.ROOT))) {
            location = criteria.location;
        }
        Matcher mail = EMAIL.matcher(snippet);
        String email = mail.find() ? mail.group() : "";

        List<String> skills = SkillExtractor.extract(pageTitle, snippet);
        if (!looksLikeActiveDeveloper(snippet, skills.size(), null)) {
            return null;
        }

        Matcher li = LINKEDIN_PROFILE.matcher(link);
        Matcher gh = GITHUB_PROFILE.matcher(link);
        String githubUser = gh.find() && !GITHUB_RESERVED.contains(gh.group(1).toLowerCase(Locale.ROOT)) ? gh.group(1) : "";
        return RawCandidateRecord.builder()
                .platform(NAME)
                .platformId(link)
                .profileUrl(link)
                .name(name)
                .title(headline)
                .location(location)
                .email(email)
                .summary(truncate(snippet, MAX_SUMMARY))
                .linkedinUrl(li.find() ? link : "")
                .githubUsername(githubUser)
                .skills(skills)
                .sourceRank(termHits(criteria, skills) * 15.0 + Math.max(0, 100 - position))
                .build();
    }

    static String normalizeLink(String link) {
        if (link == null) {
            return "";
        }
        String out = link.trim();
        int cut = out.indexOf('?');
        if (cut >= 0) {
            out = out.substring(0, cut);
        }
        cut = out.indexOf('#');
        if (cut >= 0) {
            out = out.substring(0, cut);
        }
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static boolean looksLikePersonName(String name) {
        if (name.length() < 2 || name.split("\\s+").length > 5) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT) + " ";
        for (String word : NON_PERSON_WORDS) {
            if (lower.contains(word)) {
                return false;
            }
        }
        return true;
    }
}
