package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.data.http.HttpClientEx;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Professional-network profiles through a synchronous Apify people-search actor run.
 */
public final class LinkedInCollector extends AbstractSourceCollector {
    public static final String NAME = "linkedin";

    private static final Pattern YEARS = Pattern.compile("(\\d+)\\s*yrs?");
    private static final Pattern MONTHS = Pattern.compile("(\\d+)\\s*mos?");
    private static final Pattern SLUG = Pattern.compile("linkedin\\.com/in/([^/?#]+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> DEVELOPER_KEYWORDS = List.of(
            "developer", "engineer", "programmer", "architect", "software", "technical", "coding", "programming",
            "full stack", "backend", "frontend", "devops", "data scien"
    );
    private static final int MAX_SKILLS = 12;
    private static final int MAX_SUMMARY = 350;

    private final String apiBase;
    private final String actorId;
    private final String token;
    private final int maxResults;

    public LinkedInCollector(Config config, HttpClientEx http) {
        this(config, http, Clock.systemUTC());
    }

    public LinkedInCollector(Config config, HttpClientEx http, Clock clock) {
        super(config, http, clock);
        this.apiBase = config.getString("linkedin.api_base", "https://api.apify.com/v2");
        this.actorId = config.getString("linkedin.actor_id", "clever-lemon~linkedin-people-search-scraper");
        this.token = config.getSecret("linkedin.apify_token", "APIFY_API_KEY");
        this.maxResults = Math.max(1, config.getInt("linkedin.max_results", 20));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String configurationProblem() {
        return token.isEmpty() ? "linkedin collector not configured (apify token required)" : "";
    }

    @Override
    protected void gather(SearchCriteria criteria, Deadline deadline, CollectionRun run) throws InterruptedException {
        long actorTimeoutSec = Math.max(1L, deadline.remainingMs() / 1000L);
        String url = apiBase + "/acts/" + actorId + "/run-sync-get-dataset-items?timeout=" + actorTimeoutSec;

        JSONObject input = new JSONObject();
        input.put("searchKeywords", searchKeywords(criteria));
        input.put("maxProfiles", maxResults);
        input.put("includeContactInfo", false);
        if (criteria.hasLocation()) {
            input.put("locations", new JSONArray(List.of(criteria.location)));
        }

        JSONArray profiles = new JSONArray(post(url, input.toString(), Map.of("Authorization", "Bearer " + token), deadline));
        for (int i = 0; i < profiles.length() && !run.isFull(maxResults); i++) {
            JSONObject profile = profiles.optJSONObject(i);
            if (profile == null) {
                continue;
            }
            String profileUrl = firstNonBlank(profile.optString("profileUrl", ""), profile.optString("url", ""));
            String id = firstNonBlank(profile.optString("publicIdentifier", ""), slug(profileUrl), profileUrl);
            if (!run.markSeen(id)) {
                continue;
            }
            run.countScreened();
            RawCandidateRecord record = toRecord(profile, id, profileUrl, criteria);
            if (record != null) {
                run.add(record);
            }
        }
    }

    static String searchKeywords(SearchCriteria criteria) {
        List<String> parts = new ArrayList<>();
        List<String> terms = criteria.skills.isEmpty() ? List.of(criteria.query) : criteria.skills;
        parts.addAll(terms.subList(0, Math.min(3, terms.size())));
        parts.add("developer");
        return String.join(" ", parts).trim();
    }

    RawCandidateRecord toRecord(JSONObject p, String id, String profileUrl, SearchCriteria criteria) {
        String name = firstNonBlank(p.optString("fullName", ""), p.optString("name", ""));
        if (name.length() < 2) {
            return null;
        }
        String headline = firstNonBlank(p.optString("headline", ""), p.optString("title", ""));
        String about = firstNonBlank(p.optString("summary", ""), p.optString("about", ""));
        String text = (headline + " " + about).toLowerCase(Locale.ROOT);
        boolean developer = false;
        for (String keyword : DEVELOPER_KEYWORDS) {
            if (text.contains(keyword)) {
                developer = true;
                break;
            }
        }

        List<String> listed = new ArrayList<>();
        JSONArray skillArray = p.optJSONArray("skills");
        for (int i = 0; skillArray != null && i < skillArray.length(); i++) {
            Object raw = skillArray.opt(i);
            String skill = raw instanceof JSONObject obj ? obj.optString("name", "") : String.valueOf(raw);
            if (!skill.isBlank()) {
                listed.add(SkillExtractor.canonical(skill));
            }
        }
        List<String> skills = SkillExtractor.merge(MAX_SKILLS, listed, SkillExtractor.extract(headline, about));
        if (!developer && skills.isEmpty()) {
            return null;
        }
        if (!looksLikeActiveDeveloper(about.isEmpty() ? headline : about, skills.size(), null)) {
            return null;
        }

        int connections = p.optInt("connectionsCount", p.optInt("connections", 0));
        return RawCandidateRecord.builder()
                .platform(NAME)
                .platformId(id)
                .profileUrl(profileUrl)
                .name(name)
                .title(headline)
                .location(p.optString("location", ""))
                .avatarUrl(firstNonBlank(p.optString("profilePicture", ""), p.optString("profileImage", ""),
                        p.optString("photoUrl", "")))
                .email(p.optString("email", ""))
                .summary(truncate(about.isEmpty() ? headline : about, MAX_SUMMARY))
                .linkedinUrl(profileUrl)
                .skills(skills)
                .experienceYears(experienceYears(p.optJSONArray("experience")))
                .connections(connections)
                .sourceRank(termHits(criteria, skills) * 15.0 + Math.min(connections / 10.0, 100.0))
                .build();
    }

    /**
     * Sum of "N yrs M mos" durations across positions, in years. Zero when nothing parses.
     */
    static double experienceYears(JSONArray experience) {
        if (experience == null) {
            return 0.0;
        }
        int months = 0;
        for (int i = 0; i < experience.length(); i++) {
            JSONObject position = experience.optJSONObject(i);
            String duration = position == null ? "" : position.optString("duration", "");
            Matcher y = YEARS.matcher(duration);
            Matcher m = MONTHS.matcher(duration);
            months += (y.find() ? Integer.parseInt(y.group(1)) * 12 : 0) + (m.find() ? Integer.parseInt(m.group(1)) : 0);
        }
        return Math.round(months / 12.0 * 10.0) / 10.0;
    }

    private static String slug(String url) {
        Matcher m = SLUG.matcher(url == null ? "" : url);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }
}
