package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceOutcome;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StackOverflowCollectorTest {
    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");
    private static final String TOP_ANSWERERS = "/tags/python/top-answerers/all_time\\?";
    private static final String USERS = "/users/101\\?";
    private static final String TOP_TAGS = "/users/101/top-answer-tags\\?";

    private final Config config = Config.fromMap(Path.of("."), Map.of(
            "stackoverflow", Map.of("max_tags", 1),
            "collector", Map.of("retry_backoff_ms", 0, "deadline_reserve_ms", 0)
    ));
    private final SearchCriteria criteria = SearchCriteria.builder()
            .query("python engineer")
            .skills(List.of("Python"))
            .build();

    @Test
    void collect_shouldMapTopAnswerersToRecords() {
        StubHttpClient http = new StubHttpClient()
                .reply(TOP_ANSWERERS, topAnswerers(false))
                .reply(USERS, users())
                .reply(TOP_TAGS, new JSONObject().put("items", new JSONArray()
                        .put(new JSONObject().put("tag_name", "django").put("answer_score", 50))
                        .put(new JSONObject().put("tag_name", "python").put("answer_score", 300))).toString());

        SourceOutcome outcome = collector(http).collect(criteria, Deadline.after(Duration.ofSeconds(10)));

        assertFalse(outcome.hasError());
        assertEquals(1, outcome.records.size());
        RawCandidateRecord r = outcome.records.get(0);
        assertEquals("stackoverflow:101", r.key());
        assertEquals("José García", r.name);
        assertEquals("101", r.stackoverflowId);
        assertEquals("jgarcia", r.githubUsername);
        assertEquals(List.of("Python", "Django"), r.skills);
        assertEquals("Python Developer", r.title);
        assertEquals(15000, r.reputationPoints);
        assertEquals(Instant.parse("2026-09-28T00:00:00Z"), r.lastActive);
        assertEquals(11.0, r.experienceYears, 1e-9);
    }

    @Test
    void throttledResponseShouldStopAfterCurrentTag() {
        StubHttpClient http = new StubHttpClient()
                .reply(TOP_ANSWERERS, topAnswerers(true))
                .reply(USERS, users());

        SourceOutcome outcome = collector(http).collect(criteria, Deadline.after(Duration.ofSeconds(10)));

        assertFalse(outcome.hasError());
        assertTrue(outcome.rateLimited);
        assertEquals(1, outcome.records.size());
        assertEquals(List.of("python"), outcome.records.get(0).skills);
        assertEquals(0, http.count(TOP_TAGS));
    }

    @Test
    void accountScreenShouldRequireReputationAgeAndPosts() {
        StackOverflowCollector collector = collector(new StubHttpClient());
        long old = Instant.parse("2020-01-01T00:00:00Z").getEpochSecond();
        long fresh = NOW.minus(Duration.ofDays(2)).getEpochSecond();

        assertTrue(collector.passesAccountScreen(new JSONObject().put("reputation", 500).put("creation_date", old), 3));
        assertFalse(collector.passesAccountScreen(new JSONObject().put("reputation", 10).put("creation_date", old), 3));
        assertFalse(collector.passesAccountScreen(new JSONObject().put("reputation", 500).put("creation_date", fresh), 3));
        assertFalse(collector.passesAccountScreen(new JSONObject().put("reputation", 500).put("creation_date", old), 0));
    }

    @Test
    void toRecord_shouldDropDormantAccountsWithoutSkillsOrProfileText() {
        StackOverflowCollector collector = collector(new StubHttpClient());
        JSONObject dormant = new JSONObject()
                .put("user_id", 202)
                .put("display_name", "Quiet Answerer")
                .put("reputation", 800)
                .put("creation_date", Instant.parse("2016-01-01T00:00:00Z").getEpochSecond())
                .put("last_access_date", Instant.parse("2023-06-01T00:00:00Z").getEpochSecond());

        assertNull(collector.toRecord(dormant, "python", 12, List.of(), criteria));

        JSONObject described = new JSONObject(dormant.toString())
                .put("about_me", "<p>Backend engineer writing Python services.</p>");
        RawCandidateRecord kept = collector.toRecord(described, "python", 12, List.of(), criteria);
        assertNotNull(kept);
        assertTrue(kept.summary.contains("800 reputation"));

        RawCandidateRecord skilled = collector.toRecord(dormant, "python", 12, List.of("Python"), criteria);
        assertNotNull(skilled);
    }

    @Test
    void unescapeShouldDecodeHtmlEntities() {
        assertEquals("O'Brien & Sons", StackOverflowCollector.unescape("O&#39;Brien &amp; Sons "));
        assertEquals("", StackOverflowCollector.unescape(null));
    }

    private static String topAnswerers(boolean throttled) {
        JSONObject body = new JSONObject().put("items", new JSONArray()
                .put(new JSONObject()
                        .put("post_count", 40)
                        .put("user", new JSONObject().put("user_id", 101).put("user_type", "registered"))));
        if (throttled) {
            body.put("backoff", 10);
        }
        return body.toString();
    }

    private static String users() {
        return new JSONObject().put("items", new JSONArray().put(new JSONObject()
                .put("user_id", 101)
                .put("display_name", "Jos&#233; Garc&#237;a")
                .put("reputation", 15000)
                .put("creation_date", Instant.parse("2015-01-01T00:00:00Z").getEpochSecond())
                .put("last_access_date", Instant.parse("2026-09-28T00:00:00Z").getEpochSecond())
                .put("location", "Madrid, Spain")
                .put("website_url", "https://github.com/jgarcia")
                .put("link", "https://stackoverflow.com/users/101/jose-garcia"))).toString();
    }

    private StackOverflowCollector collector(StubHttpClient http) {
        return new StackOverflowCollector(config, http, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
