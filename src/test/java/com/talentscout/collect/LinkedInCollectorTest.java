package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.core.Deadline;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceFailureReason;
import com.talentscout.model.SourceOutcome;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkedInCollectorTest {
    private static final String ACTOR_RUN = "/acts/[^/]+/run-sync-get-dataset-items\\?timeout=\\d+";

    private final Config config = Config.fromMap(Path.of("."), Map.of(
            "linkedin", Map.of("apify_token", "tok"),
            "collector", Map.of("retry_backoff_ms", 0, "deadline_reserve_ms", 0)
    ));
    private final SearchCriteria criteria = SearchCriteria.builder()
            .query("java backend")
            .location("Bengaluru")
            .skills(List.of("Java", "Spring"))
            .build();

    @Test
    void collect_shouldPostActorInputAndFilterNonDevelopers() {
        JSONArray dataset = new JSONArray()
                .put(new JSONObject()
                        .put("fullName", "Priya Raman")
                        .put("headline", "Senior Backend Engineer at Fintech")
                        .put("location", "Bengaluru, India")
                        .put("profileUrl", "https://www.linkedin.com/in/priya-raman")
                        .put("publicIdentifier", "priya-raman")
                        .put("summary", "Backend engineer working with Java, Spring and Kafka on payment systems.")
                        .put("skills", new JSONArray().put(new JSONObject().put("name", "Java")).put("Kubernetes"))
                        .put("connectionsCount", 500)
                        .put("experience", new JSONArray()
                                .put(new JSONObject().put("duration", "3 yrs 2 mos"))
                                .put(new JSONObject().put("duration", "1 yr 10 mos"))))
                .put(new JSONObject()
                        .put("fullName", "Mario Rossi")
                        .put("headline", "Head chef")
                        .put("summary", "Cooking Italian food")
                        .put("profileUrl", "https://www.linkedin.com/in/mario"));
        StubHttpClient http = new StubHttpClient().reply(ACTOR_RUN, dataset.toString());

        SourceOutcome outcome = new LinkedInCollector(config, http).collect(criteria, Deadline.after(Duration.ofSeconds(10)));

        assertEquals(2, outcome.totalFound);
        assertEquals(1, outcome.records.size());
        RawCandidateRecord r = outcome.records.get(0);
        assertEquals("linkedin:priya-raman", r.key());
        assertEquals("https://www.linkedin.com/in/priya-raman", r.linkedinUrl);
        assertEquals(List.of("Java", "Kubernetes", "Spring", "Kafka"), r.skills);
        assertEquals(5.0, r.experienceYears, 1e-9);
        assertEquals(500, r.connections);

        JSONObject input = new JSONObject(http.posted.get(0));
        assertEquals("Java Spring developer", input.getString("searchKeywords"));
        assertEquals("Bengaluru", input.getJSONArray("locations").getString(0));
        assertEquals(false, input.getBoolean("includeContactInfo"));
    }

    @Test
    void missingTokenShouldReportNotConfigured() {
        SourceOutcome outcome = new LinkedInCollector(Config.fromMap(Path.of("."), Map.of()), new StubHttpClient())
                .collect(criteria, Deadline.after(Duration.ofSeconds(10)));

        assertEquals(SourceFailureReason.NOT_CONFIGURED, outcome.failureReason);
        assertTrue(outcome.records.isEmpty());
    }

    @Test
    void experienceYears_shouldSumDurations() {
        JSONArray experience = new JSONArray()
                .put(new JSONObject().put("duration", "2 yrs 6 mos"))
                .put(new JSONObject().put("duration", "8 mos"))
                .put(new JSONObject().put("duration", "1 yr"))
                .put(new JSONObject().put("title", "no duration"));

        assertEquals(4.2, LinkedInCollector.experienceYears(experience), 1e-9);
        assertEquals(0.0, LinkedInCollector.experienceYears(null), 1e-9);
    }

    @Test
    void searchKeywords_shouldFallBackToQuery() {
        assertEquals("rust embedded developer",
                LinkedInCollector.searchKeywords(SearchCriteria.builder().query("rust embedded").build()));
    }
}
