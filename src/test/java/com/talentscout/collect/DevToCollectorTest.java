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

class DevToCollectorTest {
    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");

    private final Config config = Config.fromMap(Path.of("."), Map.of(
            "collector", Map.of("retry_backoff_ms", 0, "deadline_reserve_ms", 0)
    ));

    @Test
    void collect_shouldAggregateArticlesPerAuthor() {
        JSONArray articles = new JSONArray()
                .put(article("ferris", 250, "2026-09-15T10:00:00Z", "rust", "webassembly"))
                .put(article("ferris", 50, "2026-08-01T00:00:00Z", "rust"));
        StubHttpClient http = new StubHttpClient()
                .reply("/articles\\?tag=rust&", articles.toString())
                .reply("/users/by_username\\?url=ferris", new JSONObject()
                        .put("username", "ferris")
                        .put("name", "Ferris Crab")
                        .put("summary", "Systems programmer writing about Rust and WebAssembly.")
                        .put("location", "Portland")
                        .put("github_username", "ferris-gh")
                        .toString());
        SearchCriteria criteria = SearchCriteria.builder().query("rust").skills(List.of("Rust")).build();

        SourceOutcome outcome = new DevToCollector(config, http, Clock.fixed(NOW, ZoneOffset.UTC))
                .collect(criteria, Deadline.after(Duration.ofSeconds(10)));

        assertFalse(outcome.hasError());
        assertEquals(1, outcome.records.size());
        assertEquals(1, http.count("/users/by_username"));
        RawCandidateRecord r = outcome.records.get(0);
        assertEquals("devto:ferris", r.key());
        assertEquals("Ferris Crab", r.name);
        assertEquals("ferris-gh", r.githubUsername);
        assertEquals(30, r.followers);
        assertEquals(Instant.parse("2026-09-15T10:00:00Z"), r.lastActive);
        assertEquals("Rust", r.skills.get(0));
        assertEquals("Rust Developer", r.title);
    }

    @Test
    void tags_shouldSlugTermsOrUseDefaults() {
        SearchCriteria criteria = SearchCriteria.builder().query("x").skills(List.of("Node.js", "React", "Go", "Vue")).build();

        assertEquals(List.of("nodejs", "react", "go"), DevToCollector.tags(criteria, 3));
        assertEquals(List.of("javascript", "python", "webdev"),
                DevToCollector.tags(SearchCriteria.builder().query("anyone").build(), 3));
    }

    private static JSONObject article(String username, int reactions, String publishedAt, String... tags) {
        return new JSONObject()
                .put("user", new JSONObject().put("username", username))
                .put("public_reactions_count", reactions)
                .put("published_at", publishedAt)
                .put("tag_list", new JSONArray(List.of(tags)));
    }
}
