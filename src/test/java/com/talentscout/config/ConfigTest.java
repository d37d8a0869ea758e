package com.talentscout.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigTest {

    @Test
    void fromMap_shouldFlattenNestedKeysAndLists() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "orchestrator", Map.of("max_sources", 2),
                "pipeline", Map.of("default_sources", List.of("github", "devto"))
        ));

        assertEquals(2, config.getInt("orchestrator.max_sources", 4));
        assertEquals(List.of("github", "devto"), config.getList("pipeline.default_sources"));
    }

    @Test
    void missingKeysShouldFallBackToDefaults() {
        Config config = Config.fromMap(Path.of("."), Map.of());

        assertEquals(70, config.getInt("orchestrator.max_time_budget_sec", 0));
        assertEquals(20, config.getInt("orchestrator.max_records_per_source", 0));
        assertEquals(40.0, config.getDouble("score.weight.skill_match", 0.0), 1e-9);
        assertEquals(List.of("github", "stackoverflow", "linkedin", "google"), config.getList("pipeline.default_sources"));
        assertEquals("20", config.getString("risk.penalty.low_score"));
        assertEquals("fallback", config.getString("not.a.key", "fallback"));
    }

    @Test
    void unparsableNumbersShouldUseFallback() {
        Config config = Config.fromMap(Path.of("."), Map.of("collector.retry_backoff_ms", "soon"));

        assertEquals(123L, config.getLong("collector.retry_backoff_ms", 123L));
        assertEquals(7, config.getInt("collector.retry_backoff_ms", 7));
    }

    @Test
    void getSecret_shouldPreferConfigValue() {
        Config config = Config.fromMap(Path.of("."), Map.of("github.token", "  abc  "));

        assertEquals("abc", config.getSecret("github.token", "GITHUB_TOKEN"));
        assertEquals("", config.getSecret("google.api_key", "TALENTSCOUT_TEST_UNSET_VARIABLE"));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDir() {
        Path root = Path.of("/tmp/talentscout");
        Config config = Config.fromMap(root, Map.of("outputs.dir", "out/run"));

        assertEquals(root.resolve("out/run").normalize(), config.getPath("outputs.dir"));
    }
}
