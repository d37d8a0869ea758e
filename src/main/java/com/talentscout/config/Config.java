package com.talentscout.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * <p>
 * Lookup order: working-dir {@code config.properties}, classpath {@code config.properties},
 * then the built-in defaults table. Blank values fall through to the next layer.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Map<String, String> environment;
    private final Path workingDir;

    private Config(Path workingDir, Map<String, String> environment) {
        this.workingDir = workingDir;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir, System.getenv());

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                Properties overrides = new Properties();
                overrides.load(in);
                config.props.putAll(overrides);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a config from an in-memory (possibly nested) map. No environment lookup.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir, Map.of());
        flattenInto(config, "", rawProperties);
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    /**
     * Resolves a credential: config key first, then the named environment variable.
     * Returns an empty string when neither is set.
     */
    public String getSecret(String key, String envName) {
        String value = getString(key);
        if (!value.isEmpty()) {
            return value;
        }
        String env = envName == null ? null : environment.get(envName);
        return env == null ? "" : env.trim();
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(item == null ? "" : String.valueOf(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, String.valueOf(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("pipeline.default_sources", "github,stackoverflow,linkedin,google");
        defaults.put("pipeline.default_limit", "50");
        defaults.put("pipeline.default_time_budget_sec", "60");

        defaults.put("orchestrator.max_sources", "4");
        defaults.put("orchestrator.max_time_budget_sec", "70");
        defaults.put("orchestrator.max_records_per_source", "20");

        defaults.put("collector.retry_backoff_ms", "400");
        defaults.put("collector.request_timeout_sec", "15");
        defaults.put("collector.deadline_reserve_ms", "750");

        defaults.put("github.api_base", "https://api.github.com");
        defaults.put("github.per_page", "15");
        defaults.put("github.max_pages", "2");
        defaults.put("github.max_queries", "4");
        defaults.put("github.max_candidates", "20");

        defaults.put("stackoverflow.api_base", "https://api.stackexchange.com/2.3");
        defaults.put("stackoverflow.page_size", "30");
        defaults.put("stackoverflow.max_tags", "3");
        defaults.put("stackoverflow.max_candidates", "20");

        defaults.put("google.api_base", "https://www.googleapis.com/customsearch/v1");
        defaults.put("google.max_queries", "3");
        defaults.put("google.max_pages", "1");

        defaults.put("linkedin.api_base", "https://api.apify.com/v2");
        defaults.put("linkedin.actor_id", "clever-lemon~linkedin-people-search-scraper");
        defaults.put("linkedin.max_results", "20");

        defaults.put("devto.api_base", "https://dev.to/api");
        defaults.put("devto.per_page", "30");
        defaults.put("devto.max_tags", "3");
        defaults.put("devto.max_candidates", "20");

        defaults.put("score.weight.skill_match", "40");
        defaults.put("score.weight.experience", "20");
        defaults.put("score.weight.reputation", "15");
        defaults.put("score.weight.freshness", "10");
        defaults.put("score.weight.social_proof", "5");

        defaults.put("risk.penalty.inactive", "15");
        defaults.put("risk.penalty.few_skills", "10");
        defaults.put("risk.penalty.short_summary", "8");
        defaults.put("risk.penalty.limited_experience", "12");
        defaults.put("risk.penalty.no_location", "5");
        defaults.put("risk.penalty.low_score", "20");

        defaults.put("dedup.name_similarity", "0.85");
        defaults.put("dedup.location_similarity", "0.75");
        defaults.put("dedup.overall_similarity", "0.8");

        return Map.copyOf(defaults);
    }
}
