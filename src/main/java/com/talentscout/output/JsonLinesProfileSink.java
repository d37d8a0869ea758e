package com.talentscout.output;

import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.ScoredProfile;
import com.talentscout.model.SourceReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one JSON line per source reference in {@code <dir>/profiles.jsonl}. Existing lines with the same key are replaced.
 */
public final class JsonLinesProfileSink implements ProfileSink {
    private static final Logger LOG = LogManager.getLogger(JsonLinesProfileSink.class);
    static final String FILE_NAME = "profiles.jsonl";

    private final Path dir;
    private final Clock clock;

    public JsonLinesProfileSink(Path dir) {
        this(dir, Clock.systemUTC());
    }

    public JsonLinesProfileSink(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
    }

    public Path file() {
        return dir.resolve(FILE_NAME);
    }

    @Override
    public synchronized int upsert(List<ScoredProfile> profiles) throws IOException {
        if (profiles == null || profiles.isEmpty()) {
            return 0;
        }
        Files.createDirectories(dir);
        Map<String, String> lines = readExisting();

        String updatedAt = clock.instant().toString();
        int written = 0;
        for (ScoredProfile sp : profiles) {
            CanonicalProfile p = sp.profile;
            for (SourceReference ref : p.sources) {
                JSONObject row = new JSONObject();
                row.put("key", ref.key());
                row.put("platform", ref.platform());
                row.put("external_id", ref.externalId());
                row.put("url", ref.url());
                row.put("profile_id", p.id);
                row.put("name", p.name);
                row.put("email", p.email);
                row.put("location", p.location);
                row.put("final_score", sp.score.finalScore);
                row.put("updated_at", updatedAt);
                lines.put(ref.key(), row.toString());
                written++;
            }
        }

        Path target = file();
        Path tmp = dir.resolve(FILE_NAME + ".tmp");
        Files.write(tmp, lines.values(), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("profile sink upserted refs={} total={} file={}", written, lines.size(), target);
        return written;
    }

    private Map<String, String> readExisting() throws IOException {
        Map<String, String> out = new LinkedHashMap<>();
        Path target = file();
        if (!Files.exists(target)) {
            return out;
        }
        List<String> skipped = new ArrayList<>();
        for (String line : Files.readAllLines(target, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                String key = new JSONObject(line).optString("key", "");
                if (key.isEmpty()) {
                    skipped.add(line);
                } else {
                    out.put(key, line);
                }
            } catch (JSONException e) {
                skipped.add(line);
            }
        }
        if (!skipped.isEmpty()) {
            LOG.warn("profile sink dropped unreadable lines count={} file={}", skipped.size(), target);
        }
        return out;
    }
}
