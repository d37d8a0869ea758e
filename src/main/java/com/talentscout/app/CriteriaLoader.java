package com.talentscout.app;

import com.talentscout.model.SearchCriteria;
import com.talentscout.orchestrator.InvalidCriteriaException;
import org.apache.commons.cli.CommandLine;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link SearchCriteria} from a criteria JSON document and/or command-line flags. Flags win over the file.
 */
final class CriteriaLoader {

    private CriteriaLoader() {
    }

    static SearchCriteria fromCommandLine(CommandLine cmd, Path workingDir) throws IOException {
        SearchCriteria.SearchCriteriaBuilder builder;
        if (cmd.hasOption("criteria")) {
            Path file = workingDir.resolve(cmd.getOptionValue("criteria")).normalize();
            if (!Files.isRegularFile(file)) {
                throw new InvalidCriteriaException("criteria file not found: " + file);
            }
            builder = fromJson(Files.readString(file, StandardCharsets.UTF_8)).toBuilder();
        } else {
            builder = SearchCriteria.builder();
        }

        if (cmd.hasOption("query")) {
            builder.query(cmd.getOptionValue("query"));
        }
        if (cmd.hasOption("location")) {
            builder.location(cmd.getOptionValue("location"));
        }
        if (cmd.hasOption("skills")) {
            builder.skills(splitList(cmd.getOptionValue("skills")));
        }
        if (cmd.hasOption("keywords")) {
            builder.keywords(splitList(cmd.getOptionValue("keywords")));
        }
        if (cmd.hasOption("roles")) {
            builder.roleTypes(splitList(cmd.getOptionValue("roles")));
        }
        if (cmd.hasOption("sources")) {
            builder.sources(splitList(cmd.getOptionValue("sources")));
        }
        if (cmd.hasOption("time-budget")) {
            builder.timeBudgetSeconds(parseInt("time-budget", cmd.getOptionValue("time-budget")));
        }
        if (cmd.hasOption("limit")) {
            builder.limit(parseInt("limit", cmd.getOptionValue("limit")));
        }
        return builder.build();
    }

    /**
     * Accepts both camelCase and snake_case keys, e.g. {@code roleTypes} or {@code role_types}.
     */
    static SearchCriteria fromJson(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new InvalidCriteriaException("criteria is not a JSON object: " + e.getMessage());
        }
        return SearchCriteria.builder()
                .query(root.optString("query", ""))
                .location(root.optString("location", ""))
                .skills(list(root, "skills"))
                .keywords(list(root, "keywords"))
                .roleTypes(list(root, root.has("roleTypes") ? "roleTypes" : "role_types"))
                .sources(root.has("sources") ? list(root, "sources") : null)
                .timeBudgetSeconds(number(root, root.has("timeBudget") ? "timeBudget" : "time_budget"))
                .limit(number(root, "limit"))
                .build();
    }

    private static List<String> list(JSONObject root, String key) {
        Object raw = root.opt(key);
        if (raw == null || raw == JSONObject.NULL) {
            return List.of();
        }
        if (raw instanceof String s) {
            return splitList(s);
        }
        if (!(raw instanceof JSONArray arr)) {
            throw new InvalidCriteriaException(key + " must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            String v = arr.optString(i, "").trim();
            if (!v.isEmpty()) {
                out.add(v);
            }
        }
        return out;
    }

    private static int number(JSONObject root, String key) {
        Object raw = root.opt(key);
        if (raw == null || raw == JSONObject.NULL) {
            return 0;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        return parseInt(key, raw.toString());
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCriteriaException(name + " must be a whole number: " + raw);
        }
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split("[,;]")) {
            String v = part.trim();
            if (!v.isEmpty()) {
                out.add(v);
            }
        }
        return out;
    }
}
