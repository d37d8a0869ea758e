package com.talentscout.collect;

import com.talentscout.config.Config;
import com.talentscout.data.http.HttpClientEx;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the collector registry keyed by source name.
 */
public final class SourceCollectors {

    private SourceCollectors() {
    }

    public static Map<String, SourceCollector> defaults(Config config, HttpClientEx http) {
        return of(List.of(
                new GitHubCollector(config, http),
                new StackOverflowCollector(config, http),
                new LinkedInCollector(config, http),
                new GoogleSearchCollector(config, http),
                new DevToCollector(config, http)
        ));
    }

    public static Map<String, SourceCollector> of(List<? extends SourceCollector> collectors) {
        Map<String, SourceCollector> out = new LinkedHashMap<>();
        for (SourceCollector c : collectors) {
            out.put(c.name(), c);
        }
        return out;
    }
}
