package com.talentscout.model;

/**
 * Where a canonical profile was seen: platform, its id there, and the profile URL.
 */
public record SourceReference(String platform, String externalId, String url) {
    public SourceReference {
        platform = platform == null ? "" : platform;
        externalId = externalId == null ? "" : externalId;
        url = url == null ? "" : url;
    }

    public String key() {
        return platform + ":" + externalId;
    }
}
