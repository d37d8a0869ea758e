package com.talentscout.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One platform's view of one person. Every collector maps its native payload into this shape.
 * String fields are never null; {@link #lastActive} is null when the platform does not expose activity.
 */
@Value
public final class RawCandidateRecord {
    public final String platform;
    public final String platformId;
    public final String profileUrl;
    public final String name;
    public final String title;
    public final String location;
    public final String avatarUrl;
    public final String email;
    public final String summary;
    public final String githubUsername;
    public final String linkedinUrl;
    public final String stackoverflowId;
    public final List<String> skills;
    public final Instant lastActive;
    public final double experienceYears;
    public final int followers;
    public final int stars;
    public final int forks;
    public final int repoCount;
    public final int reputationPoints;
    public final int connections;
    public final double sourceRank;

    @Builder(toBuilder = true)
    public RawCandidateRecord(
            String platform,
            String platformId,
            String profileUrl,
            String name,
            String title,
            String location,
            String avatarUrl,
            String email,
            String summary,
            String githubUsername,
            String linkedinUrl,
            String stackoverflowId,
            List<String> skills,
            Instant lastActive,
            double experienceYears,
            int followers,
            int stars,
            int forks,
            int repoCount,
            int reputationPoints,
            int connections,
            double sourceRank
    ) {
        this.platform = safe(platform).toLowerCase(Locale.ROOT);
        this.platformId = safe(platformId);
        this.profileUrl = safe(profileUrl);
        this.name = safe(name);
        this.title = safe(title);
        this.location = safe(location);
        this.avatarUrl = safe(avatarUrl);
        this.email = safe(email);
        this.summary = safe(summary);
        this.githubUsername = safe(githubUsername);
        this.linkedinUrl = safe(linkedinUrl);
        this.stackoverflowId = safe(stackoverflowId);
        this.skills = distinctSkills(skills);
        this.lastActive = lastActive;
        this.experienceYears = Math.max(0.0, experienceYears);
        this.followers = Math.max(0, followers);
        this.stars = Math.max(0, stars);
        this.forks = Math.max(0, forks);
        this.repoCount = Math.max(0, repoCount);
        this.reputationPoints = Math.max(0, reputationPoints);
        this.connections = Math.max(0, connections);
        this.sourceRank = sourceRank;
    }

    /**
     * Upsert key: platform plus platform id.
     */
    public String key() {
        return platform + ":" + platformId;
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    private static List<String> distinctSkills(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String s : raw) {
            if (s == null || s.isBlank()) {
                continue;
            }
            String skill = s.trim();
            if (seen.add(skill.toLowerCase(Locale.ROOT))) {
                out.add(skill);
            }
        }
        return List.copyOf(out);
    }
}
