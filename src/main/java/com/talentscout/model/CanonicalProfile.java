package com.talentscout.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A deduplicated identity merged from one or more raw records. Never merged again within the run.
 */
@Value
public final class CanonicalProfile {
    public final String id;
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
    public final List<SourceReference> sources;
    public final MergeProvenance provenance;

    @Builder(toBuilder = true)
    public CanonicalProfile(
            String id,
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
            List<SourceReference> sources,
            MergeProvenance provenance
    ) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("canonical profile needs at least one source reference: " + id);
        }
        this.id = id == null ? "" : id;
        this.name = name == null ? "" : name;
        this.title = title == null ? "" : title;
        this.location = location == null ? "" : location;
        this.avatarUrl = avatarUrl == null ? "" : avatarUrl;
        this.email = email == null ? "" : email;
        this.summary = summary == null ? "" : summary;
        this.githubUsername = githubUsername == null ? "" : githubUsername;
        this.linkedinUrl = linkedinUrl == null ? "" : linkedinUrl;
        this.stackoverflowId = stackoverflowId == null ? "" : stackoverflowId;
        this.skills = skills == null ? List.of() : List.copyOf(skills);
        this.lastActive = lastActive;
        this.experienceYears = experienceYears;
        this.followers = followers;
        this.stars = stars;
        this.forks = forks;
        this.repoCount = repoCount;
        this.reputationPoints = reputationPoints;
        this.connections = connections;
        this.sources = List.copyOf(sources);
        this.provenance = provenance == null ? MergeProvenance.single(this.id) : provenance;
    }

    public String primaryPlatform() {
        return sources.get(0).platform();
    }
}
