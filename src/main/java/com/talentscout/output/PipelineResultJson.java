package com.talentscout.output;

import com.talentscout.model.CanonicalProfile;
import com.talentscout.model.DeduplicationMetrics;
import com.talentscout.model.EmailConfidence;
import com.talentscout.model.PerformanceMetrics;
import com.talentscout.model.PipelineResult;
import com.talentscout.model.QualitySummary;
import com.talentscout.model.RawCandidateRecord;
import com.talentscout.model.RiskFlag;
import com.talentscout.model.ScoreBreakdown;
import com.talentscout.model.ScoredProfile;
import com.talentscout.model.SearchCriteria;
import com.talentscout.model.SourceError;
import com.talentscout.model.SourceOutcome;
import com.talentscout.model.SourceReference;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Map;

/**
 * JSON payload handed to presentation and storage collaborators.
 */
public final class PipelineResultJson {

    public String toJson(PipelineResult result) {
        return toJsonObject(result).toString();
    }

    public String toPrettyJson(PipelineResult result) {
        return toJsonObject(result).toString(2);
    }

    public JSONObject toJsonObject(PipelineResult result) {
        JSONObject root = new JSONObject();
        root.put("criteria", criteria(result.criteria));

        JSONArray candidates = new JSONArray();
        for (ScoredProfile sp : result.candidates) {
            candidates.put(candidate(sp));
        }
        root.put("candidates", candidates);

        JSONObject results = new JSONObject();
        for (Map.Entry<String, SourceOutcome> e : result.results.entrySet()) {
            results.put(e.getKey(), outcome(e.getValue()));
        }
        root.put("results", results);

        root.put("deduplication_metrics", deduplication(result.deduplicationMetrics));
        root.put("performance_metrics", performance(result.performance));
        root.put("quality_metrics", quality(result.quality));

        JSONArray errors = new JSONArray();
        for (SourceError error : result.errors) {
            errors.put(error(error));
        }
        root.put("errors", errors);
        return root;
    }

    private JSONObject criteria(SearchCriteria c) {
        JSONObject o = new JSONObject();
        o.put("query", c.query);
        o.put("location", c.location);
        o.put("skills", new JSONArray(c.skills));
        o.put("keywords", new JSONArray(c.keywords));
        o.put("role_types", new JSONArray(c.roleTypes));
        o.put("sources", c.sources == null ? new JSONArray() : new JSONArray(c.sources));
        o.put("time_budget", c.timeBudgetSeconds);
        o.put("limit", c.limit);
        return o;
    }

    private JSONObject candidate(ScoredProfile sp) {
        CanonicalProfile p = sp.profile;
        JSONObject o = new JSONObject();
        o.put("id", p.id);
        o.put("name", p.name);
        o.put("title", p.title);
        o.put("location", p.location);
        o.put("avatar_url", p.avatarUrl);
        o.put("email", p.email);
        o.put("summary", p.summary);
        o.put("github_username", p.githubUsername);
        o.put("linkedin_url", p.linkedinUrl);
        o.put("stackoverflow_id", p.stackoverflowId);
        o.put("skills", new JSONArray(p.skills));
        o.put("last_active", instant(p.lastActive));
        o.put("experience_years", p.experienceYears);
        o.put("followers", p.followers);
        o.put("stars", p.stars);
        o.put("forks", p.forks);
        o.put("repo_count", p.repoCount);
        o.put("reputation", p.reputationPoints);
        o.put("connections", p.connections);

        JSONArray sources = new JSONArray();
        for (SourceReference ref : p.sources) {
            JSONObject s = new JSONObject();
            s.put("platform", ref.platform());
            s.put("external_id", ref.externalId());
            s.put("url", ref.url());
            sources.put(s);
        }
        o.put("sources", sources);

        JSONObject provenance = new JSONObject();
        provenance.put("record_count", p.provenance.recordCount);
        provenance.put("record_keys", new JSONArray(p.provenance.recordKeys));
        provenance.put("reasons", new JSONArray(p.provenance.reasons));
        o.put("merge_provenance", provenance);

        o.put("score", score(sp.score));
        o.put("email_confidence", email(sp.emailConfidence));
        return o;
    }

    private JSONObject score(ScoreBreakdown s) {
        JSONObject o = new JSONObject();
        o.put("skill_match", s.skillMatch);
        o.put("experience", s.experience);
        o.put("reputation", s.reputation);
        o.put("freshness", s.freshness);
        o.put("social_proof", s.socialProof);
        o.put("weighted_total", s.weightedTotal);
        JSONArray flags = new JSONArray();
        for (RiskFlag flag : s.riskFlags) {
            JSONObject f = new JSONObject();
            f.put("code", flag.code());
            f.put("label", flag.label());
            flags.put(f);
        }
        o.put("risk_flags", flags);
        o.put("risk_penalty", s.riskPenalty);
        o.put("final_score", s.finalScore);
        return o;
    }

    private Object email(EmailConfidence e) {
        if (e == null) {
            return JSONObject.NULL;
        }
        JSONObject o = new JSONObject();
        o.put("score", e.score);
        o.put("level", e.level.label());
        o.put("type", e.type.label());
        return o;
    }

    private JSONObject outcome(SourceOutcome outcome) {
        JSONObject o = new JSONObject();
        JSONArray records = new JSONArray();
        for (RawCandidateRecord r : outcome.records) {
            records.put(record(r));
        }
        o.put("records", records);
        o.put("total_found", outcome.totalFound);
        o.put("error", outcome.hasError() ? outcome.error : JSONObject.NULL);
        o.put("failure_reason", outcome.failureReason.label());
        o.put("elapsed_ms", outcome.elapsedMs);
        o.put("rate_limited", outcome.rateLimited);
        return o;
    }

    private JSONObject record(RawCandidateRecord r) {
        JSONObject o = new JSONObject();
        o.put("platform", r.platform);
        o.put("platform_id", r.platformId);
        o.put("profile_url", r.profileUrl);
        o.put("name", r.name);
        o.put("title", r.title);
        o.put("location", r.location);
        o.put("skills", new JSONArray(r.skills));
        o.put("last_active", instant(r.lastActive));
        return o;
    }

    private JSONObject deduplication(DeduplicationMetrics m) {
        JSONObject o = new JSONObject();
        o.put("original_count", m.originalCount);
        o.put("deduplicated_count", m.deduplicatedCount);
        o.put("duplicates_removed", m.duplicatesRemoved);
        o.put("merge_decisions", m.mergeDecisions);
        o.put("deduplication_rate", m.deduplicationRate);
        return o;
    }

    private JSONObject performance(PerformanceMetrics m) {
        JSONObject o = new JSONObject();
        o.put("total_time_ms", m.totalTimeMs);
        o.put("success_rate", m.successRate);
        o.put("per_source_time", new JSONObject(m.perSourceTimeMs));
        o.put("average_time_per_source", m.averageTimePerSource);
        o.put("timeout_rate", m.timeoutRate);
        o.put("candidates_per_successful_source", m.candidatesPerSuccessfulSource);
        return o;
    }

    private JSONObject quality(QualitySummary q) {
        JSONObject o = new JSONObject();
        o.put("completion_rate", q.completionRate);
        o.put("graceful_degradation", q.gracefulDegradation);
        JSONArray failed = new JSONArray();
        for (SourceError error : q.failedSources) {
            failed.put(error(error));
        }
        o.put("failed_sources", failed);
        o.put("degraded", q.degraded);
        o.put("degraded_reason", q.degradedReason.isEmpty() ? JSONObject.NULL : q.degradedReason);
        return o;
    }

    private JSONObject error(SourceError error) {
        JSONObject o = new JSONObject();
        o.put("source", error.source());
        o.put("error", error.error());
        o.put("reason", error.reason().label());
        return o;
    }

    private static Object instant(Instant value) {
        return value == null ? JSONObject.NULL : value.toString();
    }
}
