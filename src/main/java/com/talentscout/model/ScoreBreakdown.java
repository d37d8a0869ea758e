package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoreBreakdown {
    public final int skillMatch;
    public final int experience;
    public final int reputation;
    public final int freshness;
    public final int socialProof;
    public final double weightedTotal;
    public final List<RiskFlag> riskFlags;
    public final double riskPenalty;
    public final double finalScore;
}
