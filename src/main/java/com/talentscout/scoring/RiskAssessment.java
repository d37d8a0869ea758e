package com.talentscout.scoring;

import com.talentscout.model.RiskFlag;

import java.util.List;

public final class RiskAssessment {
    public final List<RiskFlag> flags;
    public final double penalty;
    public final List<String> reasons;

    public RiskAssessment(List<RiskFlag> flags, double penalty, List<String> reasons) {
        this.flags = flags == null ? List.of() : List.copyOf(flags);
        this.penalty = Math.max(0.0, penalty);
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
