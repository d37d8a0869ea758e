package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ScoredProfile {
    public final CanonicalProfile profile;
    public final ScoreBreakdown score;
    public final EmailConfidence emailConfidence;
}
