package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class MergeProvenance {
    public final int recordCount;
    public final List<String> recordKeys;
    public final List<String> reasons;

    public static MergeProvenance single(String recordKey) {
        return new MergeProvenance(1, List.of(recordKey), List.of());
    }
}
