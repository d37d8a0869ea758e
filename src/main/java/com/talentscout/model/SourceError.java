package com.talentscout.model;

public record SourceError(String source, String error, SourceFailureReason reason) {
}
