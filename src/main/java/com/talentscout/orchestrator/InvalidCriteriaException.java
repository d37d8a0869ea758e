package com.talentscout.orchestrator;

/**
 * Malformed or missing criteria. Raised before any network activity; not retryable.
 */
public class InvalidCriteriaException extends IllegalArgumentException {
    public InvalidCriteriaException(String message) {
        super(message);
    }
}
