package com.talentscout.collect;

import com.talentscout.model.SourceFailureReason;

/**
 * Raised inside a collector run to stop it; converted to an outcome at the collector boundary.
 */
class SourceFetchException extends RuntimeException {
    private final SourceFailureReason reason;

    SourceFetchException(SourceFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    SourceFetchException(SourceFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    SourceFailureReason reason() {
        return reason;
    }
}
