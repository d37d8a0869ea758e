package com.talentscout.orchestrator;

import com.talentscout.model.ProgressUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Receives coarse phase transitions. Called from the orchestrating thread only.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NOOP = update -> {
    };

    void onProgress(ProgressUpdate update);

    static ProgressListener logging() {
        Logger log = LogManager.getLogger(ProgressListener.class);
        return update -> log.info("progress phase={}{} sources={}/{} candidates={} elapsed_ms={} remaining_ms={}",
                update.phase(),
                update.detail().isEmpty() ? "" : " detail=" + update.detail(),
                update.completedSources(),
                update.totalSources(),
                update.candidatesFound(),
                update.elapsedMs(),
                update.remainingMs());
    }
}
