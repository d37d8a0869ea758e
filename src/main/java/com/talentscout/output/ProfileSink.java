package com.talentscout.output;

import com.talentscout.model.ScoredProfile;

import java.io.IOException;
import java.util.List;

/**
 * Persistence boundary. Implementations upsert by platform + platform id and own their storage format.
 */
public interface ProfileSink {
    /**
     * @return number of source references written
     */
    int upsert(List<ScoredProfile> profiles) throws IOException;
}
