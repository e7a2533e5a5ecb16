package org.estateranker.engine;

import org.estateranker.engine.config.ScoringConfigLoader;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.RetrievedListing;
import org.estateranker.engine.domain.model.ScoringConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared builders for listings and the bundled scoring configuration.
 */
public final class TestFixtures {

    /** Victory Monument, Bangkok. */
    public static final double BANGKOK_LAT = 13.7649;
    public static final double BANGKOK_LON = 100.5383;

    private static ScoringConfig bundled;

    private TestFixtures() {
    }

    public static synchronized ScoringConfig bundledConfig() {
        if (bundled == null) {
            bundled = new ScoringConfigLoader().loadDefault();
        }
        return bundled;
    }

    /**
     * Listing attributes from alternating key/value pairs.
     */
    public static CandidateAttributes listing(String id, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(CandidateAttributes.ID, id);
        for (int i = 0; i < keyValues.length; i += 2) {
            raw.put((String) keyValues[i], keyValues[i + 1]);
        }
        return CandidateAttributes.of(raw);
    }

    public static RetrievedListing retrieved(double semanticScore, String id, Object... keyValues) {
        return RetrievedListing.of(semanticScore, listing(id, keyValues));
    }
}
