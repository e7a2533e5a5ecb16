package org.estateranker.engine.cache;

import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.service.ScoringEngine;

/**
 * Holder of the current scoring configuration and the engine built from it.
 */
public interface ScoringConfigCache {

    /**
     * Load a fresh configuration and swap it in atomically.
     * On failure the previous configuration stays active.
     *
     * @return true if the new configuration was applied
     */
    boolean refresh();

    /**
     * Get the current scoring configuration.
     */
    ScoringConfig getConfig();

    /**
     * Get the engine for the current configuration. Read once per call.
     */
    ScoringEngine getEngine();

    /**
     * Check if a configuration has been loaded successfully.
     */
    boolean isInitialized();
}
