package org.estateranker.engine.cache;

import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.service.ScoringEngine;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe implementation of ScoringConfigCache.
 * Uses read-write lock for concurrent access with exclusive writes.
 */
public final class ScoringConfigCacheImpl implements ScoringConfigCache {

    private static final Logger LOG = Logger.getLogger(ScoringConfigCacheImpl.class.getName());

    private final Supplier<ScoringConfig> source;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;
    private ScoringEngine engine = ScoringEngine.create(new ScoringConfig.Builder().build());

    /**
     * @param source loads a complete configuration, throwing on failure
     */
    public ScoringConfigCacheImpl(Supplier<ScoringConfig> source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public boolean refresh() {
        LOG.info("Refreshing scoring configuration...");

        try {
            ScoringConfig config = source.get();
            if (config == null) {
                LOG.warning("Configuration source returned nothing, keeping existing configuration");
                return false;
            }
            ScoringEngine fresh = ScoringEngine.create(config);

            lock.writeLock().lock();
            try {
                this.engine = fresh;
                this.initialized = true;
            } finally {
                lock.writeLock().unlock();
            }

            LOG.info(() -> String.format("Scoring configuration refresh complete (%d POI keys)",
                    config.getCatalog().size()));
            return true;

        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Failed to refresh scoring configuration", e);
            // Keep existing configuration on failure
            return false;
        }
    }

    @Override
    public ScoringConfig getConfig() {
        return getEngine().getConfig();
    }

    @Override
    public ScoringEngine getEngine() {
        lock.readLock().lock();
        try {
            return engine;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }
}
