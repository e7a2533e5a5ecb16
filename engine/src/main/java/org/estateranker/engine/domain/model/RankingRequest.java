package org.estateranker.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One ranking call: the parsed intent, the retrieved pool and optional location context.
 * Explicit coordinates win over place names; names are geocoded only when coordinates are absent.
 */
public final class RankingRequest {

    private final Intent intent;
    private final List<RetrievedListing> pool;
    private final GeoPoint targetLocation;
    private final GeoPoint avoidLocation;
    private final Integer topN;

    private RankingRequest(Builder builder) {
        this.intent = Objects.requireNonNull(builder.intent, "intent must not be null");
        this.pool = Collections.unmodifiableList(new ArrayList<>(builder.pool));
        this.targetLocation = builder.targetLocation;
        this.avoidLocation = builder.avoidLocation;
        if (builder.topN != null && builder.topN <= 0) {
            throw new IllegalArgumentException("topN must be positive");
        }
        this.topN = builder.topN;
    }

    public Intent getIntent() {
        return intent;
    }

    public List<RetrievedListing> getPool() {
        return pool;
    }

    /**
     * Coordinates to be near, or null.
     */
    public GeoPoint getTargetLocation() {
        return targetLocation;
    }

    /**
     * Coordinates to stay away from, or null.
     */
    public GeoPoint getAvoidLocation() {
        return avoidLocation;
    }

    /**
     * Requested result count, or null for the configured default.
     */
    public Integer getTopN() {
        return topN;
    }

    @Override
    public String toString() {
        return "RankingRequest{pool=" + pool.size() + ", intent=" + intent + ", topN=" + topN + '}';
    }

    /**
     * Builder for RankingRequest.
     */
    public static final class Builder {
        private Intent intent = Intent.empty();
        private List<RetrievedListing> pool = Collections.emptyList();
        private GeoPoint targetLocation;
        private GeoPoint avoidLocation;
        private Integer topN;

        public Builder intent(Intent intent) {
            this.intent = intent;
            return this;
        }

        public Builder pool(List<RetrievedListing> pool) {
            this.pool = pool != null ? pool : Collections.emptyList();
            return this;
        }

        public Builder targetLocation(GeoPoint targetLocation) {
            this.targetLocation = targetLocation;
            return this;
        }

        public Builder avoidLocation(GeoPoint avoidLocation) {
            this.avoidLocation = avoidLocation;
            return this;
        }

        public Builder topN(Integer topN) {
            this.topN = topN;
            return this;
        }

        public RankingRequest build() {
            return new RankingRequest(this);
        }
    }
}
