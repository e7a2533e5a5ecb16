package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * A listing returned by semantic retrieval, with its similarity score in [0, 1].
 */
public final class RetrievedListing {

    private final double semanticScore;
    private final CandidateAttributes attributes;

    private RetrievedListing(double semanticScore, CandidateAttributes attributes) {
        this.semanticScore = semanticScore;
        this.attributes = attributes;
    }

    public static RetrievedListing of(double semanticScore, CandidateAttributes attributes) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        if (Double.isNaN(semanticScore)) {
            throw new IllegalArgumentException("semanticScore must be a number");
        }
        return new RetrievedListing(semanticScore, attributes);
    }

    public String getId() {
        return attributes.getId();
    }

    public double getSemanticScore() {
        return semanticScore;
    }

    public CandidateAttributes getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return String.format("RetrievedListing{id='%s', semantic=%.3f}", getId(), semanticScore);
    }
}
