package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Immutable domain model for a ranked listing with its combined score.
 */
public final class RankedListing implements Comparable<RankedListing> {

    private final String listingId;
    private final double finalScore;
    private final double structuredScore;
    private final double semanticScore;
    private final double lifestyleScore;
    private final ScoringResult scoringResult;

    private RankedListing(Builder builder) {
        this.listingId = Objects.requireNonNull(builder.listingId, "listingId must not be null");
        this.scoringResult = Objects.requireNonNull(builder.scoringResult, "scoringResult must not be null");
        this.finalScore = builder.finalScore;
        this.structuredScore = builder.structuredScore;
        this.semanticScore = builder.semanticScore;
        this.lifestyleScore = builder.lifestyleScore;
    }

    // Getters
    public String getListingId() {
        return listingId;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public double getStructuredScore() {
        return structuredScore;
    }

    public double getSemanticScore() {
        return semanticScore;
    }

    public double getLifestyleScore() {
        return lifestyleScore;
    }

    public ScoringResult getScoringResult() {
        return scoringResult;
    }

    /**
     * Quality score of the candidate's data, 0 when no report was attached.
     */
    public double getQualityScore() {
        DataQualityReport quality = scoringResult.getDataQuality();
        return quality != null ? quality.getQualityScore() : 0.0;
    }

    @Override
    public int compareTo(RankedListing other) {
        // Higher score is better, ties broken by id for a stable order
        int byScore = Double.compare(other.finalScore, this.finalScore);
        return byScore != 0 ? byScore : this.listingId.compareTo(other.listingId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankedListing)) {
            return false;
        }
        RankedListing that = (RankedListing) o;
        return Double.compare(that.finalScore, finalScore) == 0
                && listingId.equals(that.listingId)
                && scoringResult.equals(that.scoringResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listingId, finalScore, scoringResult);
    }

    @Override
    public String toString() {
        return String.format("RankedListing{id='%s', final=%.3f, structured=%.2f, semantic=%.3f}",
                listingId, finalScore, structuredScore, semanticScore);
    }

    /**
     * Builder for RankedListing.
     */
    public static final class Builder {
        private String listingId;
        private double finalScore;
        private double structuredScore;
        private double semanticScore;
        private double lifestyleScore;
        private ScoringResult scoringResult;

        public Builder listingId(String listingId) {
            this.listingId = listingId;
            return this;
        }

        public Builder finalScore(double finalScore) {
            this.finalScore = finalScore;
            return this;
        }

        public Builder structuredScore(double structuredScore) {
            this.structuredScore = structuredScore;
            return this;
        }

        public Builder semanticScore(double semanticScore) {
            this.semanticScore = semanticScore;
            return this;
        }

        public Builder lifestyleScore(double lifestyleScore) {
            this.lifestyleScore = lifestyleScore;
            return this;
        }

        public Builder scoringResult(ScoringResult scoringResult) {
            this.scoringResult = scoringResult;
            return this;
        }

        public RankedListing build() {
            return new RankedListing(this);
        }
    }
}
