package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Settings for combining the structured score with retrieval signals and cutting the result list.
 */
public final class RankingSettings {

    private final double structuredWeight;
    private final double semanticWeight;
    private final double lifestyleWeight;
    private final double minFinalScore;
    private final int defaultTopN;
    private final int maxPoolSize;
    private final double minQualityForInclusion;

    private RankingSettings(Builder builder) {
        if (builder.defaultTopN < 1) {
            throw new IllegalArgumentException("defaultTopN must be at least 1");
        }
        if (builder.maxPoolSize < 1) {
            throw new IllegalArgumentException("maxPoolSize must be at least 1");
        }
        this.structuredWeight = builder.structuredWeight;
        this.semanticWeight = builder.semanticWeight;
        this.lifestyleWeight = builder.lifestyleWeight;
        this.minFinalScore = builder.minFinalScore;
        this.defaultTopN = builder.defaultTopN;
        this.maxPoolSize = builder.maxPoolSize;
        this.minQualityForInclusion = builder.minQualityForInclusion;
    }

    public static RankingSettings defaults() {
        return new Builder().build();
    }

    public double getStructuredWeight() {
        return structuredWeight;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public double getLifestyleWeight() {
        return lifestyleWeight;
    }

    public double getMinFinalScore() {
        return minFinalScore;
    }

    public int getDefaultTopN() {
        return defaultTopN;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public double getMinQualityForInclusion() {
        return minQualityForInclusion;
    }

    /**
     * Weighted combination of the structured score with the retrieval and popularity signals.
     */
    public double combine(double structuredScore, double semanticScore, double lifestyleScore) {
        return structuredWeight * structuredScore
                + semanticWeight * semanticScore
                + lifestyleWeight * lifestyleScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankingSettings)) {
            return false;
        }
        RankingSettings that = (RankingSettings) o;
        return Double.compare(that.structuredWeight, structuredWeight) == 0
                && Double.compare(that.semanticWeight, semanticWeight) == 0
                && Double.compare(that.lifestyleWeight, lifestyleWeight) == 0
                && Double.compare(that.minFinalScore, minFinalScore) == 0
                && defaultTopN == that.defaultTopN
                && maxPoolSize == that.maxPoolSize
                && Double.compare(that.minQualityForInclusion, minQualityForInclusion) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(structuredWeight, semanticWeight, lifestyleWeight, minFinalScore,
                defaultTopN, maxPoolSize, minQualityForInclusion);
    }

    @Override
    public String toString() {
        return String.format("RankingSettings{structured=%.2f, semantic=%.2f, lifestyle=%.2f, minFinal=%.2f, topN=%d, pool=%d}",
                structuredWeight, semanticWeight, lifestyleWeight, minFinalScore, defaultTopN, maxPoolSize);
    }

    /**
     * Builder for RankingSettings.
     */
    public static final class Builder {
        private double structuredWeight = 0.7;
        private double semanticWeight = 0.2;
        private double lifestyleWeight = 0.05;
        private double minFinalScore = 0.35;
        private int defaultTopN = 5;
        private int maxPoolSize = 100;
        private double minQualityForInclusion = 0.0;

        public Builder structuredWeight(double structuredWeight) {
            this.structuredWeight = structuredWeight;
            return this;
        }

        public Builder semanticWeight(double semanticWeight) {
            this.semanticWeight = semanticWeight;
            return this;
        }

        public Builder lifestyleWeight(double lifestyleWeight) {
            this.lifestyleWeight = lifestyleWeight;
            return this;
        }

        public Builder minFinalScore(double minFinalScore) {
            this.minFinalScore = minFinalScore;
            return this;
        }

        public Builder defaultTopN(int defaultTopN) {
            this.defaultTopN = defaultTopN;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder minQualityForInclusion(double minQualityForInclusion) {
            this.minQualityForInclusion = minQualityForInclusion;
            return this;
        }

        public RankingSettings build() {
            return new RankingSettings(this);
        }
    }
}
