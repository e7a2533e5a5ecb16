package org.estateranker.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of scoring one candidate against one intent.
 * <p>
 * A disqualified result always has a score of 0, a non-null reason and an empty breakdown;
 * the signals gathered before the failing gate are kept for audit.
 */
public final class ScoringResult {

    private final String candidateId;
    private final double score;
    private final boolean disqualified;
    private final String disqualificationReason;
    private final List<Signal> signals;
    private final Map<String, Double> scoreBreakdown;
    private final DataQualityReport dataQuality;

    private ScoringResult(String candidateId, double score, boolean disqualified, String disqualificationReason,
                          List<Signal> signals, Map<String, Double> scoreBreakdown, DataQualityReport dataQuality) {
        this.candidateId = candidateId;
        this.score = score;
        this.disqualified = disqualified;
        this.disqualificationReason = disqualificationReason;
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.scoreBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(scoreBreakdown));
        this.dataQuality = dataQuality;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public double getScore() {
        return score;
    }

    public boolean isDisqualified() {
        return disqualified;
    }

    /**
     * Why the candidate was removed, or null when it was not.
     */
    public String getDisqualificationReason() {
        return disqualificationReason;
    }

    /**
     * Every signal in the order it was produced.
     */
    public List<Signal> getSignals() {
        return signals;
    }

    public List<Signal> getPositiveSignals() {
        return signals.stream()
                .filter(s -> s.getKind() == SignalKind.POSITIVE)
                .collect(Collectors.toList());
    }

    /**
     * Negative and warning signals, in order.
     */
    public List<Signal> getNegativeSignals() {
        return signals.stream()
                .filter(s -> s.getKind() != SignalKind.POSITIVE)
                .collect(Collectors.toList());
    }

    public List<Signal> getWarnings() {
        return signals.stream()
                .filter(s -> s.getKind() == SignalKind.WARNING)
                .collect(Collectors.toList());
    }

    /**
     * Signal label to summed numeric contribution. Zero contributions are omitted.
     */
    public Map<String, Double> getScoreBreakdown() {
        return scoreBreakdown;
    }

    /**
     * Quality report the result was computed with. May be null.
     */
    public DataQualityReport getDataQuality() {
        return dataQuality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoringResult)) {
            return false;
        }
        ScoringResult that = (ScoringResult) o;
        return Double.compare(that.score, score) == 0
                && disqualified == that.disqualified
                && Objects.equals(candidateId, that.candidateId)
                && Objects.equals(disqualificationReason, that.disqualificationReason)
                && signals.equals(that.signals)
                && scoreBreakdown.equals(that.scoreBreakdown)
                && Objects.equals(dataQuality, that.dataQuality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateId, score, disqualified, disqualificationReason, signals, scoreBreakdown,
                dataQuality);
    }

    @Override
    public String toString() {
        if (disqualified) {
            return String.format("ScoringResult{id='%s', disqualified='%s'}", candidateId, disqualificationReason);
        }
        return String.format("ScoringResult{id='%s', score=%.3f, signals=%d}", candidateId, score, signals.size());
    }

    /**
     * Accumulates signals for one scoring call. Not thread-safe; one builder per call.
     */
    public static final class Builder {
        private final String candidateId;
        private final List<Signal> signals = new ArrayList<>();
        private final Map<String, Double> breakdown = new LinkedHashMap<>();
        private double score;
        private DataQualityReport dataQuality;

        public Builder(String candidateId) {
            this.candidateId = candidateId;
        }

        public Builder dataQuality(DataQualityReport dataQuality) {
            this.dataQuality = dataQuality;
            return this;
        }

        /**
         * Appends a signal and applies its contribution.
         */
        public Builder add(Signal signal) {
            signals.add(Objects.requireNonNull(signal, "signal must not be null"));
            double contribution = signal.getContribution();
            if (contribution != 0.0) {
                score += contribution;
                breakdown.merge(signal.getLabel(), contribution, Double::sum);
            }
            return this;
        }

        public Builder addAll(List<Signal> toAdd) {
            toAdd.forEach(this::add);
            return this;
        }

        public double currentScore() {
            return score;
        }

        public ScoringResult build() {
            return new ScoringResult(candidateId, score, false, null, signals, breakdown, dataQuality);
        }

        /**
         * Terminal result: score frozen at 0, breakdown cleared, prior signals kept.
         */
        public ScoringResult disqualify(String reason) {
            Objects.requireNonNull(reason, "reason must not be null");
            return new ScoringResult(candidateId, 0.0, true, reason, signals, Collections.emptyMap(), dataQuality);
        }
    }
}
