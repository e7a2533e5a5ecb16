package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.ScoringResult;
import org.estateranker.engine.domain.model.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for a scoring result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScoringResultDto {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("score")
    private final double score;

    @JsonProperty("is_disqualified")
    private final boolean disqualified;

    @JsonProperty("disqualification_reason")
    private final String disqualificationReason;

    @JsonProperty("positive_signals")
    private final List<String> positiveSignals;

    @JsonProperty("negative_signals")
    private final List<String> negativeSignals;

    @JsonProperty("signals")
    private final List<SignalDto> signals;

    @JsonProperty("score_breakdown")
    private final Map<String, Double> scoreBreakdown;

    @JsonProperty("data_quality")
    private final DataQualityDto dataQuality;

    private ScoringResultDto(ScoringResult result) {
        this.id = result.getCandidateId();
        this.score = result.getScore();
        this.disqualified = result.isDisqualified();
        this.disqualificationReason = result.getDisqualificationReason();
        this.positiveSignals = messages(result.getPositiveSignals());
        this.negativeSignals = messages(result.getNegativeSignals());
        this.signals = result.getSignals().stream().map(SignalDto::new).collect(Collectors.toList());
        this.scoreBreakdown = result.getScoreBreakdown();
        this.dataQuality = result.getDataQuality() != null ? new DataQualityDto(result.getDataQuality()) : null;
    }

    public static ScoringResultDto from(ScoringResult result) {
        return new ScoringResultDto(result);
    }

    private static List<String> messages(List<Signal> signals) {
        return signals.stream().map(Signal::getMessage).collect(Collectors.toList());
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public boolean isDisqualified() {
        return disqualified;
    }

    public String getDisqualificationReason() {
        return disqualificationReason;
    }

    public List<String> getPositiveSignals() {
        return positiveSignals;
    }

    public List<String> getNegativeSignals() {
        return negativeSignals;
    }

    public List<SignalDto> getSignals() {
        return signals;
    }

    public Map<String, Double> getScoreBreakdown() {
        return scoreBreakdown;
    }

    public DataQualityDto getDataQuality() {
        return dataQuality;
    }

    /**
     * One structured signal.
     */
    public static final class SignalDto {
        @JsonProperty("kind")
        private final String kind;

        @JsonProperty("label")
        private final String label;

        @JsonProperty("message")
        private final String message;

        @JsonProperty("contribution")
        private final double contribution;

        SignalDto(Signal signal) {
            this.kind = signal.getKind().name().toLowerCase(Locale.ROOT);
            this.label = signal.getLabel();
            this.message = signal.getMessage();
            this.contribution = signal.getContribution();
        }

        public String getKind() {
            return kind;
        }

        public String getLabel() {
            return label;
        }

        public String getMessage() {
            return message;
        }

        public double getContribution() {
            return contribution;
        }
    }

    /**
     * Data quality summary.
     */
    public static final class DataQualityDto {
        @JsonProperty("quality_score")
        private final double qualityScore;

        @JsonProperty("available_poi_keys")
        private final List<String> availablePoiKeys;

        @JsonProperty("missing_poi_keys")
        private final List<String> missingPoiKeys;

        @JsonProperty("warnings")
        private final List<String> warnings;

        DataQualityDto(DataQualityReport report) {
            this.qualityScore = report.getQualityScore();
            this.availablePoiKeys = new ArrayList<>(report.getAvailablePoiKeys());
            this.missingPoiKeys = new ArrayList<>(report.getMissingPoiKeys());
            this.warnings = report.getWarnings() != null ? report.getWarnings() : Collections.emptyList();
        }

        public double getQualityScore() {
            return qualityScore;
        }

        public List<String> getAvailablePoiKeys() {
            return availablePoiKeys;
        }

        public List<String> getMissingPoiKeys() {
            return missingPoiKeys;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
