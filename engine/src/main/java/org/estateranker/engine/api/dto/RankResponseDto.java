package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.RankedListing;
import org.estateranker.engine.domain.model.RankingResponse;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a ranking call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RankResponseDto {

    @JsonProperty("results")
    private final List<RankedListingDto> results;

    @JsonProperty("candidates_scored")
    private final int candidatesScored;

    @JsonProperty("candidates_disqualified")
    private final int candidatesDisqualified;

    @JsonProperty("message")
    private final String message;

    private RankResponseDto(RankingResponse response) {
        this.results = response.getResults().stream().map(RankedListingDto::new).collect(Collectors.toList());
        this.candidatesScored = response.getCandidatesScored();
        this.candidatesDisqualified = response.getCandidatesDisqualified();
        this.message = response.getMessage();
    }

    public static RankResponseDto from(RankingResponse response) {
        return new RankResponseDto(response);
    }

    public List<RankedListingDto> getResults() {
        return results;
    }

    public int getCandidatesScored() {
        return candidatesScored;
    }

    public int getCandidatesDisqualified() {
        return candidatesDisqualified;
    }

    public String getMessage() {
        return message;
    }

    /**
     * One ranked listing with its score components.
     */
    public static final class RankedListingDto {
        @JsonProperty("id")
        private final String id;

        @JsonProperty("final_score")
        private final double finalScore;

        @JsonProperty("structured_score")
        private final double structuredScore;

        @JsonProperty("semantic_score")
        private final double semanticScore;

        @JsonProperty("quality_score")
        private final double qualityScore;

        @JsonProperty("scoring")
        private final ScoringResultDto scoring;

        RankedListingDto(RankedListing listing) {
            this.id = listing.getListingId();
            this.finalScore = listing.getFinalScore();
            this.structuredScore = listing.getStructuredScore();
            this.semanticScore = listing.getSemanticScore();
            this.qualityScore = listing.getQualityScore();
            this.scoring = ScoringResultDto.from(listing.getScoringResult());
        }

        public String getId() {
            return id;
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

        public double getQualityScore() {
            return qualityScore;
        }

        public ScoringResultDto getScoring() {
            return scoring;
        }
    }
}
