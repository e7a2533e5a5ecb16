package org.estateranker.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a ranking call. An empty result list carries a message explaining why.
 */
public final class RankingResponse {

    private final List<RankedListing> results;
    private final int candidatesScored;
    private final int candidatesDisqualified;
    private final String message;

    private RankingResponse(List<RankedListing> results, int candidatesScored, int candidatesDisqualified,
                            String message) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.candidatesScored = candidatesScored;
        this.candidatesDisqualified = candidatesDisqualified;
        this.message = message;
    }

    public static RankingResponse of(List<RankedListing> results, int candidatesScored,
                                     int candidatesDisqualified) {
        return new RankingResponse(results, candidatesScored, candidatesDisqualified, null);
    }

    public static RankingResponse empty(String message, int candidatesScored, int candidatesDisqualified) {
        return new RankingResponse(Collections.emptyList(), candidatesScored, candidatesDisqualified, message);
    }

    public List<RankedListing> getResults() {
        return results;
    }

    public int getCandidatesScored() {
        return candidatesScored;
    }

    public int getCandidatesDisqualified() {
        return candidatesDisqualified;
    }

    /**
     * Explanation when no results are returned, otherwise null.
     */
    public String getMessage() {
        return message;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RankingResponse{results=%d, scored=%d, disqualified=%d, message=%s}",
                results.size(), candidatesScored, candidatesDisqualified, message);
    }
}
