package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.ScoringResult;

/**
 * Service for scoring a candidate listing against a parsed intent.
 */
public interface ScoringService {

    /**
     * Score a candidate.
     * Higher score = better candidate. A disqualified candidate always scores 0.
     * Never throws on dirty candidate data.
     *
     * @param attributes the candidate snapshot
     * @param intent the parsed user preferences
     * @param quality data quality report for this candidate
     * @param targetLocation geocoded location to be near, or null
     * @param avoidLocation geocoded location to stay away from, or null
     * @return scoring result with signals and breakdown
     */
    ScoringResult score(CandidateAttributes attributes, Intent intent, DataQualityReport quality,
                        GeoPoint targetLocation, GeoPoint avoidLocation);

    /**
     * Score a candidate without location context.
     */
    default ScoringResult score(CandidateAttributes attributes, Intent intent, DataQualityReport quality) {
        return score(attributes, intent, quality, null, null);
    }
}
