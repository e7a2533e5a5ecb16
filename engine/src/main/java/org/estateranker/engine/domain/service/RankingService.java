package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RankingResponse;

/**
 * Service for ranking a retrieved candidate pool against an intent.
 */
public interface RankingService {

    /**
     * Score every candidate, drop disqualified ones, combine with the semantic and lifestyle
     * scores, sort best first and truncate.
     *
     * @param request intent, pool and optional location context
     * @return ranked listings, or an empty response with a message
     */
    RankingResponse rank(RankingRequest request);
}
