package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.model.ScoringResult;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One configuration together with the assessor and scorer built from it.
 * Swapped as a unit on reload so a scoring call never mixes two configurations.
 */
public final class ScoringEngine {

    private final ScoringConfig config;
    private final DataQualityAssessor assessor;
    private final ScoringService scoringService;

    public ScoringEngine(ScoringConfig config, DataQualityAssessor assessor, ScoringService scoringService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.assessor = Objects.requireNonNull(assessor, "assessor must not be null");
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
    }

    public static ScoringEngine create(ScoringConfig config) {
        DataQualityAssessor assessor = new DataQualityAssessorImpl(config);
        return new ScoringEngine(config, assessor, new ScoringServiceImpl(config, assessor));
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public DataQualityAssessor getAssessor() {
        return assessor;
    }

    public ScoringService getScoringService() {
        return scoringService;
    }

    /**
     * Assess a candidate for an intent: must-haves are required, nice-to-have and avoid keys optional.
     */
    public DataQualityReport assess(CandidateAttributes attributes, Intent intent) {
        Set<String> optional = new LinkedHashSet<>(intent.getNiceToHave());
        optional.addAll(intent.getAvoidPoi());
        return assessor.assess(attributes, intent.getMustHave(), optional);
    }

    /**
     * Assess then score one candidate.
     */
    public ScoringResult evaluate(CandidateAttributes attributes, Intent intent, GeoPoint targetLocation,
                                  GeoPoint avoidLocation) {
        DataQualityReport quality = assess(attributes, intent);
        return scoringService.score(attributes, intent, quality, targetLocation, avoidLocation);
    }
}
