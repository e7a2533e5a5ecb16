package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.AttributeReading;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Classifies candidate attributes as present, missing or unusable.
 * Never throws on dirty data: malformed values degrade to "missing".
 */
public interface DataQualityAssessor {

    /**
     * Assess which of the required and optional POI keys carry verified data,
     * and whether price, asset type and location are usable.
     *
     * @param attributes candidate snapshot
     * @param requiredKeys must-have POI keys, each missing one yields a warning
     * @param optionalKeys other POI keys worth checking
     * @return a fresh report
     */
    DataQualityReport assess(CandidateAttributes attributes, Collection<String> requiredKeys,
                             Collection<String> optionalKeys);

    /**
     * Assess many candidates at once.
     *
     * @return candidate id to report, in input order
     */
    Map<String, DataQualityReport> assessAll(List<CandidateAttributes> candidates, Collection<String> requiredKeys,
                                             Collection<String> optionalKeys);

    /**
     * Classify a single raw attribute.
     */
    AttributeReading read(CandidateAttributes attributes, String key);

    /**
     * The distance for a POI key only when it is verified present. Every distance read
     * in scoring goes through here, never through a raw field with a numeric default.
     */
    OptionalDouble verifiedDistance(CandidateAttributes attributes, String poiKey);
}
