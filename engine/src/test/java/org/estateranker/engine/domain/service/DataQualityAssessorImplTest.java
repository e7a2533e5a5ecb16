package org.estateranker.engine.domain.service;

import org.estateranker.engine.TestFixtures;
import org.estateranker.engine.domain.model.AttributeReading;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.DataQualityReport;
import org.estateranker.engine.domain.model.DataStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.estateranker.engine.TestFixtures.listing;

class DataQualityAssessorImplTest {

    private final DataQualityAssessor assessor = new DataQualityAssessorImpl(TestFixtures.bundledConfig());

    @Test
    @DisplayName("Checked keys are partitioned into available and missing")
    void partitionsCheckedKeys() {
        CandidateAttributes attributes = listing("Q1",
                "school", 450, "cafe", 99999, "market", "abc",
                "asset_details_selling_price", 3_000_000, "asset_type_id", 3,
                "latitude", 13.75, "longitude", 100.5);

        DataQualityReport report = assessor.assess(attributes,
                Collections.singletonList("school"), Arrays.asList("cafe", "market"));

        assertThat(report.getAvailablePoiKeys()).containsExactly("school");
        assertThat(report.getMissingPoiKeys()).containsExactlyInAnyOrder("cafe", "market");
        assertThat(report.hasValidPrice()).isTrue();
        assertThat(report.hasValidAssetType()).isTrue();
        assertThat(report.hasValidLocation()).isTrue();
        assertThat(report.getQualityScore()).isCloseTo(0.4 / 3 + 0.3 + 0.2 + 0.1, within(1e-9));
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    void warnsOnlyForMissingRequiredKeys() {
        DataQualityReport report = assessor.assess(listing("Q2"),
                Collections.singletonList("school"), Collections.singletonList("cafe"));

        assertThat(report.getWarnings()).containsExactly("School cannot be verified (no usable distance data)");
        assertThat(report.missingMustHaves(Collections.singletonList("school"))).containsExactly("school");
    }

    @Test
    void emptyListingScoresZero() {
        DataQualityReport report = assessor.assess(listing("Q3"), null, null);

        assertThat(report.getQualityScore()).isZero();
        assertThat(report.getAvailablePoiKeys()).isEmpty();
        assertThat(report.getMissingPoiKeys()).isEmpty();
    }

    @Test
    void villageNameCountsAsLocation() {
        DataQualityReport report = assessor.assess(listing("Q4", "location_village_th", "Baan Suan"),
                Collections.emptyList(), Collections.emptyList());

        assertThat(report.hasValidLocation()).isTrue();
        assertThat(report.getQualityScore()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void outOfRangeAssetTypeIsNotValid() {
        DataQualityReport report = assessor.assess(listing("Q6", "asset_type_id", 4294967299.0),
                Collections.emptyList(), Collections.emptyList());

        assertThat(report.hasValidAssetType()).isFalse();
        assertThat(report.getQualityScore()).isZero();
    }

    @Test
    void largePriceIsNotMistakenForSentinel() {
        DataQualityReport report = assessor.assess(listing("Q5", "asset_details_selling_price", 99999),
                Collections.emptyList(), Collections.emptyList());

        assertThat(report.hasValidPrice()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(doubles = {99999, 90000, 125000})
    void sentinelRangeReadsAsMissing(double value) {
        AttributeReading reading = assessor.read(listing("Q6", "school", value), "school");

        assertThat(reading.getStatus()).isEqualTo(DataStatus.MISSING);
        assertThat(reading.value()).isEmpty();
    }

    @Test
    void readClassifiesRawValues() {
        CandidateAttributes attributes = listing("Q7",
                "a", 0, "b", "  ", "c", -1, "d", Double.NaN, "e", "12,500", "f", true, "g", "far");

        assertThat(assessor.read(attributes, "a").value()).hasValue(0.0);
        assertThat(assessor.read(attributes, "b").getStatus()).isEqualTo(DataStatus.MISSING);
        assertThat(assessor.read(attributes, "c").getStatus()).isEqualTo(DataStatus.UNUSABLE);
        assertThat(assessor.read(attributes, "d").getStatus()).isEqualTo(DataStatus.UNUSABLE);
        assertThat(assessor.read(attributes, "e").value()).hasValue(12500.0);
        assertThat(assessor.read(attributes, "f").getStatus()).isEqualTo(DataStatus.UNUSABLE);
        assertThat(assessor.read(attributes, "g").getStatus()).isEqualTo(DataStatus.UNUSABLE);
        assertThat(assessor.read(attributes, "absent").getStatus()).isEqualTo(DataStatus.MISSING);
    }

    @Test
    void assessAllKeysReportsById() {
        List<CandidateAttributes> candidates = Arrays.asList(
                listing("first", "school", 100),
                listing("second"));

        Map<String, DataQualityReport> reports = assessor.assessAll(candidates,
                Collections.singletonList("school"), Collections.emptyList());

        assertThat(reports).containsOnlyKeys("first", "second");
        assertThat(reports.get("first").isPoiAvailable("school")).isTrue();
        assertThat(reports.get("second").isPoiMissing("school")).isTrue();
    }
}
