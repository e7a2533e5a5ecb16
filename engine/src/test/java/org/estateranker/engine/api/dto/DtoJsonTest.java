package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.estateranker.engine.TestFixtures;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.PetPreference;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.ScoringResult;
import org.estateranker.engine.domain.service.ScoringEngine;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.estateranker.engine.TestFixtures.listing;

class DtoJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rankRequestMapsToDomain() throws Exception {
        String json = "{"
                + "\"intent\": {\"asset_types\": [\"condo\"], \"must_have\": [\"bts_station\"],"
                + " \"pet_friendly\": false, \"price_range\": {\"min\": 2000000},"
                + " \"target_location\": \"Ari\", \"mood\": \"cozy\"},"
                + "\"candidates\": [{\"id\": \"L1\", \"semantic_score\": 0.82, \"bts_station\": 350,"
                + " \"asset_type_id\": 3, \"bts_station_name\": \"Ari\"}],"
                + "\"target_coords\": {\"latitude\": 13.7796, \"longitude\": 100.5446},"
                + "\"top_n\": 3}";

        RankingRequest request = mapper.readValue(json, RankRequestDto.class).toRankingRequest();

        Intent intent = request.getIntent();
        assertThat(intent.getAssetTypes()).containsExactly("condo");
        assertThat(intent.getMustHave()).containsExactly("bts_station");
        assertThat(intent.getPetPreference()).isEqualTo(PetPreference.NO_PETS);
        assertThat(intent.getPriceRange().getMin()).isEqualTo(2_000_000.0);
        assertThat(intent.getPriceRange().getMax()).isNull();
        assertThat(intent.getTargetLocation()).isEqualTo("Ari");
        assertThat(request.getTargetLocation()).isEqualTo(GeoPoint.of(13.7796, 100.5446));
        assertThat(request.getTopN()).isEqualTo(3);

        assertThat(request.getPool()).hasSize(1);
        assertThat(request.getPool().get(0).getId()).isEqualTo("L1");
        assertThat(request.getPool().get(0).getSemanticScore()).isEqualTo(0.82);
        assertThat(request.getPool().get(0).getAttributes().getPoiName("bts_station")).isEqualTo("Ari");
        assertThat(request.getPool().get(0).getAttributes().has("semantic_score")).isFalse();
    }

    @Test
    void missingIntentReadsAsEmpty() throws Exception {
        RankingRequest request = mapper.readValue("{\"candidates\": []}", RankRequestDto.class).toRankingRequest();

        assertThat(request.getIntent()).isEqualTo(Intent.empty());
        assertThat(request.getPool()).isEmpty();
        assertThat(request.getTopN()).isNull();
    }

    @Test
    void invalidCoordinatesAreRejected() throws Exception {
        RankRequestDto dto = mapper.readValue("{\"target_coords\": {\"latitude\": 123, \"longitude\": 10}}",
                RankRequestDto.class);

        assertThatThrownBy(dto::toRankingRequest).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scoringResultSerializesWithSnakeCaseKeys() {
        ScoringEngine engine = ScoringEngine.create(TestFixtures.bundledConfig());
        Intent intent = new Intent.Builder().mustHave(Collections.singletonList("school")).build();
        ScoringResult result = engine.evaluate(listing("S1", "school", 600), intent, null, null);

        JsonNode json = mapper.valueToTree(ScoringResultDto.from(result));

        assertThat(json.get("id").asText()).isEqualTo("S1");
        assertThat(json.get("is_disqualified").asBoolean()).isFalse();
        assertThat(json.has("disqualification_reason")).isFalse();
        assertThat(json.get("positive_signals").get(0).asText()).startsWith("Near School");
        assertThat(json.get("signals").get(0).get("kind").asText()).isEqualTo("positive");
        assertThat(json.get("score_breakdown").has("must_have:school")).isTrue();
        assertThat(json.get("data_quality").get("available_poi_keys").get(0).asText()).isEqualTo("school");
    }

    @Test
    void disqualifiedResultCarriesReason() {
        ScoringEngine engine = ScoringEngine.create(TestFixtures.bundledConfig());
        Intent intent = new Intent.Builder().mustHave(Collections.singletonList("school")).build();
        ScoringResult result = engine.evaluate(listing("S2", "school", 9000), intent, null, null);

        JsonNode json = mapper.valueToTree(ScoringResultDto.from(result));

        assertThat(json.get("is_disqualified").asBoolean()).isTrue();
        assertThat(json.get("score").asDouble()).isZero();
        assertThat(json.get("disqualification_reason").asText()).contains("School");
    }
}
