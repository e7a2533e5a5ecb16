package org.estateranker.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.estateranker.engine.TestFixtures;
import org.estateranker.engine.cache.ScoringConfigCacheImpl;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RankingResponse;
import org.estateranker.engine.domain.service.RankingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RankingServerTest {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient http = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private RankingService rankingService;
    private RankingServer server;

    @BeforeEach
    void setUp() throws IOException {
        ScoringConfigCacheImpl cache = new ScoringConfigCacheImpl(TestFixtures::bundledConfig);
        cache.refresh();
        rankingService = mock(RankingService.class);
        server = new RankingServer(0, cache, rankingService);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private String url(String path) {
        return "http://localhost:" + server.getPort() + path;
    }

    private Response post(String path, String body) throws IOException {
        return http.newCall(new Request.Builder().url(url(path)).post(RequestBody.create(body, JSON)).build())
                .execute();
    }

    private JsonNode json(Response response) throws IOException {
        return mapper.readTree(response.body().string());
    }

    @Test
    void healthReportsCatalogSize() throws IOException {
        try (Response response = http.newCall(new Request.Builder().url(url("/health")).build()).execute()) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("status").asText()).isEqualTo("healthy");
            assertThat(body.get("poi_keys").asInt()).isEqualTo(26);
        }
    }

    @Test
    void wrongMethodIsRejected() throws IOException {
        try (Response response = post("/health", "{}")) {
            assertThat(response.code()).isEqualTo(405);
        }
    }

    @Test
    void scoresSingleListing() throws IOException {
        String body = "{\"intent\": {\"must_have\": [\"school\"]},"
                + " \"listing\": {\"id\": \"L9\", \"school\": 5000}}";

        try (Response response = post("/score", body)) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode result = json(response);
            assertThat(result.get("id").asText()).isEqualTo("L9");
            assertThat(result.get("is_disqualified").asBoolean()).isTrue();
        }
    }

    @Test
    void scoreWithoutListingIsBadRequest() throws IOException {
        try (Response response = post("/score", "{\"intent\": {}}")) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    void malformedJsonIsBadRequest() throws IOException {
        try (Response response = post("/score", "{\"listing\": ")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(json(response).get("error").asText()).startsWith("malformed request");
        }
    }

    @Test
    void rankDelegatesToRankingService() throws IOException {
        when(rankingService.rank(any(RankingRequest.class)))
                .thenReturn(RankingResponse.empty("No candidates to rank", 0, 0));

        try (Response response = post("/rank", "{\"candidates\": [], \"top_n\": 2}")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("results")).isEmpty();
            assertThat(body.get("message").asText()).isEqualTo("No candidates to rank");
        }

        ArgumentCaptor<RankingRequest> captor = ArgumentCaptor.forClass(RankingRequest.class);
        verify(rankingService).rank(captor.capture());
        assertThat(captor.getValue().getTopN()).isEqualTo(2);
    }

    @Test
    void refreshReloadsConfiguration() throws IOException {
        try (Response response = post("/refresh", "")) {
            assertThat(response.code()).isEqualTo(200);
        }
    }
}
