package org.estateranker.engine.api;

import com.sun.net.httpserver.HttpServer;
import org.estateranker.engine.domain.model.GeoPoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class GoogleGeocodingClientTest {

    private static final String FOUND = "{\"status\":\"OK\",\"results\":[{\"formatted_address\":\"Siam\","
            + "\"geometry\":{\"location\":{\"lat\":13.7462,\"lng\":100.5347}}}]}";
    private static final String NOT_FOUND = "{\"status\":\"ZERO_RESULTS\",\"results\":[]}";

    private HttpServer server;
    private final Deque<String[]> replies = new ArrayDeque<>();
    private final List<URI> requests = new CopyOnWriteArrayList<>();
    private GoogleGeocodingClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", exchange -> {
            requests.add(exchange.getRequestURI());
            String[] reply;
            synchronized (replies) {
                reply = replies.isEmpty() ? new String[]{"404", "{}"} : replies.poll();
            }
            byte[] bytes = reply[1].getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(Integer.parseInt(reply[0]), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        client = new GoogleGeocodingClient("http://localhost:" + server.getAddress().getPort(),
                "test-key", "th", "th");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void reply(int status, String body) {
        synchronized (replies) {
            replies.add(new String[]{String.valueOf(status), body});
        }
    }

    private static Map<String, String> query(URI uri) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : uri.getRawQuery().split("&")) {
            int eq = pair.indexOf('=');
            params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    @Test
    void resolvesPlaceAndSendsKeyAndBias() {
        reply(200, FOUND);

        Optional<GeoPoint> point = client.geocode("  Siam Paragon ");

        assertThat(point).contains(GeoPoint.of(13.7462, 100.5347));
        assertThat(requests).hasSize(1);
        URI request = requests.get(0);
        assertThat(request.getPath()).isEqualTo("/maps/api/geocode/json");
        assertThat(query(request))
                .containsEntry(ApiKeyInterceptor.KEY_PARAMETER, "test-key")
                .containsEntry("address", "Siam Paragon")
                .containsEntry("region", "th")
                .containsEntry("language", "th");
    }

    @Test
    void successfulLookupsAreCached() {
        reply(200, FOUND);

        client.geocode("Siam Paragon");
        Optional<GeoPoint> second = client.geocode("Siam Paragon");

        assertThat(second).isPresent();
        assertThat(requests).hasSize(1);
    }

    @Test
    void unknownPlaceIsEmptyAndNotCached() {
        reply(200, NOT_FOUND);
        reply(200, NOT_FOUND);

        assertThat(client.geocode("Atlantis")).isEmpty();
        assertThat(client.geocode("Atlantis")).isEmpty();
        assertThat(requests).hasSize(2);
    }

    @Test
    void httpErrorIsEmpty() {
        reply(500, "{\"error_message\":\"backend error\"}");

        assertThat(client.geocode("Siam Paragon")).isEmpty();
    }

    @Test
    void malformedBodyIsEmpty() {
        reply(200, "not json");

        assertThat(client.geocode("Siam Paragon")).isEmpty();
    }

    @Test
    void blankNameSkipsTheCall() {
        assertThat(client.geocode(" ")).isEmpty();
        assertThat(client.geocode(null)).isEmpty();
        assertThat(requests).isEmpty();
    }

    @Test
    void disabledClientResolvesNothing() {
        assertThat(GeocodingClient.disabled().geocode("Siam Paragon")).isEmpty();
    }
}
