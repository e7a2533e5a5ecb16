package org.estateranker.engine.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.estateranker.engine.api.dto.GeocodeResponseDto;
import org.estateranker.engine.domain.model.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Retrofit-based GeocodingClient backed by the Google Geocoding API.
 * Results are biased to the configured region and language, and successful lookups
 * are kept in a small LRU cache to limit API cost.
 */
public final class GoogleGeocodingClient implements GeocodingClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleGeocodingClient.class);

    // Cache to avoid repeated API calls for the same place
    static final int MAX_CACHE_SIZE = 100;
    private final Map<String, GeoPoint> cache =
            new LinkedHashMap<String, GeoPoint>(MAX_CACHE_SIZE, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, GeoPoint> eldest) {
                    return size() > MAX_CACHE_SIZE;
                }
            };

    private final GeocodingApi api;
    private final String region;
    private final String language;

    /**
     * @param baseUrl API root, e.g. "https://maps.googleapis.com/"
     * @param apiKey Google Maps API key
     * @param region region bias (ccTLD), e.g. "th"
     * @param language result language, e.g. "th"
     */
    public GoogleGeocodingClient(String baseUrl, String apiKey, String region, String language) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.region = region;
        this.language = language;

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(new ApiKeyInterceptor(apiKey))
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build();

        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(mapper))
                .client(client)
                .build();

        this.api = retrofit.create(GeocodingApi.class);
    }

    @Override
    public Optional<GeoPoint> geocode(String placeName) {
        if (placeName == null || placeName.trim().isEmpty()) {
            return Optional.empty();
        }
        String name = placeName.trim();

        synchronized (cache) {
            GeoPoint cached = cache.get(name);
            if (cached != null) {
                return Optional.of(cached);
            }
        }

        GeocodeResponseDto response = execute(api.geocode(name, region, language), "geocode '" + name + "'");
        if (response == null) {
            return Optional.empty();
        }
        if (!response.isOk()) {
            log.warn("Location not found: '{}' (status {})", name, response.getStatus());
            return Optional.empty();
        }

        Optional<GeoPoint> point = response.firstLocation();
        if (point.isPresent()) {
            log.info("Geocoded '{}' -> {}", name, point.get());
            synchronized (cache) {
                cache.put(name, point.get());
            }
        } else {
            log.warn("Geocoding result for '{}' carried no usable location", name);
        }
        return point;
    }

    /**
     * Execute a Retrofit call and return the result, or null on any failure.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            log.warn("[Geocoding] {} failed: {} {}", description, response.code(), response.message());
            return null;
        } catch (Exception e) {
            log.warn("[Geocoding] {} error", description, e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the Geocoding API.
     */
    interface GeocodingApi {
        @GET("maps/api/geocode/json")
        Call<GeocodeResponseDto> geocode(@Query("address") String address,
                                         @Query("region") String region,
                                         @Query("language") String language);
    }
}
