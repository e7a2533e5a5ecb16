package org.estateranker.engine.api;

import org.estateranker.engine.domain.model.GeoPoint;

import java.util.Optional;

/**
 * Client for resolving free-text place names to coordinates.
 * Implementations never throw: any failure reads as "not found".
 */
public interface GeocodingClient {

    /**
     * Resolve a place name.
     *
     * @param placeName free-text name, e.g. a school or a district
     * @return coordinates, or empty when not found or the lookup failed
     */
    Optional<GeoPoint> geocode(String placeName);

    /**
     * A client that resolves nothing, used when no API key is configured.
     */
    static GeocodingClient disabled() {
        return placeName -> Optional.empty();
    }
}
