package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.GeoPoint;

/**
 * DTO for a coordinate pair.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeoPointDto {

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    /**
     * Domain point, or null when either coordinate is absent.
     *
     * @throws IllegalArgumentException when coordinates are out of range
     */
    public GeoPoint toGeoPoint() {
        if (latitude == null || longitude == null) {
            return null;
        }
        return GeoPoint.of(latitude, longitude);
    }
}
