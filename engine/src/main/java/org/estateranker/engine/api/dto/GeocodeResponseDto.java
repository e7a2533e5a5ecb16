package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.GeoPoint;

import java.util.List;
import java.util.Optional;

/**
 * DTO for a Google Geocoding API response. Only the fields the engine reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeocodeResponseDto {

    static final String STATUS_OK = "OK";

    @JsonProperty("status")
    private String status;

    @JsonProperty("results")
    private List<ResultDto> results;

    // Getters and Setters
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<ResultDto> getResults() {
        return results;
    }

    public void setResults(List<ResultDto> results) {
        this.results = results;
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    /**
     * Location of the first result, if it is complete and in range.
     */
    public Optional<GeoPoint> firstLocation() {
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        ResultDto first = results.get(0);
        if (first == null || first.getGeometry() == null || first.getGeometry().getLocation() == null) {
            return Optional.empty();
        }
        LocationDto location = first.getGeometry().getLocation();
        if (location.getLat() == null || location.getLng() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(GeoPoint.of(location.getLat(), location.getLng()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ResultDto {
        @JsonProperty("formatted_address")
        private String formattedAddress;

        @JsonProperty("geometry")
        private GeometryDto geometry;

        public String getFormattedAddress() {
            return formattedAddress;
        }

        public void setFormattedAddress(String formattedAddress) {
            this.formattedAddress = formattedAddress;
        }

        public GeometryDto getGeometry() {
            return geometry;
        }

        public void setGeometry(GeometryDto geometry) {
            this.geometry = geometry;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GeometryDto {
        @JsonProperty("location")
        private LocationDto location;

        public LocationDto getLocation() {
            return location;
        }

        public void setLocation(LocationDto location) {
            this.location = location;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LocationDto {
        @JsonProperty("lat")
        private Double lat;

        @JsonProperty("lng")
        private Double lng;

        public Double getLat() {
            return lat;
        }

        public void setLat(Double lat) {
            this.lat = lat;
        }

        public Double getLng() {
            return lng;
        }

        public void setLng(Double lng) {
            this.lng = lng;
        }
    }
}
