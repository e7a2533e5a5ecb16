package org.estateranker.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only snapshot of one listing's attributes as supplied by the listing store.
 * <p>
 * The raw flat map is kept so that POI distances can be classified as present, missing
 * or unusable. Typed accessors parse leniently and never throw: a malformed value reads
 * as absent.
 */
public final class CandidateAttributes {

    public static final String ID = "id";
    public static final String ASSET_ID = "asset_id";
    public static final String ASSET_TYPE_ID = "asset_type_id";
    public static final String ASSET_TYPE_NAME = "asset_type_fixed";
    public static final String PET_FRIENDLY = "pet_friendly";
    public static final String SELLING_PRICE = "asset_details_selling_price";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String LOCATION_LATITUDE = "location_latitude";
    public static final String LOCATION_LONGITUDE = "location_longitude";
    public static final String LOCATION_VILLAGE = "location_village_th";
    public static final String LOCATION_ROAD = "location_road_th";
    public static final String LIFESTYLE_SCORE = "lifestyle_score";
    public static final String NAME = "name_th";

    private static final String POI_NAME_SUFFIX = "_name";
    private static final String UNKNOWN_ID = "unknown";

    private final String id;
    private final Map<String, Object> values;

    private CandidateAttributes(String id, Map<String, Object> values) {
        this.id = id;
        this.values = values;
    }

    /**
     * Snapshot of a flat attribute map. The id is taken from {@code id} or {@code asset_id}.
     */
    public static CandidateAttributes of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        Object rawId = copy.get(ID) != null ? copy.get(ID) : copy.get(ASSET_ID);
        return new CandidateAttributes(rawId != null ? String.valueOf(rawId) : UNKNOWN_ID, copy);
    }

    /**
     * Snapshot with an explicit id, used when the store keeps ids outside the attribute map.
     */
    public static CandidateAttributes of(String id, Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        return new CandidateAttributes(id != null ? id : UNKNOWN_ID,
                Collections.unmodifiableMap(new LinkedHashMap<>(raw)));
    }

    public String getId() {
        return id;
    }

    /**
     * Raw value for a key, or null when absent.
     */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Asset-type identifier, or null when absent or not an integer.
     */
    public Integer getAssetTypeId() {
        Double number = toNumber(values.get(ASSET_TYPE_ID));
        if (number == null || number != Math.rint(number)
                || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            return null;
        }
        return number.intValue();
    }

    /**
     * Human-readable asset type, falling back to the identifier.
     */
    public String getAssetTypeName() {
        String name = getText(ASSET_TYPE_NAME);
        if (name != null) {
            return name;
        }
        Integer typeId = getAssetTypeId();
        return typeId != null ? "type " + typeId : "unknown type";
    }

    /**
     * Explicit pet policy: TRUE, FALSE, or null when unset or unrecognised.
     */
    public Boolean getPetFriendly() {
        Object raw = values.get(PET_FRIENDLY);
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof String) {
            String normalized = ((String) raw).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "yes".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized) || "no".equals(normalized)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * PRESENT for a recognised pet flag, MISSING when unset, UNUSABLE for anything else.
     */
    public DataStatus getPetFriendlyStatus() {
        Object raw = values.get(PET_FRIENDLY);
        if (raw == null || (raw instanceof String && ((String) raw).trim().isEmpty())) {
            return DataStatus.MISSING;
        }
        return getPetFriendly() != null ? DataStatus.PRESENT : DataStatus.UNUSABLE;
    }

    /**
     * Selling price, or 0 when unset or malformed.
     */
    public double getSellingPrice() {
        Double price = toNumber(values.get(SELLING_PRICE));
        if (price == null || price.isNaN() || price.isInfinite() || price < 0) {
            return 0.0;
        }
        return price;
    }

    /**
     * Popularity score computed at ingestion, 0 when absent.
     */
    public double getLifestyleScore() {
        Double score = toNumber(values.get(LIFESTYLE_SCORE));
        return score == null || score.isNaN() || score.isInfinite() ? 0.0 : score;
    }

    /**
     * Status of the listing's own coordinates. Zero, blank or absent coordinates are MISSING,
     * unparseable or out-of-range ones are UNUSABLE.
     */
    public DataStatus getCoordinateStatus() {
        Object rawLat = firstPresent(LATITUDE, LOCATION_LATITUDE);
        Object rawLon = firstPresent(LONGITUDE, LOCATION_LONGITUDE);
        if (isBlank(rawLat) || isBlank(rawLon)) {
            return DataStatus.MISSING;
        }
        Double lat = toNumber(rawLat);
        Double lon = toNumber(rawLon);
        if (lat == null || lon == null || lat.isNaN() || lon.isNaN()) {
            return DataStatus.UNUSABLE;
        }
        if (lat == 0.0 || lon == 0.0) {
            return DataStatus.MISSING;
        }
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            return DataStatus.UNUSABLE;
        }
        return DataStatus.PRESENT;
    }

    public Optional<GeoPoint> getCoordinates() {
        if (getCoordinateStatus() != DataStatus.PRESENT) {
            return Optional.empty();
        }
        return Optional.of(GeoPoint.of(
                toNumber(firstPresent(LATITUDE, LOCATION_LATITUDE)),
                toNumber(firstPresent(LONGITUDE, LOCATION_LONGITUDE))));
    }

    /**
     * Trimmed text value, or null when absent or blank.
     */
    public String getText(String key) {
        Object raw = values.get(key);
        if (raw == null) {
            return null;
        }
        String text = String.valueOf(raw).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Name of the specific nearest POI instance (e.g. a station name), if the store recorded one.
     */
    public String getPoiName(String poiKey) {
        return getText(poiKey + POI_NAME_SUFFIX);
    }

    private Object firstPresent(String primary, String fallback) {
        Object value = values.get(primary);
        return isBlank(value) ? values.get(fallback) : value;
    }

    private static boolean isBlank(Object raw) {
        return raw == null || (raw instanceof String && ((String) raw).trim().isEmpty());
    }

    /**
     * Lenient numeric conversion. Numbers and numeric strings convert, anything else is null.
     */
    public static Double toNumber(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim().replace(",", "");
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CandidateAttributes)) {
            return false;
        }
        CandidateAttributes that = (CandidateAttributes) o;
        return id.equals(that.id) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, values);
    }

    @Override
    public String toString() {
        return "CandidateAttributes{id='" + id + "', keys=" + values.keySet() + '}';
    }
}
