package org.estateranker.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of named hard-constraint toggles.
 * An enabled toggle turns the matching gate failure into a disqualification,
 * a disabled one turns it into a fixed penalty.
 */
public final class HardConstraints {

    public static final String WRONG_ASSET_TYPE = "wrong_asset_type";
    public static final String WRONG_TRANSPORT_TYPE = "wrong_transport_type";
    public static final String MUST_HAVE_POI_TOO_FAR = "must_have_poi_too_far";
    public static final String AVOID_POI_TOO_CLOSE = "avoid_poi_too_close";
    public static final String TARGET_LOCATION_TOO_FAR = "target_location_too_far";

    private final Map<String, Boolean> toggles;

    private HardConstraints(Map<String, Boolean> toggles) {
        this.toggles = Collections.unmodifiableMap(new HashMap<>(toggles));
    }

    /**
     * All gates enabled.
     */
    public static HardConstraints defaults() {
        return new HardConstraints(Collections.emptyMap());
    }

    /**
     * Every known gate disabled.
     */
    public static HardConstraints allDisabled() {
        Map<String, Boolean> off = new HashMap<>();
        off.put(WRONG_ASSET_TYPE, false);
        off.put(WRONG_TRANSPORT_TYPE, false);
        off.put(MUST_HAVE_POI_TOO_FAR, false);
        off.put(AVOID_POI_TOO_CLOSE, false);
        off.put(TARGET_LOCATION_TOO_FAR, false);
        return new HardConstraints(off);
    }

    public static HardConstraints fromMap(Map<String, Boolean> toggles) {
        Objects.requireNonNull(toggles, "toggles must not be null");
        Map<String, Boolean> copy = new HashMap<>();
        toggles.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return new HardConstraints(copy);
    }

    /**
     * Unknown toggles are enabled.
     */
    public boolean isEnabled(String key) {
        return toggles.getOrDefault(key, Boolean.TRUE);
    }

    public HardConstraints with(String key, boolean enabled) {
        Map<String, Boolean> copy = new HashMap<>(toggles);
        copy.put(key, enabled);
        return new HardConstraints(copy);
    }

    public boolean isWrongAssetTypeEnabled() {
        return isEnabled(WRONG_ASSET_TYPE);
    }

    public boolean isWrongTransportTypeEnabled() {
        return isEnabled(WRONG_TRANSPORT_TYPE);
    }

    public boolean isMustHavePoiTooFarEnabled() {
        return isEnabled(MUST_HAVE_POI_TOO_FAR);
    }

    public boolean isAvoidPoiTooCloseEnabled() {
        return isEnabled(AVOID_POI_TOO_CLOSE);
    }

    public boolean isTargetLocationTooFarEnabled() {
        return isEnabled(TARGET_LOCATION_TOO_FAR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HardConstraints && toggles.equals(((HardConstraints) o).toggles);
    }

    @Override
    public int hashCode() {
        return toggles.hashCode();
    }

    @Override
    public String toString() {
        return "HardConstraints" + toggles;
    }
}
