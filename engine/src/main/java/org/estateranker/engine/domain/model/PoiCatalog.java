package org.estateranker.engine.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of POI definitions keyed by POI key.
 * Shared read-only by every scoring call.
 */
public final class PoiCatalog {

    private final Map<String, PoiDefinition> definitions;
    private final List<String> rapidTransitKeys;

    private PoiCatalog(Map<String, PoiDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        List<String> rapid = new ArrayList<>();
        for (PoiDefinition definition : definitions.values()) {
            if (definition.isRapidTransit()) {
                rapid.add(definition.getKey());
            }
        }
        this.rapidTransitKeys = Collections.unmodifiableList(rapid);
    }

    /**
     * Creates a catalog preserving the iteration order of the given definitions.
     */
    public static PoiCatalog of(Collection<PoiDefinition> definitions) {
        Map<String, PoiDefinition> byKey = new LinkedHashMap<>();
        for (PoiDefinition definition : definitions) {
            byKey.put(definition.getKey(), definition);
        }
        return new PoiCatalog(byKey);
    }

    public static PoiCatalog empty() {
        return new PoiCatalog(Collections.emptyMap());
    }

    public Optional<PoiDefinition> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(key));
    }

    public boolean contains(String key) {
        return key != null && definitions.containsKey(key);
    }

    /**
     * Display label for a key, or the key itself when it is not catalogued.
     */
    public String displayNameOf(String key) {
        PoiDefinition definition = key == null ? null : definitions.get(key);
        return definition != null ? definition.getDisplayName() : String.valueOf(key);
    }

    public boolean isRapidTransit(String key) {
        PoiDefinition definition = key == null ? null : definitions.get(key);
        return definition != null && definition.isRapidTransit();
    }

    /**
     * Catalog keys flagged as rapid transit, in catalog order.
     */
    public List<String> getRapidTransitKeys() {
        return rapidTransitKeys;
    }

    public Collection<PoiDefinition> getDefinitions() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PoiCatalog && definitions.equals(((PoiCatalog) o).definitions);
    }

    @Override
    public int hashCode() {
        return definitions.hashCode();
    }

    @Override
    public String toString() {
        return "PoiCatalog" + definitions.keySet();
    }
}
