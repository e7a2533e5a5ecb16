package org.estateranker.engine.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Many-to-many mapping from asset-type labels (as produced by intent extraction)
 * to the integer asset-type identifiers used by the listing store.
 */
public final class AssetTypeMapping {

    private final Map<String, Set<Integer>> idsByLabel;
    private final Set<Integer> petFriendlyIds;
    private final Set<Integer> condoIds;

    private AssetTypeMapping(Map<String, ? extends Collection<Integer>> idsByLabel,
                             Collection<Integer> petFriendlyIds,
                             Collection<Integer> condoIds) {
        Map<String, Set<Integer>> normalized = new LinkedHashMap<>();
        idsByLabel.forEach((label, ids) -> {
            if (label != null && ids != null) {
                normalized.computeIfAbsent(normalize(label), k -> new LinkedHashSet<>()).addAll(ids);
            }
        });
        normalized.replaceAll((label, ids) -> Collections.unmodifiableSet(ids));
        this.idsByLabel = Collections.unmodifiableMap(normalized);
        this.petFriendlyIds = Collections.unmodifiableSet(new LinkedHashSet<>(petFriendlyIds));
        this.condoIds = Collections.unmodifiableSet(new LinkedHashSet<>(condoIds));
    }

    public static AssetTypeMapping of(Map<String, ? extends Collection<Integer>> idsByLabel,
                                      Collection<Integer> petFriendlyIds,
                                      Collection<Integer> condoIds) {
        Objects.requireNonNull(idsByLabel, "idsByLabel must not be null");
        Objects.requireNonNull(petFriendlyIds, "petFriendlyIds must not be null");
        Objects.requireNonNull(condoIds, "condoIds must not be null");
        return new AssetTypeMapping(idsByLabel, petFriendlyIds, condoIds);
    }

    public static AssetTypeMapping empty() {
        return new AssetTypeMapping(Collections.emptyMap(), List.of(4, 15, 1), List.of(3, 12));
    }

    /**
     * Union of the identifiers accepted for the requested labels. Unknown labels contribute nothing.
     */
    public Set<Integer> acceptedIds(Collection<String> labels) {
        Set<Integer> accepted = new LinkedHashSet<>();
        for (String label : labels) {
            if (label == null) {
                continue;
            }
            Set<Integer> ids = idsByLabel.get(normalize(label));
            if (ids != null) {
                accepted.addAll(ids);
            }
        }
        return accepted;
    }

    public boolean isCondoClass(int assetTypeId) {
        return condoIds.contains(assetTypeId);
    }

    /**
     * Detached, semi-detached and townhome class identifiers.
     */
    public boolean isPetFriendlyClass(int assetTypeId) {
        return petFriendlyIds.contains(assetTypeId);
    }

    public Map<String, Set<Integer>> getIdsByLabel() {
        return idsByLabel;
    }

    public Set<Integer> getPetFriendlyIds() {
        return petFriendlyIds;
    }

    public Set<Integer> getCondoIds() {
        return condoIds;
    }

    private static String normalize(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssetTypeMapping)) {
            return false;
        }
        AssetTypeMapping that = (AssetTypeMapping) o;
        return idsByLabel.equals(that.idsByLabel)
                && petFriendlyIds.equals(that.petFriendlyIds)
                && condoIds.equals(that.condoIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(idsByLabel, petFriendlyIds, condoIds);
    }

    @Override
    public String toString() {
        return "AssetTypeMapping" + idsByLabel.keySet();
    }
}
