package org.estateranker.engine.domain.model;

/**
 * Tri-state pet preference of a search intent.
 */
public enum PetPreference {
    WANTS_PETS,
    NO_PETS,
    UNSPECIFIED;

    public static PetPreference fromBoolean(Boolean wantsPets) {
        if (wantsPets == null) {
            return UNSPECIFIED;
        }
        return wantsPets ? WANTS_PETS : NO_PETS;
    }

    public Boolean toBoolean() {
        switch (this) {
            case WANTS_PETS:
                return Boolean.TRUE;
            case NO_PETS:
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
