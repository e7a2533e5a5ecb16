package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * Optional inclusive price bounds. Either bound may be unset (null).
 */
public final class PriceRange {

    private static final PriceRange UNBOUNDED = new PriceRange(null, null);

    private final Double min;
    private final Double max;

    private PriceRange(Double min, Double max) {
        this.min = min;
        this.max = max;
    }

    public static PriceRange of(Double min, Double max) {
        if (min == null && max == null) {
            return UNBOUNDED;
        }
        return new PriceRange(min, max);
    }

    public static PriceRange unbounded() {
        return UNBOUNDED;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public boolean isUnbounded() {
        return min == null && max == null;
    }

    public boolean isBelowMin(double price) {
        return min != null && price < min;
    }

    public boolean isAboveMax(double price) {
        return max != null && price > max;
    }

    /**
     * Inclusive on both bounds.
     */
    public boolean contains(double price) {
        return !isBelowMin(price) && !isAboveMax(price);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceRange)) {
            return false;
        }
        PriceRange that = (PriceRange) o;
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "PriceRange[" + min + ", " + max + "]";
    }
}
