package org.estateranker.engine.domain.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Classified numeric attribute value. Only PRESENT readings carry a value.
 */
public final class AttributeReading {

    private static final AttributeReading MISSING = new AttributeReading(DataStatus.MISSING, Double.NaN);
    private static final AttributeReading UNUSABLE = new AttributeReading(DataStatus.UNUSABLE, Double.NaN);

    private final DataStatus status;
    private final double value;

    private AttributeReading(DataStatus status, double value) {
        this.status = status;
        this.value = value;
    }

    public static AttributeReading present(double value) {
        return new AttributeReading(DataStatus.PRESENT, value);
    }

    public static AttributeReading missing() {
        return MISSING;
    }

    public static AttributeReading unusable() {
        return UNUSABLE;
    }

    public DataStatus getStatus() {
        return status;
    }

    public boolean isPresent() {
        return status == DataStatus.PRESENT;
    }

    public OptionalDouble value() {
        return isPresent() ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeReading)) {
            return false;
        }
        AttributeReading that = (AttributeReading) o;
        return status == that.status && (status != DataStatus.PRESENT || Double.compare(that.value, value) == 0);
    }

    @Override
    public int hashCode() {
        return status == DataStatus.PRESENT ? Objects.hash(status, value) : status.hashCode();
    }

    @Override
    public String toString() {
        return isPresent() ? "PRESENT(" + value + ")" : status.name();
    }
}
