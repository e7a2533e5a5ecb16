package org.estateranker.engine.domain.model;

import java.util.Objects;

/**
 * One itemized reason behind a score: its direction, a machine label, a readable message
 * and the numeric contribution it made.
 */
public final class Signal {

    private final SignalKind kind;
    private final String label;
    private final String message;
    private final double contribution;

    private Signal(SignalKind kind, String label, String message, double contribution) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.contribution = contribution;
    }

    public static Signal positive(String label, String message, double contribution) {
        return new Signal(SignalKind.POSITIVE, label, message, contribution);
    }

    public static Signal negative(String label, String message, double contribution) {
        return new Signal(SignalKind.NEGATIVE, label, message, contribution);
    }

    public static Signal warning(String label, String message) {
        return new Signal(SignalKind.WARNING, label, message, 0.0);
    }

    public SignalKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    public String getMessage() {
        return message;
    }

    public double getContribution() {
        return contribution;
    }

    public boolean isPositive() {
        return kind == SignalKind.POSITIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signal)) {
            return false;
        }
        Signal that = (Signal) o;
        return Double.compare(that.contribution, contribution) == 0
                && kind == that.kind
                && label.equals(that.label)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, label, message, contribution);
    }

    @Override
    public String toString() {
        return String.format("%s[%s] %s (%+.2f)", kind, label, message, contribution);
    }
}
