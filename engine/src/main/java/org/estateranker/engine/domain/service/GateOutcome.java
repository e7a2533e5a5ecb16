package org.estateranker.engine.domain.service;

import org.estateranker.engine.domain.model.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of one scoring step: either a terminal disqualification or a list of signals to merge.
 * Signals gathered before a disqualification are kept for audit.
 */
final class GateOutcome {

    private static final GateOutcome NOTHING = new GateOutcome(null, Collections.emptyList());

    private final String disqualificationReason;
    private final List<Signal> signals;

    private GateOutcome(String disqualificationReason, List<Signal> signals) {
        this.disqualificationReason = disqualificationReason;
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
    }

    static GateOutcome nothing() {
        return NOTHING;
    }

    static GateOutcome of(Signal signal) {
        return new GateOutcome(null, Collections.singletonList(signal));
    }

    static GateOutcome of(List<Signal> signals) {
        return signals.isEmpty() ? NOTHING : new GateOutcome(null, signals);
    }

    static GateOutcome disqualify(String reason) {
        return disqualify(reason, Collections.emptyList());
    }

    static GateOutcome disqualify(String reason, List<Signal> signalsSoFar) {
        return new GateOutcome(Objects.requireNonNull(reason, "reason must not be null"), signalsSoFar);
    }

    boolean isDisqualified() {
        return disqualificationReason != null;
    }

    String getDisqualificationReason() {
        return disqualificationReason;
    }

    List<Signal> getSignals() {
        return signals;
    }
}
