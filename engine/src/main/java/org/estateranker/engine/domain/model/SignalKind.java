package org.estateranker.engine.domain.model;

/**
 * Direction of a scoring signal.
 */
public enum SignalKind {
    POSITIVE,
    NEGATIVE,
    /** Could not be verified; carries no score change. */
    WARNING
}
