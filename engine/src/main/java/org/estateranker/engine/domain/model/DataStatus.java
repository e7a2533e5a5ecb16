package org.estateranker.engine.domain.model;

/**
 * What is known about one candidate attribute.
 */
public enum DataStatus {
    /** A usable, verified value. */
    PRESENT,
    /** Absent, null, or a legacy "far away" sentinel. */
    MISSING,
    /** Present but malformed: non-numeric, negative or not finite. */
    UNUSABLE
}
