package com.momentumquant.rebalancer.domain;

/**
 * Exchange surveillance list a restriction comes from.
 */
public enum RestrictionType {
    /** Long-term additional surveillance; always excluded. */
    LONG_TERM,
    /** Short-term additional surveillance; excluded from the configured stage upward. */
    SHORT_TERM,
    /** Graded surveillance; always excluded. */
    GRADED
}
