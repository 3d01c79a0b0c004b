package com.momentumquant.rebalancer.domain;

/**
 * Why a symbol was left out of a ranking or an eligible universe.
 */
public enum ExclusionReason {
    RESTRICTED,
    INSUFFICIENT_HISTORY,
    NO_PRICE_ON_DATE,
    UNDEFINED_FACTOR,
    BELOW_MIN_PRICE,
    ABOVE_MAX_PRICE,
    ILLIQUID;

    /**
     * Missing or unusable price data rather than a decision that the symbol
     * is ineligible. A held symbol excluded for such a reason is kept.
     */
    public boolean isDataGap() {
        return this == INSUFFICIENT_HISTORY || this == NO_PRICE_ON_DATE || this == UNDEFINED_FACTOR;
    }
}
