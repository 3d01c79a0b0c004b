package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Band-rule and sizing settings for the reconciler.
 */
@Value
public class RebalanceRules {

    public static final int DEFAULT_TOP_N = 15;
    public static final int DEFAULT_BAND = 5;
    public static final String DEFAULT_CASH_EQUIVALENT = "LIQUIDCASE";
    public static final double DEFAULT_JUMP_THRESHOLD = 0.15;

    int topN;
    int band;
    String cashEquivalentSymbol;
    BigDecimal transactionCostRate;
    double jumpThreshold;

    @Builder(toBuilder = true)
    private RebalanceRules(Integer topN, Integer band, String cashEquivalentSymbol,
                           BigDecimal transactionCostRate, Double jumpThreshold) {
        this.topN = topN == null ? DEFAULT_TOP_N : topN;
        this.band = band == null ? DEFAULT_BAND : band;
        this.cashEquivalentSymbol = cashEquivalentSymbol == null ? DEFAULT_CASH_EQUIVALENT : cashEquivalentSymbol;
        this.transactionCostRate = transactionCostRate == null ? BigDecimal.ZERO : transactionCostRate;
        this.jumpThreshold = jumpThreshold == null ? DEFAULT_JUMP_THRESHOLD : jumpThreshold;

        if (this.topN <= 0) {
            throw new IllegalArgumentException("Top-N must be positive: " + this.topN);
        }
        if (this.band < 0) {
            throw new IllegalArgumentException("Band must not be negative: " + this.band);
        }
        if (this.cashEquivalentSymbol.isBlank()) {
            throw new IllegalArgumentException("Cash-equivalent symbol must not be blank");
        }
        if (this.transactionCostRate.signum() < 0 || this.transactionCostRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Transaction cost rate must be in [0, 1): " + this.transactionCostRate);
        }
        if (this.jumpThreshold < 0) {
            throw new IllegalArgumentException("Jump threshold must not be negative: " + this.jumpThreshold);
        }
    }

    public static RebalanceRules defaults() {
        return RebalanceRules.builder().build();
    }

    /**
     * Worst rank at which a held name is still kept.
     */
    public int retentionLimit() {
        return topN + band;
    }

    public boolean isCashEquivalent(String symbol) {
        return cashEquivalentSymbol.equals(symbol);
    }
}
