package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Lookback windows and price/liquidity screens used by the scorer.
 * A screen with a zero threshold is switched off.
 */
@Value
public class ScoringParameters {

    public static final List<Integer> DEFAULT_LOOKBACKS = List.of(22, 44, 66);
    public static final int DEFAULT_PROXIMITY_LOOKBACK = 252;
    public static final int DEFAULT_LIQUIDITY_LOOKBACK = 22;
    public static final int DEFAULT_MAX_STALE_DAYS = 7;

    List<Integer> returnLookbacks;
    List<Integer> rsiLookbacks;
    int proximityLookback;
    BigDecimal minPrice;
    BigDecimal maxPrice;
    BigDecimal minMedianTradedValue;
    long minAverageVolume;
    int liquidityLookback;
    /** Calendar days the latest bar may lag the scoring date before the symbol counts as unpriced. */
    int maxStaleDays;

    @Builder(toBuilder = true)
    private ScoringParameters(List<Integer> returnLookbacks, List<Integer> rsiLookbacks, Integer proximityLookback,
                              BigDecimal minPrice, BigDecimal maxPrice, BigDecimal minMedianTradedValue,
                              Long minAverageVolume, Integer liquidityLookback, Integer maxStaleDays) {
        this.returnLookbacks = List.copyOf(returnLookbacks == null ? DEFAULT_LOOKBACKS : returnLookbacks);
        this.rsiLookbacks = List.copyOf(rsiLookbacks == null ? DEFAULT_LOOKBACKS : rsiLookbacks);
        this.proximityLookback = proximityLookback == null ? DEFAULT_PROXIMITY_LOOKBACK : proximityLookback;
        this.minPrice = minPrice == null ? BigDecimal.ZERO : minPrice;
        this.maxPrice = maxPrice == null ? BigDecimal.ZERO : maxPrice;
        this.minMedianTradedValue = minMedianTradedValue == null ? BigDecimal.ZERO : minMedianTradedValue;
        this.minAverageVolume = minAverageVolume == null ? 0L : minAverageVolume;
        this.liquidityLookback = liquidityLookback == null ? DEFAULT_LIQUIDITY_LOOKBACK : liquidityLookback;
        this.maxStaleDays = maxStaleDays == null ? DEFAULT_MAX_STALE_DAYS : maxStaleDays;
        validate();
    }

    public static ScoringParameters defaults() {
        return ScoringParameters.builder().build();
    }

    private void validate() {
        if (returnLookbacks.isEmpty() || rsiLookbacks.isEmpty()) {
            throw new IllegalArgumentException("At least one return and one RSI lookback is required");
        }
        for (int window : returnLookbacks) {
            if (window < 1) {
                throw new IllegalArgumentException("Return lookback must be positive: " + window);
            }
        }
        for (int window : rsiLookbacks) {
            if (window < 1) {
                throw new IllegalArgumentException("RSI lookback must be positive: " + window);
            }
        }
        if (proximityLookback < 1) {
            throw new IllegalArgumentException("Proximity lookback must be positive: " + proximityLookback);
        }
        if (liquidityLookback < 1) {
            throw new IllegalArgumentException("Liquidity lookback must be positive: " + liquidityLookback);
        }
        if (maxStaleDays < 0) {
            throw new IllegalArgumentException("Maximum stale days must not be negative: " + maxStaleDays);
        }
        if (minPrice.signum() < 0 || maxPrice.signum() < 0 || minMedianTradedValue.signum() < 0
                || minAverageVolume < 0) {
            throw new IllegalArgumentException("Screen thresholds must not be negative");
        }
        if (maxPrice.signum() > 0 && maxPrice.compareTo(minPrice) <= 0) {
            throw new IllegalArgumentException("Maximum price must exceed minimum price");
        }
    }

    /**
     * Bars needed before every factor can be computed. The return over N
     * days reads N bars, RSI over N days reads N + 1.
     */
    public int requiredHistory() {
        int longestReturn = returnLookbacks.stream().mapToInt(Integer::intValue).max().orElse(1);
        int longestRsi = rsiLookbacks.stream().mapToInt(Integer::intValue).max().orElse(1) + 1;
        int required = Arrays.stream(new int[] { longestReturn, longestRsi, proximityLookback })
                .max().orElse(1);
        if (liquidityScreensEnabled()) {
            required = Math.max(required, liquidityLookback);
        }
        return required;
    }

    public boolean liquidityScreensEnabled() {
        return minMedianTradedValue.signum() > 0 || minAverageVolume > 0;
    }
}
