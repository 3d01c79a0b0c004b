package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Everything one simulator run needs. Validated on construction.
 */
@Value
public class BacktestConfig {

    public static final int DEFAULT_WARMUP_DAYS = 400;
    public static final int DEFAULT_REGIME_WINDOW = 200;
    public static final BigDecimal DEFAULT_INITIAL_CAPITAL = new BigDecimal("1000000");

    List<String> universe;
    LocalDate startDate;
    LocalDate endDate;
    DayOfWeek rebalanceDay;
    BigDecimal initialCapital;
    WeightCandidate weights;
    ScoringParameters scoring;
    RebalanceRules rules;
    int warmupDays;
    String benchmarkSymbol;
    int regimeWindow;
    double riskFreeRate;

    @Builder(toBuilder = true)
    private BacktestConfig(List<String> universe, LocalDate startDate, LocalDate endDate, DayOfWeek rebalanceDay,
                           BigDecimal initialCapital, WeightCandidate weights, ScoringParameters scoring,
                           RebalanceRules rules, Integer warmupDays, String benchmarkSymbol,
                           Integer regimeWindow, Double riskFreeRate) {
        if (universe == null || universe.isEmpty()) {
            throw new IllegalArgumentException("Universe must contain at least one symbol");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("Start date " + startDate + " is after end date " + endDate);
        }
        this.universe = List.copyOf(new LinkedHashSet<>(universe));
        this.startDate = startDate;
        this.endDate = endDate;
        this.rebalanceDay = rebalanceDay == null ? DayOfWeek.WEDNESDAY : rebalanceDay;
        this.initialCapital = initialCapital == null ? DEFAULT_INITIAL_CAPITAL : initialCapital;
        if (this.initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive: " + this.initialCapital);
        }
        this.weights = weights == null ? WeightCandidate.of(0.8, 0.1, 0.1) : weights;
        this.scoring = scoring == null ? ScoringParameters.defaults() : scoring;
        this.rules = rules == null ? RebalanceRules.defaults() : rules;
        this.warmupDays = warmupDays == null ? DEFAULT_WARMUP_DAYS : warmupDays;
        if (this.warmupDays < 0) {
            throw new IllegalArgumentException("Warm-up days must not be negative: " + this.warmupDays);
        }
        this.benchmarkSymbol = benchmarkSymbol == null || benchmarkSymbol.isBlank() ? null : benchmarkSymbol;
        this.regimeWindow = regimeWindow == null ? DEFAULT_REGIME_WINDOW : regimeWindow;
        if (this.regimeWindow < 1) {
            throw new IllegalArgumentException("Regime window must be positive: " + this.regimeWindow);
        }
        this.riskFreeRate = riskFreeRate == null ? 0.0 : riskFreeRate;
    }

    public BacktestConfig withWeights(WeightCandidate candidate) {
        return toBuilder().weights(candidate).build();
    }

    public LocalDate dataStart() {
        return startDate.minusDays(warmupDays);
    }

    /**
     * Universe plus the cash-equivalent and benchmark symbols.
     */
    public List<String> symbolsToLoad() {
        LinkedHashSet<String> symbols = new LinkedHashSet<>(universe);
        symbols.add(rules.getCashEquivalentSymbol());
        if (benchmarkSymbol != null) {
            symbols.add(benchmarkSymbol);
        }
        return List.copyOf(symbols);
    }
}
