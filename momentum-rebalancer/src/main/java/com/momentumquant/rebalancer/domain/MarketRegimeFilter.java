package com.momentumquant.rebalancer.domain;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Classifies the market as strong when the benchmark closes above its simple
 * moving average. Missing or short benchmark history counts as strong.
 */
@Slf4j
public class MarketRegimeFilter {

    private final String benchmarkSymbol;
    private final int window;

    public MarketRegimeFilter(String benchmarkSymbol, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Moving-average window must be positive: " + window);
        }
        this.benchmarkSymbol = benchmarkSymbol;
        this.window = window;
    }

    public boolean isStrong(PriceTable prices, LocalDate asOf) {
        if (benchmarkSymbol == null || benchmarkSymbol.isBlank()) {
            return true;
        }
        List<PriceBar> history = prices.historyUpTo(benchmarkSymbol, asOf);
        double[] closes = history.stream().mapToDouble(bar -> bar.getClose().doubleValue()).toArray();
        OptionalDouble average = MomentumIndicators.simpleMovingAverage(closes, window);
        if (average.isEmpty()) {
            log.debug("Benchmark {} has {} bars on {}, treating market as strong",
                    benchmarkSymbol, closes.length, asOf);
            return true;
        }
        double latest = closes[closes.length - 1];
        return latest > average.getAsDouble();
    }
}
