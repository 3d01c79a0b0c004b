package com.momentumquant.rebalancer.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * Ranks symbols by a weighted blend of three momentum factors:
 * average total return, average RSI and closeness to the 52-week high.
 * <p>
 * Each factor is turned into a normalized sub-rank in [0, 1] (1 = best) so the
 * factors are comparable regardless of scale. Symbols with tied factor values
 * share the best position. The composite is the weighted sum of sub-ranks;
 * composite ties are broken by symbol in ascending order.
 */
@Slf4j
public class MomentumScorer {

    @Getter
    private final ScoringParameters parameters;

    public MomentumScorer(ScoringParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Score and rank the given symbols as of a date, using each symbol's bars
     * up to the date. Symbols without enough history, whose latest bar is
     * older than the staleness limit, with an undefined factor, or failing a
     * screen are reported in the excluded map rather than ranked.
     */
    public ScoringResult score(LocalDate asOf, Collection<String> symbols, PriceTable prices, WeightCandidate weights) {
        Map<String, ExclusionReason> excluded = new TreeMap<>();
        List<SymbolSnapshot> snapshots = new ArrayList<>();

        for (String symbol : new TreeSet<>(symbols)) {
            List<PriceBar> history = prices.historyUpTo(symbol, asOf);
            ExclusionReason reason = screen(asOf, history);
            if (reason != null) {
                excluded.put(symbol, reason);
                continue;
            }
            Optional<SymbolSnapshot> snapshot = snapshot(symbol, asOf, history);
            if (snapshot.isEmpty()) {
                excluded.put(symbol, ExclusionReason.UNDEFINED_FACTOR);
                continue;
            }
            snapshots.add(snapshot.get());
        }

        if (!excluded.isEmpty()) {
            log.debug("Excluded {} of {} symbols on {}: {}", excluded.size(), symbols.size(), asOf, excluded);
        }

        List<RankedSymbol> ranked = rank(snapshots, weights);
        return new ScoringResult(asOf, weights, ranked, excluded);
    }

    private ExclusionReason screen(LocalDate asOf, List<PriceBar> history) {
        if (history.size() < parameters.requiredHistory()) {
            return ExclusionReason.INSUFFICIENT_HISTORY;
        }
        PriceBar latest = history.get(history.size() - 1);
        if (latest.getDate().plusDays(parameters.getMaxStaleDays()).isBefore(asOf)) {
            return ExclusionReason.NO_PRICE_ON_DATE;
        }
        BigDecimal close = latest.getClose();
        if (parameters.getMinPrice().signum() > 0 && close.compareTo(parameters.getMinPrice()) < 0) {
            return ExclusionReason.BELOW_MIN_PRICE;
        }
        if (parameters.getMaxPrice().signum() > 0 && close.compareTo(parameters.getMaxPrice()) >= 0) {
            return ExclusionReason.ABOVE_MAX_PRICE;
        }
        if (parameters.liquidityScreensEnabled() && isIlliquid(history)) {
            return ExclusionReason.ILLIQUID;
        }
        return null;
    }

    private boolean isIlliquid(List<PriceBar> history) {
        int window = parameters.getLiquidityLookback();
        List<PriceBar> recent = history.subList(history.size() - window, history.size());
        if (recent.stream().anyMatch(bar -> !bar.hasVolume())) {
            return true;
        }
        double[] closes = recent.stream().mapToDouble(bar -> bar.getClose().doubleValue()).toArray();
        double[] volumes = recent.stream().mapToDouble(bar -> bar.getVolume().doubleValue()).toArray();

        if (parameters.getMinMedianTradedValue().signum() > 0) {
            OptionalDouble median = MomentumIndicators.medianTradedValue(closes, volumes, window);
            if (median.isEmpty() || median.getAsDouble() < parameters.getMinMedianTradedValue().doubleValue()) {
                return true;
            }
        }
        if (parameters.getMinAverageVolume() > 0) {
            OptionalDouble average = MomentumIndicators.averageVolume(volumes, window);
            return average.isEmpty() || average.getAsDouble() < parameters.getMinAverageVolume();
        }
        return false;
    }

    /**
     * Empty when any factor is undefined for the series, e.g. a zero close at
     * the start of a return window.
     */
    private Optional<SymbolSnapshot> snapshot(String symbol, LocalDate asOf, List<PriceBar> history) {
        double[] closes = history.stream().mapToDouble(bar -> bar.getClose().doubleValue()).toArray();

        List<Double> returns = new ArrayList<>();
        for (int window : parameters.getReturnLookbacks()) {
            OptionalDouble value = MomentumIndicators.totalReturn(closes, window);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            returns.add(value.getAsDouble());
        }
        List<Double> rsiValues = new ArrayList<>();
        for (int window : parameters.getRsiLookbacks()) {
            OptionalDouble value = MomentumIndicators.rsi(closes, window);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            rsiValues.add(value.getAsDouble());
        }
        OptionalDouble percentFromHigh = MomentumIndicators.percentFromHigh(closes, parameters.getProximityLookback());
        if (percentFromHigh.isEmpty()) {
            return Optional.empty();
        }
        OptionalDouble dailyReturn = MomentumIndicators.dailyReturn(closes);

        return Optional.of(SymbolSnapshot.builder()
                .symbol(symbol)
                .asOfDate(asOf)
                .close(history.get(history.size() - 1).getClose())
                .returns(List.copyOf(returns))
                .rsiValues(List.copyOf(rsiValues))
                .returnScore(average(returns))
                .rsiScore(average(rsiValues))
                .percentFromHigh(percentFromHigh.getAsDouble())
                .dailyReturn(dailyReturn.isPresent() ? dailyReturn.getAsDouble() : null)
                .build());
    }

    private List<RankedSymbol> rank(List<SymbolSnapshot> snapshots, WeightCandidate weights) {
        Map<String, Double> returnRanks = normalizedRanks(snapshots, SymbolSnapshot::getReturnScore, true);
        Map<String, Double> rsiRanks = normalizedRanks(snapshots, SymbolSnapshot::getRsiScore, true);
        Map<String, Double> proximityRanks = normalizedRanks(snapshots, SymbolSnapshot::getPercentFromHigh, false);

        List<RankedSymbol> unordered = new ArrayList<>();
        for (SymbolSnapshot snapshot : snapshots) {
            String symbol = snapshot.getSymbol();
            double composite = weights.getReturnWeight() * returnRanks.get(symbol)
                    + weights.getRsiWeight() * rsiRanks.get(symbol)
                    + weights.getProximityWeight() * proximityRanks.get(symbol);
            unordered.add(RankedSymbol.builder()
                    .symbol(symbol)
                    .compositeScore(composite)
                    .returnSubRank(returnRanks.get(symbol))
                    .rsiSubRank(rsiRanks.get(symbol))
                    .proximitySubRank(proximityRanks.get(symbol))
                    .snapshot(snapshot)
                    .build());
        }

        unordered.sort(Comparator.comparingDouble(RankedSymbol::getCompositeScore).reversed()
                .thenComparing(RankedSymbol::getSymbol));

        List<RankedSymbol> ranked = new ArrayList<>(unordered.size());
        for (int i = 0; i < unordered.size(); i++) {
            ranked.add(unordered.get(i).toBuilder().rank(i + 1).build());
        }
        return ranked;
    }

    /**
     * Position-based sub-rank: best value maps to 1.0, worst to 0.0.
     * Equal values share the position of the first of them.
     */
    static Map<String, Double> normalizedRanks(List<SymbolSnapshot> snapshots,
                                               ToDoubleFunction<SymbolSnapshot> factor,
                                               boolean higherIsBetter) {
        List<SymbolSnapshot> ordered = new ArrayList<>(snapshots);
        Comparator<SymbolSnapshot> byValue = Comparator.comparingDouble(factor);
        ordered.sort(higherIsBetter ? byValue.reversed() : byValue);

        int count = ordered.size();
        Map<String, Double> ranks = new HashMap<>();
        int position = 0;
        double previous = Double.NaN;
        for (int i = 0; i < count; i++) {
            double value = factor.applyAsDouble(ordered.get(i));
            if (i == 0 || Double.compare(value, previous) != 0) {
                position = i;
                previous = value;
            }
            double normalized = count == 1 ? 1.0 : (double) (count - 1 - position) / (count - 1);
            ranks.put(ordered.get(i).getSymbol(), normalized);
        }
        return ranks;
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
