package com.momentumquant.rebalancer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One rebalance step shared by the simulator and live mode: market-regime
 * check, universe filter, scoring and reconciliation against a portfolio.
 */
@Slf4j
public class RebalancePlanner {

    private final WeightCandidate weights;
    private final MomentumScorer scorer;
    private final UniverseFilter filter;
    private final PortfolioReconciler reconciler;
    private final MarketRegimeFilter regime;

    public RebalancePlanner(BacktestConfig config) {
        this(config.getWeights(), config.getScoring(), config.getRules(),
                config.getBenchmarkSymbol(), config.getRegimeWindow());
    }

    public RebalancePlanner(WeightCandidate weights, ScoringParameters scoring, RebalanceRules rules,
                            String benchmarkSymbol, int regimeWindow) {
        this.weights = weights;
        this.scorer = new MomentumScorer(scoring);
        this.filter = new UniverseFilter(scoring.requiredHistory());
        this.reconciler = new PortfolioReconciler(rules);
        this.regime = new MarketRegimeFilter(benchmarkSymbol, regimeWindow);
    }

    public RebalancePlan plan(LocalDate date, Collection<String> universe, Portfolio portfolio, PriceTable prices,
                              Set<String> restricted, BigDecimal additionalCapital) {
        Map<String, BigDecimal> executionPrices = executionPrices(date, universe, portfolio, prices);

        if (!regime.isStrong(prices, date)) {
            log.info("Weak market on {}, moving to {}", date, reconciler.getRules().getCashEquivalentSymbol());
            return RebalancePlan.builder()
                    .outcome(RebalanceEvent.Outcome.MOVED_TO_CASH)
                    .decision(reconciler.moveToCash(date, portfolio, executionPrices, additionalCapital))
                    .build();
        }

        EligibleUniverse eligible = filter.filter(universe, date, restricted, prices);
        ScoringResult ranking = scorer.score(date, eligible.getSymbols(), prices, weights)
                .withExclusions(eligible.getExcluded());
        int excludedCount = ranking.getExcluded().size();
        if (excludedCount > 0) {
            log.warn("{} of {} symbols excluded on {}", excludedCount, universe.size(), date);
        }

        if (ranking.isEmpty()) {
            String message = String.format("No symbol could be ranked on %s (%d excluded), portfolio carried forward",
                    date, excludedCount);
            log.warn(message);
            return RebalancePlan.skipped(message, ranking);
        }

        RebalanceDecision decision = reconciler.reconcile(date, portfolio, ranking, executionPrices,
                additionalCapital);
        return RebalancePlan.builder()
                .outcome(RebalanceEvent.Outcome.EXECUTED)
                .decision(decision)
                .ranking(ranking)
                .build();
    }

    /**
     * Latest close at or before the date for every symbol that may trade.
     */
    private Map<String, BigDecimal> executionPrices(LocalDate date, Collection<String> universe, Portfolio portfolio,
                                                    PriceTable prices) {
        Set<String> symbols = new LinkedHashSet<>(universe);
        symbols.addAll(portfolio.heldSymbols());
        symbols.add(reconciler.getRules().getCashEquivalentSymbol());
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            prices.lastCloseOnOrBefore(symbol, date).ifPresent(close -> result.put(symbol, close));
        }
        return result;
    }
}
