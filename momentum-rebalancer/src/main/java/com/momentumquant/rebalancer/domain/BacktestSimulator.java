package com.momentumquant.rebalancer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Replays the weekly momentum rebalance over history against a cash ledger.
 * <p>
 * Every trading day is marked to market at the close; on each scheduled
 * rebalance date the universe is filtered, scored and reconciled, and the
 * decision is filled at that day's close, sells before buys. A rebalance date
 * without any universe prices is skipped and the portfolio carried forward.
 * Runs are deterministic: identical inputs give identical results.
 */
@Slf4j
public class BacktestSimulator {

    private final PriceHistoryProvider priceHistory;
    private final RestrictionListProvider restrictions;

    public BacktestSimulator(PriceHistoryProvider priceHistory, RestrictionListProvider restrictions) {
        this.priceHistory = priceHistory;
        this.restrictions = restrictions;
    }

    /**
     * Run a backtest with the given configuration, loading prices for the
     * period plus the warm-up window.
     *
     * @throws CatastrophicDataException when the price data cannot support the run
     */
    public BacktestResult run(BacktestConfig config) {
        PriceTable prices = priceHistory.getPrices(config.symbolsToLoad(), config.dataStart(), config.getEndDate());
        return run(config, prices);
    }

    /**
     * Run against an already loaded table. Lets the optimizer share one load
     * across candidates.
     */
    public BacktestResult run(BacktestConfig config, PriceTable prices) {
        log.info("Starting backtest - Universe: {} symbols, Period: {} to {}, Weights: {}",
                config.getUniverse().size(), config.getStartDate(), config.getEndDate(),
                config.getWeights().format());

        NavigableSet<LocalDate> tradingDays = universeTradingDays(config, prices);
        if (tradingDays.isEmpty()) {
            throw new CatastrophicDataException(String.format(
                    "No price data for the universe between %s and %s", config.getStartDate(), config.getEndDate()));
        }

        RebalancePlanner planner = new RebalancePlanner(config);
        Portfolio portfolio = new Portfolio(config.getInitialCapital());
        List<LocalDate> schedule = RebalanceSchedule.weekly(
                config.getStartDate(), config.getEndDate(), config.getRebalanceDay());
        Set<LocalDate> scheduled = new HashSet<>(schedule);
        NavigableSet<LocalDate> timeline = new TreeSet<>(tradingDays);
        timeline.addAll(schedule);

        BacktestResult.BacktestResultBuilder result = BacktestResult.builder().weights(config.getWeights());
        SimulatorState state = SimulatorState.WARMING_UP;
        int missingDataDates = 0;

        for (LocalDate date : timeline) {
            boolean tradingDay = tradingDays.contains(date);

            if (scheduled.contains(date)) {
                RebalanceEvent event;
                if (!tradingDay) {
                    missingDataDates++;
                    String message = String.format("No price data on rebalance date %s, portfolio carried forward",
                            date);
                    log.warn(message);
                    event = RebalanceEvent.skipped(date, message);
                } else {
                    event = rebalance(date, config, prices, portfolio, planner);
                }
                result.rebalance(event);
                if (event.getOutcome() == RebalanceEvent.Outcome.SKIPPED) {
                    result.warning(event.getMessage());
                } else {
                    result.warnings(event.getDecision().getWarnings());
                    result.trades(event.getTrades());
                    state = SimulatorState.REBALANCING;
                }
            }

            if (tradingDay) {
                result.equityPoint(markToMarket(date, portfolio, prices));
                if (state == SimulatorState.REBALANCING) {
                    state = SimulatorState.HOLDING;
                }
            }
        }

        if (!schedule.isEmpty() && missingDataDates == schedule.size()) {
            throw new CatastrophicDataException(String.format(
                    "None of the %d rebalance dates between %s and %s has price data",
                    schedule.size(), config.getStartDate(), config.getEndDate()));
        }

        state = SimulatorState.FINALIZED;
        BacktestResult partial = result.build();
        BigDecimal benchmarkCagr = benchmarkCagr(config, prices, partial.getEquityCurve());
        PerformanceSummary summary = PerformanceMetrics.summarize(partial.getEquityCurve(),
                partial.getTrades().size(), config.getRiskFreeRate(), benchmarkCagr);

        log.info("Backtest completed - Total Return: {}%, CAGR: {}%, Volatility: {}%, " +
                        "Sharpe: {}, Sortino: {}, Max DD: {}%, Trades: {}, Skipped rebalances: {}",
                summary.getTotalReturn(), summary.getCagr(), summary.getVolatility(), summary.getSharpeRatio(),
                summary.getSortinoRatio(), summary.getMaxDrawdown(), summary.getTotalTrades(),
                partial.skippedRebalanceCount());

        return result
                .finalState(state)
                .finalCash(portfolio.getCash())
                .finalHoldings(portfolio.positions())
                .summary(summary)
                .build();
    }

    private RebalanceEvent rebalance(LocalDate date, BacktestConfig config, PriceTable prices, Portfolio portfolio,
                                     RebalancePlanner planner) {
        Set<String> restricted = restrictions.getRestrictedSymbols(date);
        RebalancePlan plan = planner.plan(date, config.getUniverse(), portfolio, prices, restricted, BigDecimal.ZERO);
        if (plan.isSkipped()) {
            return RebalanceEvent.skipped(date, plan.getMessage());
        }

        RebalanceDecision decision = plan.getDecision();
        List<Trade> trades = portfolio.execute(decision, config.getRules().getTransactionCostRate());
        log.debug("Rebalanced on {}: {} sells, {} buys, {} fills", date,
                decision.getSells().size(), decision.getBuys().size(), trades.size());
        return RebalanceEvent.builder()
                .date(date)
                .outcome(plan.getOutcome())
                .decision(decision)
                .trades(trades)
                .build();
    }

    private static NavigableSet<LocalDate> universeTradingDays(BacktestConfig config, PriceTable prices) {
        NavigableSet<LocalDate> days = new TreeSet<>();
        for (LocalDate date : prices.tradingDatesBetween(config.getStartDate(), config.getEndDate())) {
            if (prices.hasDataOn(date, config.getUniverse())) {
                days.add(date);
            }
        }
        return days;
    }

    private static EquityPoint markToMarket(LocalDate date, Portfolio portfolio, PriceTable prices) {
        BigDecimal total = portfolio.totalValue(symbol -> prices.lastCloseOnOrBefore(symbol, date));
        return new EquityPoint(date, total, portfolio.getCash(), portfolio.positions());
    }

    private static BigDecimal benchmarkCagr(BacktestConfig config, PriceTable prices, List<EquityPoint> curve) {
        if (config.getBenchmarkSymbol() == null || curve.isEmpty()) {
            return null;
        }
        LocalDate first = curve.get(0).getDate();
        LocalDate last = curve.get(curve.size() - 1).getDate();
        Optional<BigDecimal> start = prices.lastCloseOnOrBefore(config.getBenchmarkSymbol(), first);
        Optional<BigDecimal> end = prices.lastCloseOnOrBefore(config.getBenchmarkSymbol(), last);
        if (start.isEmpty() || end.isEmpty()) {
            return null;
        }
        return PerformanceMetrics.calculateCAGR(start.get(), end.get(), first, last);
    }
}
