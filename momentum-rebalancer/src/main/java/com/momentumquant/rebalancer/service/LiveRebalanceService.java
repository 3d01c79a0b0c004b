package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.broker.BrokerAccount;
import com.momentumquant.rebalancer.broker.BrokerGateway;
import com.momentumquant.rebalancer.broker.ExecutionReport;
import com.momentumquant.rebalancer.broker.OrderRequest;
import com.momentumquant.rebalancer.broker.OrderResult;
import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.CatastrophicDataException;
import com.momentumquant.rebalancer.domain.Portfolio;
import com.momentumquant.rebalancer.domain.PriceHistoryProvider;
import com.momentumquant.rebalancer.domain.PriceTable;
import com.momentumquant.rebalancer.domain.RebalanceDecision;
import com.momentumquant.rebalancer.domain.RebalancePlan;
import com.momentumquant.rebalancer.domain.RebalancePlanner;
import com.momentumquant.rebalancer.domain.RestrictionListProvider;
import com.momentumquant.rebalancer.domain.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One rebalance against the broker account: the same filter, scoring and
 * reconciliation as a backtest step, applied to today's holdings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiveRebalanceService {

    private final BrokerGateway brokerGateway;
    private final PriceHistoryProvider priceHistory;
    private final RestrictionListProvider restrictions;
    private final MomentumProperties properties;

    /**
     * Plan the rebalance for the date without submitting anything.
     *
     * @throws CatastrophicDataException when no universe symbol has a price on the date
     */
    public RebalanceDecision plan(LocalDate asOf, BigDecimal additionalCapital) {
        BigDecimal extra = additionalCapital != null ? additionalCapital : BigDecimal.ZERO;
        if (extra.signum() < 0) {
            throw new IllegalArgumentException("Additional capital must not be negative: " + extra);
        }
        if (properties.getUniverse().isEmpty()) {
            throw new IllegalArgumentException("No universe configured (momentum.universe)");
        }

        BrokerAccount account = brokerGateway.fetchAccount();
        Portfolio portfolio = account.toPortfolio();
        log.info("Planning rebalance for {} - cash: {}, positions: {}, additional capital: {}",
                asOf, portfolio.getCash(), portfolio.getHoldings().size(), extra);

        Set<String> symbols = new LinkedHashSet<>(properties.getUniverse());
        symbols.addAll(portfolio.heldSymbols());
        symbols.add(properties.getCashEquivalent());
        if (properties.getBenchmarkSymbol() != null && !properties.getBenchmarkSymbol().isBlank()) {
            symbols.add(properties.getBenchmarkSymbol());
        }
        PriceTable prices = priceHistory.getPrices(symbols, asOf.minusDays(properties.getWarmupDays()), asOf);
        if (!prices.hasDataOn(asOf, properties.getUniverse())) {
            throw new CatastrophicDataException("No price data for the universe on " + asOf);
        }

        RebalancePlanner planner = new RebalancePlanner(properties.defaultWeights(),
                properties.scoringParameters(), properties.rebalanceRules(),
                properties.getBenchmarkSymbol(), properties.getRegimeWindow());
        RebalancePlan plan = planner.plan(asOf, properties.getUniverse(), portfolio, prices,
                restrictions.getRestrictedSymbols(asOf), extra);

        if (plan.isSkipped()) {
            return RebalanceDecision.builder()
                    .date(asOf)
                    .warning(plan.getMessage())
                    .build();
        }
        RebalanceDecision decision = plan.getDecision();
        decision.getWarnings().forEach(warning -> log.warn("Rebalance {}: {}", asOf, warning));
        log.info("Planned rebalance for {}: {} sells, {} buys, {} holds{}", asOf, decision.getSells().size(),
                decision.getBuys().size(), decision.getHolds().size(),
                decision.isWeakMarket() ? " (weak market)" : "");
        return decision;
    }

    /**
     * Plan and, unless it is a dry run, submit the orders: every sell first,
     * then every buy. A failed order is reported and not retried.
     */
    public ExecutionReport execute(LocalDate asOf, BigDecimal additionalCapital, boolean dryRun) {
        RebalanceDecision decision = plan(asOf, additionalCapital);
        ExecutionReport.ExecutionReportBuilder report = ExecutionReport.builder()
                .date(asOf)
                .dryRun(dryRun)
                .decision(decision);
        if (dryRun) {
            log.info("Dry run for {} - no orders submitted", asOf);
            return report.build();
        }

        for (RebalanceDecision.SellOrder sell : decision.getSells()) {
            report.result(submit(OrderRequest.builder()
                    .symbol(sell.getSymbol())
                    .side(Trade.TradeType.SELL)
                    .quantity(sell.getQuantity())
                    .referencePrice(sell.getPrice())
                    .build()));
        }
        for (RebalanceDecision.BuyOrder buy : decision.getBuys()) {
            report.result(submit(OrderRequest.builder()
                    .symbol(buy.getSymbol())
                    .side(Trade.TradeType.BUY)
                    .quantity(buy.getQuantity())
                    .referencePrice(buy.getPrice())
                    .build()));
        }

        ExecutionReport result = report.build();
        log.info("Rebalance {} executed - {} filled, {} failed", asOf, result.filledCount(), result.failedCount());
        return result;
    }

    private OrderResult submit(OrderRequest request) {
        OrderResult result;
        try {
            result = brokerGateway.submit(request);
        } catch (RuntimeException e) {
            result = OrderResult.failed(request, e.getMessage());
        }
        if (result.isFilled()) {
            log.debug("{} {} x{} filled", request.getSide(), request.getSymbol(), request.getQuantity());
        } else {
            log.warn("{} {} x{} failed: {}", request.getSide(), request.getSymbol(), request.getQuantity(),
                    result.getMessage());
        }
        return result;
    }
}
