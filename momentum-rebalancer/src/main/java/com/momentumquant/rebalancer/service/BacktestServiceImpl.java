package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.controller.dto.BacktestRequest;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.BacktestResult;
import com.momentumquant.rebalancer.domain.BacktestSimulator;
import com.momentumquant.rebalancer.domain.RebalanceRules;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Implementation of BacktestService running the simulator in the caller's thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestSimulator simulator;
    private final MomentumProperties properties;
    private final EngineMetricsService metricsService;

    @Override
    public BacktestConfig toConfig(BacktestRequest request) {
        BacktestConfig.BacktestConfigBuilder builder = properties.backtestDefaults()
                .startDate(request.getStartDate())
                .endDate(request.getEndDate());

        if (request.getUniverse() != null && !request.getUniverse().isEmpty()) {
            builder.universe(request.getUniverse());
        }
        if (request.getWeights() != null) {
            builder.weights(WeightCandidate.parse(request.getWeights()));
        }
        if (request.getInitialCapital() != null) {
            builder.initialCapital(request.getInitialCapital());
        }
        if (request.getRebalanceDay() != null) {
            builder.rebalanceDay(request.getRebalanceDay());
        }
        if (request.getBenchmarkSymbol() != null) {
            builder.benchmarkSymbol(request.getBenchmarkSymbol());
        }

        RebalanceRules.RebalanceRulesBuilder rules = properties.rebalanceRules().toBuilder();
        if (request.getTopN() != null) {
            rules.topN(request.getTopN());
        }
        if (request.getBand() != null) {
            rules.band(request.getBand());
        }
        if (request.getTransactionCostPct() != null) {
            rules.transactionCostRate(request.getTransactionCostPct()
                    .divide(BigDecimal.valueOf(100), 10, RoundingMode.HALF_UP)
                    .stripTrailingZeros());
        }
        return builder.rules(rules.build()).build();
    }

    @Override
    public BacktestResult runBacktest(BacktestConfig config) {
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        long startTime = System.currentTimeMillis();
        try {
            log.info("Running backtest {} for {} symbols", runId, config.getUniverse().size());
            BacktestResult result = simulator.run(config);

            long executionTime = System.currentTimeMillis() - startTime;
            metricsService.recordBacktestCompleted(executionTime, result.skippedRebalanceCount());
            log.info("Backtest {} finished in {}ms - {}", runId, executionTime, metricsService.getMetricsSummary());
            return result;
        } catch (RuntimeException e) {
            metricsService.recordBacktestFailed();
            log.error("Backtest {} aborted: {}", runId, e.getMessage());
            throw e;
        } finally {
            MDC.remove("runId");
        }
    }
}
