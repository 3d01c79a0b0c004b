package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.controller.dto.BacktestRequest;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.BacktestResult;

/**
 * Service interface for backtest runs.
 */
public interface BacktestService {

    /**
     * Build a validated run configuration from the configured defaults and
     * the request's overrides.
     *
     * @param request the backtest request
     * @return the run configuration
     * @throws IllegalArgumentException when the merged parameters are invalid
     */
    BacktestConfig toConfig(BacktestRequest request);

    /**
     * Run one backtest synchronously.
     *
     * @param config the run configuration
     * @return the equity curve, rebalance log and summary metrics
     * @throws com.momentumquant.rebalancer.domain.CatastrophicDataException when the data cannot support the run
     */
    BacktestResult runBacktest(BacktestConfig config);
}
