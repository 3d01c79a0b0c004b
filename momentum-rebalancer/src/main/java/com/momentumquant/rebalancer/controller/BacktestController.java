package com.momentumquant.rebalancer.controller;

import com.momentumquant.rebalancer.controller.dto.BacktestRequest;
import com.momentumquant.rebalancer.controller.dto.BacktestResponse;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.BacktestResult;
import com.momentumquant.rebalancer.service.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for backtest runs.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;

    /**
     * Run one backtest and return its results.
     *
     * @param request the period and any overrides of the configured strategy
     * @return the summary, equity curve and rebalance log
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Period: {} to {}, Weights: {}",
                request.getStartDate(), request.getEndDate(), request.getWeights());

        BacktestConfig config = backtestService.toConfig(request);
        BacktestResult result = backtestService.runBacktest(config);

        return ResponseEntity.ok(BacktestResponse.from(result));
    }
}
