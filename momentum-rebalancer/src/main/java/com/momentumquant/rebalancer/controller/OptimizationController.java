package com.momentumquant.rebalancer.controller;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.controller.dto.OptimizationRequest;
import com.momentumquant.rebalancer.controller.dto.OptimizationResponse;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.OptimizationResult;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import com.momentumquant.rebalancer.service.BacktestService;
import com.momentumquant.rebalancer.service.WeightOptimizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for weight optimization: grid, directed search or an explicit comparison.
 */
@RestController
@RequestMapping("/optimizations")
@RequiredArgsConstructor
@Slf4j
public class OptimizationController {

    private final WeightOptimizer optimizer;
    private final BacktestService backtestService;
    private final MomentumProperties properties;

    @PostMapping
    public ResponseEntity<OptimizationResponse> optimize(@Valid @RequestBody OptimizationRequest request) {

        log.info("POST /optimizations - Method: {}, Period: {} to {}", request.getMethod(),
                request.getBacktest().getStartDate(), request.getBacktest().getEndDate());

        BacktestConfig base = backtestService.toConfig(request.getBacktest());
        MomentumProperties.Optimizer defaults = properties.getOptimizer();
        double maxDrawdown = request.getMaxDrawdown() != null ? request.getMaxDrawdown() : defaults.getMaxDrawdown();

        OptimizationResult result = switch (request.getMethod()) {
            case GRID -> optimizer.gridSearch(base,
                    request.getGridStep() != null ? request.getGridStep() : defaults.getGridStep(), maxDrawdown);
            case DIRECTED -> optimizer.directedSearch(base, maxDrawdown,
                    request.getMaxEvaluations() != null ? request.getMaxEvaluations() : defaults.getMaxEvaluations());
            case COMPARE -> optimizer.compare(base, parseCandidates(request.getCandidates()), maxDrawdown);
        };

        return ResponseEntity.ok(OptimizationResponse.from(result));
    }

    private static List<WeightCandidate> parseCandidates(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("COMPARE requires at least one candidate");
        }
        return candidates.stream().map(WeightCandidate::parse).toList();
    }
}
