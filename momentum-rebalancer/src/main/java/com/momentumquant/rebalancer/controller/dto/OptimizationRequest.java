package com.momentumquant.rebalancer.controller.dto;

import com.momentumquant.rebalancer.domain.OptimizationResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a weight optimization. {@code candidates} is used by COMPARE only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationRequest {

    @NotNull(message = "Method is required")
    private OptimizationResult.Method method;

    @NotNull(message = "Backtest parameters are required")
    @Valid
    private BacktestRequest backtest;

    @Positive(message = "Grid step must be positive")
    @DecimalMax(value = "1.0", message = "Grid step must not exceed 1.0")
    private Double gridStep;

    @DecimalMax(value = "0.0", message = "Maximum drawdown is a negative percentage")
    private Double maxDrawdown;

    @Positive(message = "Maximum evaluations must be positive")
    private Integer maxEvaluations;

    private List<String> candidates;
}
