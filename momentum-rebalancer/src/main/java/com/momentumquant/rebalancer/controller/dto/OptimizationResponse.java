package com.momentumquant.rebalancer.controller.dto;

import com.momentumquant.rebalancer.domain.CandidateOutcome;
import com.momentumquant.rebalancer.domain.OptimizationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a weight optimization. {@code best} is null when no
 * candidate met the drawdown constraint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationResponse {

    private OptimizationResult.Method method;
    private double maxDrawdownThreshold;
    private int evaluated;
    private boolean cancelled;
    private CandidateView best;
    private List<CandidateView> ranked;
    private List<CandidateView> infeasible;
    private List<CandidateView> failed;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CandidateView {
        private String weights;
        private CandidateOutcome.Status status;
        private BigDecimal cagr;
        private BigDecimal maxDrawdown;
        private BigDecimal totalReturn;
        private BigDecimal sharpeRatio;
        private boolean feasible;
        private String error;
    }

    public static OptimizationResponse from(OptimizationResult result) {
        return OptimizationResponse.builder()
                .method(result.getMethod())
                .maxDrawdownThreshold(result.getMaxDrawdownThreshold())
                .evaluated(result.getEvaluated().size())
                .cancelled(result.isCancelled())
                .best(result.getBest().map(OptimizationResponse::view).orElse(null))
                .ranked(result.getRanked().stream().map(OptimizationResponse::view).toList())
                .infeasible(result.getInfeasible().stream().map(OptimizationResponse::view).toList())
                .failed(result.getFailed().stream().map(OptimizationResponse::view).toList())
                .build();
    }

    private static CandidateView view(CandidateOutcome outcome) {
        return CandidateView.builder()
                .weights(outcome.getWeights().format())
                .status(outcome.getStatus())
                .cagr(outcome.getCagr())
                .maxDrawdown(outcome.getMaxDrawdown())
                .totalReturn(outcome.getTotalReturn())
                .sharpeRatio(outcome.getSharpeRatio())
                .feasible(outcome.isFeasible())
                .error(outcome.getError())
                .build();
    }
}
