package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of evaluating one weight candidate. Metrics are null when the run failed.
 */
@Value
@Builder
public class CandidateOutcome {

    public enum Status {
        COMPLETED,
        FAILED
    }

    int index;
    WeightCandidate weights;
    Status status;
    BigDecimal cagr;
    BigDecimal maxDrawdown;
    BigDecimal totalReturn;
    BigDecimal sharpeRatio;
    BigDecimal finalValue;
    boolean feasible;
    String error;

    public static CandidateOutcome completed(int index, WeightCandidate weights, PerformanceSummary summary,
                                             double maxDrawdownThreshold) {
        return CandidateOutcome.builder()
                .index(index)
                .weights(weights)
                .status(Status.COMPLETED)
                .cagr(summary.getCagr())
                .maxDrawdown(summary.getMaxDrawdown())
                .totalReturn(summary.getTotalReturn())
                .sharpeRatio(summary.getSharpeRatio())
                .finalValue(summary.getFinalValue())
                .feasible(summary.getMaxDrawdown().doubleValue() >= maxDrawdownThreshold)
                .build();
    }

    public static CandidateOutcome failed(int index, WeightCandidate weights, String error) {
        return CandidateOutcome.builder()
                .index(index)
                .weights(weights)
                .status(Status.FAILED)
                .feasible(false)
                .error(error)
                .build();
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
