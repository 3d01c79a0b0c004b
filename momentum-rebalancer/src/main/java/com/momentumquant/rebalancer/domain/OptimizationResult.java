package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All evaluated candidates of an optimizer run plus the feasible ones in
 * rank order: CAGR descending, then shallower drawdown, then evaluation order.
 */
@Value
public class OptimizationResult {

    public enum Method {
        GRID,
        DIRECTED,
        COMPARE
    }

    static final Comparator<CandidateOutcome> RANKING = Comparator
            .comparing(CandidateOutcome::getCagr, Comparator.reverseOrder())
            .thenComparing(CandidateOutcome::getMaxDrawdown, Comparator.reverseOrder())
            .thenComparingInt(CandidateOutcome::getIndex);

    Method method;
    double maxDrawdownThreshold;
    List<CandidateOutcome> evaluated;
    List<CandidateOutcome> ranked;
    boolean cancelled;

    public OptimizationResult(Method method, double maxDrawdownThreshold, List<CandidateOutcome> evaluated,
                              boolean cancelled) {
        this.method = method;
        this.maxDrawdownThreshold = maxDrawdownThreshold;
        this.evaluated = List.copyOf(evaluated);
        this.ranked = evaluated.stream()
                .filter(CandidateOutcome::isFeasible)
                .sorted(RANKING)
                .toList();
        this.cancelled = cancelled;
    }

    /**
     * Best feasible candidate; empty when none met the drawdown constraint.
     */
    public Optional<CandidateOutcome> getBest() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public List<CandidateOutcome> getInfeasible() {
        return evaluated.stream().filter(o -> o.isCompleted() && !o.isFeasible()).toList();
    }

    public List<CandidateOutcome> getFailed() {
        return evaluated.stream().filter(o -> !o.isCompleted()).toList();
    }
}
