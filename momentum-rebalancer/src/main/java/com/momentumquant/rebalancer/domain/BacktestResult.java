package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one simulator run. Immutable.
 */
@Value
@Builder
public class BacktestResult {

    WeightCandidate weights;
    @Singular("equityPoint")
    List<EquityPoint> equityCurve;
    @Singular
    List<RebalanceEvent> rebalances;
    @Singular
    List<Trade> trades;
    @Singular
    List<String> warnings;
    SimulatorState finalState;
    BigDecimal finalCash;
    Map<String, Integer> finalHoldings;
    PerformanceSummary summary;

    public long executedRebalanceCount() {
        return rebalances.stream().filter(e -> e.getOutcome() != RebalanceEvent.Outcome.SKIPPED).count();
    }

    public long skippedRebalanceCount() {
        return rebalances.stream().filter(e -> e.getOutcome() == RebalanceEvent.Outcome.SKIPPED).count();
    }

    public BigDecimal getCagr() {
        return summary.getCagr();
    }

    public BigDecimal getMaxDrawdown() {
        return summary.getMaxDrawdown();
    }
}
