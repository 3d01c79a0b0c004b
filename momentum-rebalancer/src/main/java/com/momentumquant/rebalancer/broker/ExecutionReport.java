package com.momentumquant.rebalancer.broker;

import com.momentumquant.rebalancer.domain.RebalanceDecision;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Live rebalance outcome: the planned decision and what the broker did with
 * each order. A dry run carries the plan only.
 */
@Value
@Builder
public class ExecutionReport {

    LocalDate date;
    boolean dryRun;
    RebalanceDecision decision;
    @Singular
    List<OrderResult> results;

    public long filledCount() {
        return results.stream().filter(OrderResult::isFilled).count();
    }

    public long failedCount() {
        return results.stream().filter(r -> !r.isFilled()).count();
    }
}
