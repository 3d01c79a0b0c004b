package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Planner output for one date: a decision to execute, or the reason there is none.
 */
@Value
@Builder
public class RebalancePlan {

    RebalanceEvent.Outcome outcome;
    RebalanceDecision decision;
    ScoringResult ranking;
    String message;

    public boolean isSkipped() {
        return outcome == RebalanceEvent.Outcome.SKIPPED;
    }

    static RebalancePlan skipped(String message, ScoringResult ranking) {
        return RebalancePlan.builder()
                .outcome(RebalanceEvent.Outcome.SKIPPED)
                .ranking(ranking)
                .message(message)
                .build();
    }
}
