package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What happened on one scheduled rebalance date.
 */
@Value
@Builder
public class RebalanceEvent {

    public enum Outcome {
        EXECUTED,
        MOVED_TO_CASH,
        SKIPPED
    }

    LocalDate date;
    Outcome outcome;
    RebalanceDecision decision;
    @Singular
    List<Trade> trades;
    String message;

    public static RebalanceEvent skipped(LocalDate date, String message) {
        return RebalanceEvent.builder()
                .date(date)
                .outcome(Outcome.SKIPPED)
                .message(message)
                .build();
    }
}
