package com.momentumquant.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.momentumquant.rebalancer.domain.BacktestResult;
import com.momentumquant.rebalancer.domain.PerformanceSummary;
import com.momentumquant.rebalancer.domain.RebalanceEvent;
import com.momentumquant.rebalancer.domain.SimulatorState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a completed backtest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private String weights;
    private SimulatorState finalState;
    private PerformanceSummary summary;
    private BigDecimal finalCash;
    private Map<String, Integer> finalHoldings;
    private long executedRebalances;
    private long skippedRebalances;
    private List<EquityValue> equityCurve;
    private List<RebalanceView> rebalances;
    private List<String> warnings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EquityValue {
        @JsonFormat(pattern = "yyyy-MM-dd")
        private LocalDate date;
        private BigDecimal value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class RebalanceView {
        @JsonFormat(pattern = "yyyy-MM-dd")
        private LocalDate date;
        private RebalanceEvent.Outcome outcome;
        private List<String> sold;
        private List<String> bought;
        private int fills;
        private String message;
    }

    public static BacktestResponse from(BacktestResult result) {
        return BacktestResponse.builder()
                .weights(result.getWeights().format())
                .finalState(result.getFinalState())
                .summary(result.getSummary())
                .finalCash(result.getFinalCash())
                .finalHoldings(result.getFinalHoldings())
                .executedRebalances(result.executedRebalanceCount())
                .skippedRebalances(result.skippedRebalanceCount())
                .equityCurve(result.getEquityCurve().stream()
                        .map(p -> new EquityValue(p.getDate(), p.getTotalValue()))
                        .toList())
                .rebalances(result.getRebalances().stream().map(BacktestResponse::view).toList())
                .warnings(result.getWarnings())
                .build();
    }

    private static RebalanceView view(RebalanceEvent event) {
        RebalanceView.RebalanceViewBuilder view = RebalanceView.builder()
                .date(event.getDate())
                .outcome(event.getOutcome())
                .fills(event.getTrades().size())
                .message(event.getMessage());
        if (event.getDecision() != null) {
            view.sold(List.copyOf(event.getDecision().sellSymbols()))
                    .bought(List.copyOf(event.getDecision().buySymbols()));
        } else {
            view.sold(List.of()).bought(List.of());
        }
        return view.build();
    }
}
