package com.momentumquant.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.momentumquant.rebalancer.broker.ExecutionReport;
import com.momentumquant.rebalancer.broker.OrderResult;
import com.momentumquant.rebalancer.domain.RebalanceDecision;
import com.momentumquant.rebalancer.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Response DTO for a live rebalance: the planned orders and, unless it was a
 * dry run, the broker's result for each.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RebalanceResponse {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
    private boolean dryRun;
    private boolean weakMarket;
    private List<RebalanceDecision.SellOrder> sells;
    private List<RebalanceDecision.BuyOrder> buys;
    private List<RebalanceDecision.HeldPosition> holds;
    private List<String> warnings;
    private List<OrderStatusView> orders;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OrderStatusView {
        private String symbol;
        private Trade.TradeType side;
        private int quantity;
        private OrderResult.Status status;
        private String message;
    }

    public static RebalanceResponse from(ExecutionReport report) {
        RebalanceDecision decision = report.getDecision();
        return RebalanceResponse.builder()
                .date(report.getDate())
                .dryRun(report.isDryRun())
                .weakMarket(decision.isWeakMarket())
                .sells(decision.getSells())
                .buys(decision.getBuys())
                .holds(decision.getHolds())
                .warnings(decision.getWarnings())
                .orders(report.getResults().stream()
                        .map(r -> OrderStatusView.builder()
                                .symbol(r.getRequest().getSymbol())
                                .side(r.getRequest().getSide())
                                .quantity(r.getRequest().getQuantity())
                                .status(r.getStatus())
                                .message(r.getMessage())
                                .build())
                        .toList())
                .build();
    }
}
