package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Orders that take the current portfolio to the target one on a date.
 * Sells are executed before buys. An empty decision means no trades.
 */
@Value
@Builder
public class RebalanceDecision {

    LocalDate date;
    boolean weakMarket;
    @Singular
    List<SellOrder> sells;
    @Singular
    List<BuyOrder> buys;
    @Singular
    List<HeldPosition> holds;
    @Singular
    List<String> warnings;

    public boolean isEmpty() {
        return sells.isEmpty() && buys.isEmpty();
    }

    public Set<String> sellSymbols() {
        Set<String> symbols = new TreeSet<>();
        sells.forEach(s -> symbols.add(s.getSymbol()));
        return symbols;
    }

    public Set<String> buySymbols() {
        Set<String> symbols = new TreeSet<>();
        buys.forEach(b -> symbols.add(b.getSymbol()));
        return symbols;
    }

    public enum SellReason {
        OUT_OF_BAND,
        NOT_RANKED,
        WEAK_MARKET,
        CASH_REDEPLOYED
    }

    public enum BuyKind {
        NEW_ENTRY,
        TOP_UP,
        CASH_EQUIVALENT
    }

    @Value
    @Builder
    public static class SellOrder {
        String symbol;
        int quantity;
        BigDecimal price;
        Integer rank;
        SellReason reason;
    }

    @Value
    @Builder
    public static class BuyOrder {
        String symbol;
        int quantity;
        BigDecimal price;
        Integer rank;
        double targetWeight;
        BuyKind kind;
    }

    @Value
    @Builder
    public static class HeldPosition {
        String symbol;
        int quantity;
        Integer rank;
    }
}
