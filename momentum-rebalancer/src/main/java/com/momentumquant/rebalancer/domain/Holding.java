package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Whole-share position in one symbol with its average cost.
 */
@Value
public class Holding {

    String symbol;
    int quantity;
    BigDecimal averageCost;

    public Holding(String symbol, int quantity, BigDecimal averageCost) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Holding symbol is required");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Holding quantity must not be negative: " + quantity);
        }
        this.symbol = symbol;
        this.quantity = quantity;
        this.averageCost = averageCost == null ? BigDecimal.ZERO : averageCost;
    }

    Holding add(int shares, BigDecimal price) {
        int total = quantity + shares;
        BigDecimal cost = averageCost.multiply(BigDecimal.valueOf(quantity))
                .add(price.multiply(BigDecimal.valueOf(shares)));
        return new Holding(symbol, total, cost.divide(BigDecimal.valueOf(total), 6, RoundingMode.HALF_UP));
    }

    Holding remove(int shares) {
        return new Holding(symbol, quantity - shares, averageCost);
    }

    public BigDecimal valueAt(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
