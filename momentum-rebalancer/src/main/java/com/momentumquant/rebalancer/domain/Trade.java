package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A ledger fill at the day's close. Commission is charged on top of the
 * gross value for buys and deducted from it for sells.
 */
@Value
@Builder
public class Trade {

    LocalDate date;
    String symbol;
    TradeType type;
    BigDecimal price;
    int quantity;
    BigDecimal commission;

    public enum TradeType {
        BUY, SELL
    }

    public BigDecimal getGrossValue() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Signed effect on cash: negative for buys, positive for sells.
     */
    public BigDecimal getCashImpact() {
        BigDecimal gross = getGrossValue();
        return type == TradeType.BUY
                ? gross.add(commission).negate()
                : gross.subtract(commission);
    }
}
