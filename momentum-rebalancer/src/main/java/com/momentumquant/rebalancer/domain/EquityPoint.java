package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Marked-to-market portfolio value at one day's close.
 */
@Value
public class EquityPoint {

    LocalDate date;
    BigDecimal totalValue;
    BigDecimal cash;
    Map<String, Integer> holdings;

    public EquityPoint(LocalDate date, BigDecimal totalValue, BigDecimal cash, Map<String, Integer> holdings) {
        this.date = date;
        this.totalValue = totalValue;
        this.cash = cash;
        this.holdings = Map.copyOf(holdings);
    }
}
