package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Headline statistics of an equity curve. Percentages are expressed as
 * percent (12.5 = 12.5%); drawdown is zero or negative.
 */
@Value
@Builder
public class PerformanceSummary {

    BigDecimal initialValue;
    BigDecimal finalValue;
    BigDecimal totalReturn;
    BigDecimal cagr;
    BigDecimal maxDrawdown;
    BigDecimal volatility;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    int totalTrades;
    BigDecimal benchmarkCagr;
    BigDecimal alpha;
}
