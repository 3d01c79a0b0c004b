package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Factor values of one symbol as of a date. Returns and RSI values are
 * listed in lookback order; the factor scores are their averages.
 */
@Value
@Builder
public class SymbolSnapshot {

    String symbol;
    LocalDate asOfDate;
    BigDecimal close;
    List<Double> returns;
    List<Double> rsiValues;
    double returnScore;
    double rsiScore;
    double percentFromHigh;
    Double dailyReturn;
}
