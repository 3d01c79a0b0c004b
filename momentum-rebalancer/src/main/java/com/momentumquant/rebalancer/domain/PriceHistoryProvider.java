package com.momentumquant.rebalancer.domain;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Source of daily price bars. Returns only bars that exist; never fills gaps.
 */
public interface PriceHistoryProvider {

    PriceTable getPrices(Collection<String> symbols, LocalDate start, LocalDate end);
}
