package com.momentumquant.rebalancer.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Serves bars from a table held in memory.
 */
public class InMemoryPriceHistoryProvider implements PriceHistoryProvider {

    private final PriceTable table;

    public InMemoryPriceHistoryProvider(PriceTable table) {
        this.table = table;
    }

    @Override
    public PriceTable getPrices(Collection<String> symbols, LocalDate start, LocalDate end) {
        List<PriceBar> bars = new ArrayList<>();
        for (String symbol : symbols) {
            for (PriceBar bar : table.historyUpTo(symbol, end)) {
                if (!bar.getDate().isBefore(start)) {
                    bars.add(bar);
                }
            }
        }
        return PriceTable.of(bars);
    }
}
