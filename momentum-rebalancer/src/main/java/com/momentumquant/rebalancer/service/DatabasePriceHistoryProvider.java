package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.domain.PriceBar;
import com.momentumquant.rebalancer.domain.PriceHistoryProvider;
import com.momentumquant.rebalancer.domain.PriceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Price history backed by the stored bars, one cached load per symbol.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatabasePriceHistoryProvider implements PriceHistoryProvider {

    private final MarketDataService marketDataService;

    @Override
    public PriceTable getPrices(Collection<String> symbols, LocalDate start, LocalDate end) {
        List<PriceBar> bars = new ArrayList<>();
        int missing = 0;
        for (String symbol : new LinkedHashSet<>(symbols)) {
            List<PriceBar> series = marketDataService.loadPriceBars(symbol, start, end);
            if (series.isEmpty()) {
                missing++;
            }
            bars.addAll(series);
        }
        log.info("Loaded {} bars for {} symbols from {} to {} ({} without data)",
                bars.size(), symbols.size(), start, end, missing);
        return PriceTable.of(bars);
    }
}
