package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.RedisConfig;
import com.momentumquant.rebalancer.domain.HistoricalMarketData;
import com.momentumquant.rebalancer.domain.PriceBar;
import com.momentumquant.rebalancer.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads stored price bars per symbol. Loads from PostgreSQL with Redis caching.
 * Symbols without stored data yield an empty list; no data is synthesised.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    /**
     * Load bars for the given symbol and date range, oldest first.
     * Uses Redis cache (TTL: 10 minutes) to avoid repeated database queries.
     */
    @Cacheable(value = RedisConfig.PRICE_HISTORY_CACHE, key = "#symbol + '_' + #startDate + '_' + #endDate")
    public List<PriceBar> loadPriceBars(String symbol, LocalDate startDate, LocalDate endDate) {
        log.debug("Loading price bars for {} from {} to {}", symbol, startDate, endDate);

        List<HistoricalMarketData> stored = historicalMarketDataRepository
                .findBySymbolAndDateRange(symbol, startDate, endDate);

        if (stored.isEmpty()) {
            log.warn("No price data stored for {} between {} and {}", symbol, startDate, endDate);
            return new ArrayList<>();
        }

        log.debug("Loaded {} price bars for {} from database", stored.size(), symbol);
        return stored.stream()
                .map(HistoricalMarketData::toPriceBar)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
