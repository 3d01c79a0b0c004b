package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.RedisConfig;
import com.momentumquant.rebalancer.domain.HistoricalMarketData;
import com.momentumquant.rebalancer.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Service for ingesting CSV price data into the database.
 * Supports Yahoo Finance exports ({@code Date,Open,High,Low,Close,Adj Close,Volume})
 * and the plain {@code Date,Open,High,Low,Close,Volume} layout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceDataIngestionService {

    private static final int BATCH_SIZE = 1000;

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH)
    };

    private static final Map<String, Integer> DEFAULT_COLUMNS = Map.of(
            "date", 0, "open", 1, "high", 2, "low", 3, "close", 4, "volume", 5);

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    @Transactional
    @CacheEvict(value = RedisConfig.PRICE_HISTORY_CACHE, allEntries = true)
    public IngestionResult ingestCsv(String symbol, String csvContent) {
        return ingestCsv(symbol, new StringReader(csvContent));
    }

    /**
     * Ingest CSV rows for one symbol. Rows already stored for the same date
     * are left untouched; malformed rows are skipped with a warning.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.PRICE_HISTORY_CACHE, allEntries = true)
    public IngestionResult ingestCsv(String symbol, Reader source) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        log.info("Starting CSV ingestion for symbol: {}", symbol);

        List<HistoricalMarketData> batch = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        Map<String, Integer> columns = DEFAULT_COLUMNS;
        int inserted = 0;
        int duplicates = 0;
        int rejected = 0;
        boolean firstLine = true;

        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }

                // Header row decides the column layout
                if (firstLine) {
                    firstLine = false;
                    if (line.toLowerCase(Locale.ROOT).contains("date")) {
                        columns = parseHeader(line);
                        continue;
                    }
                }

                HistoricalMarketData row = parseLine(symbol, line, columns);
                if (row == null) {
                    rejected++;
                    continue;
                }
                if (!seen.add(row.getDate())
                        || historicalMarketDataRepository.existsBySymbolAndDate(symbol, row.getDate())) {
                    duplicates++;
                    continue;
                }
                batch.add(row);

                if (batch.size() >= BATCH_SIZE) {
                    historicalMarketDataRepository.saveAll(batch);
                    inserted += batch.size();
                    log.info("Batch inserted {} records for {}", batch.size(), symbol);
                    batch.clear();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV for " + symbol, e);
        }

        if (!batch.isEmpty()) {
            historicalMarketDataRepository.saveAll(batch);
            inserted += batch.size();
            log.info("Inserted final batch of {} records for {}", batch.size(), symbol);
        }

        long totalStored = historicalMarketDataRepository.countBySymbol(symbol);
        log.info("CSV ingestion completed for {}. Inserted: {}, Duplicates: {}, Rejected: {}, Stored: {}",
                symbol, inserted, duplicates, rejected, totalStored);

        return IngestionResult.builder()
                .symbol(symbol)
                .inserted(inserted)
                .duplicates(duplicates)
                .rejected(rejected)
                .totalStored(totalStored)
                .build();
    }

    /**
     * Delete all data for a symbol (useful for reloading).
     */
    @Transactional
    @CacheEvict(value = RedisConfig.PRICE_HISTORY_CACHE, allEntries = true)
    public void deleteSymbolData(String symbol) {
        log.info("Deleting all price data for symbol: {}", symbol);
        historicalMarketDataRepository.deleteBySymbol(symbol);
    }

    static Map<String, Integer> parseHeader(String header) {
        String[] names = header.split(",");
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim().toLowerCase(Locale.ROOT);
            if (DEFAULT_COLUMNS.containsKey(name)) {
                columns.put(name, i);
            }
        }
        if (!columns.containsKey("date") || !columns.containsKey("close")) {
            throw new IllegalArgumentException("CSV header must contain Date and Close columns: " + header);
        }
        return columns;
    }

    private HistoricalMarketData parseLine(String symbol, String line, Map<String, Integer> columns) {
        String[] parts = line.split(",");
        try {
            LocalDate date = parseDate(column(parts, columns, "date"));
            BigDecimal close = decimal(column(parts, columns, "close"));
            if (date == null || close == null || close.signum() <= 0) {
                log.warn("Skipping CSV line without a usable date and close: {}", line);
                return null;
            }
            String volume = column(parts, columns, "volume");
            return HistoricalMarketData.builder()
                    .symbol(symbol)
                    .date(date)
                    .open(decimal(column(parts, columns, "open")))
                    .high(decimal(column(parts, columns, "high")))
                    .low(decimal(column(parts, columns, "low")))
                    .close(close)
                    .volume(volume == null ? null : new BigDecimal(volume).longValue())
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Failed to parse CSV line: {} - Error: {}", line, e.getMessage());
            return null;
        }
    }

    private static String column(String[] parts, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= parts.length) {
            return null;
        }
        String value = parts[index].trim();
        return value.isEmpty() || value.equalsIgnoreCase("null") ? null : value;
    }

    private static BigDecimal decimal(String value) {
        return value == null ? null : new BigDecimal(value);
    }

    /**
     * Parse date with multiple format support.
     */
    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date {} does not match {}", value, formatter);
            }
        }
        throw new DateTimeParseException("Unable to parse date", value, 0);
    }
}
