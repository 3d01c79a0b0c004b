package com.momentumquant.rebalancer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable (date, symbol) table of daily price bars.
 * Trading days are the dates on which at least one symbol has a bar.
 */
public final class PriceTable {

    private static final PriceTable EMPTY = new PriceTable(new TreeMap<>());

    private final Map<String, NavigableMap<LocalDate, PriceBar>> bySymbol;
    private final NavigableSet<LocalDate> tradingDates;

    private PriceTable(Map<String, NavigableMap<LocalDate, PriceBar>> bySymbol) {
        this.bySymbol = bySymbol;
        NavigableSet<LocalDate> dates = new TreeSet<>();
        bySymbol.values().forEach(series -> dates.addAll(series.keySet()));
        this.tradingDates = Collections.unmodifiableNavigableSet(dates);
    }

    public static PriceTable empty() {
        return EMPTY;
    }

    /**
     * Build a table from bars in any order. Bars without a close are ignored;
     * a later bar for the same (symbol, date) replaces an earlier one.
     */
    public static PriceTable of(Collection<PriceBar> bars) {
        Map<String, NavigableMap<LocalDate, PriceBar>> bySymbol = new TreeMap<>();
        for (PriceBar bar : bars) {
            if (bar == null || bar.getClose() == null || bar.getDate() == null || bar.getSymbol() == null) {
                continue;
            }
            bySymbol.computeIfAbsent(bar.getSymbol(), s -> new TreeMap<>()).put(bar.getDate(), bar);
        }
        if (bySymbol.isEmpty()) {
            return EMPTY;
        }
        bySymbol.replaceAll((symbol, series) -> Collections.unmodifiableNavigableMap(series));
        return new PriceTable(Collections.unmodifiableMap(bySymbol));
    }

    public boolean isEmpty() {
        return bySymbol.isEmpty();
    }

    public Set<String> symbols() {
        return bySymbol.keySet();
    }

    public NavigableSet<LocalDate> tradingDates() {
        return tradingDates;
    }

    public NavigableSet<LocalDate> tradingDatesBetween(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            return Collections.emptyNavigableSet();
        }
        return tradingDates.subSet(start, true, end, true);
    }

    /**
     * Whether any of the given symbols has a bar on the date.
     */
    public boolean hasDataOn(LocalDate date, Collection<String> symbols) {
        for (String symbol : symbols) {
            if (bar(symbol, date).isPresent()) {
                return true;
            }
        }
        return false;
    }

    public Optional<PriceBar> bar(String symbol, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = bySymbol.get(symbol);
        return series == null ? Optional.empty() : Optional.ofNullable(series.get(date));
    }

    /**
     * Last known close at or before the date.
     */
    public Optional<BigDecimal> lastCloseOnOrBefore(String symbol, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = bySymbol.get(symbol);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, PriceBar> entry = series.floorEntry(date);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue().getClose());
    }

    /**
     * Bars of a symbol up to and including the date, oldest first.
     */
    public List<PriceBar> historyUpTo(String symbol, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = bySymbol.get(symbol);
        if (series == null) {
            return List.of();
        }
        return new ArrayList<>(series.headMap(date, true).values());
    }

    public int barCountUpTo(String symbol, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = bySymbol.get(symbol);
        return series == null ? 0 : series.headMap(date, true).size();
    }
}
