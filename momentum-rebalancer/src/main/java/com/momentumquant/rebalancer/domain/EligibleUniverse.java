package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Symbols that may be scored on a date, in universe order.
 */
@Value
public class EligibleUniverse {

    LocalDate date;
    List<String> symbols;
    SortedMap<String, ExclusionReason> excluded;

    public EligibleUniverse(LocalDate date, List<String> symbols, Map<String, ExclusionReason> excluded) {
        this.date = date;
        this.symbols = List.copyOf(symbols);
        this.excluded = Collections.unmodifiableSortedMap(new TreeMap<>(excluded));
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public boolean contains(String symbol) {
        return symbols.contains(symbol);
    }
}
