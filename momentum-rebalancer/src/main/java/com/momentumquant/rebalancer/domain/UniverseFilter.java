package com.momentumquant.rebalancer.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes symbols that may not be held on a date: those on the exchange
 * restriction list and those without enough trailing history to be scored.
 * Pure function of its inputs.
 */
public class UniverseFilter {

    private final int requiredHistory;

    public UniverseFilter(int requiredHistory) {
        if (requiredHistory < 1) {
            throw new IllegalArgumentException("Required history must be positive: " + requiredHistory);
        }
        this.requiredHistory = requiredHistory;
    }

    public EligibleUniverse filter(Collection<String> universe, LocalDate date, Set<String> restricted,
                                   PriceTable prices) {
        List<String> eligible = new ArrayList<>();
        Map<String, ExclusionReason> excluded = new LinkedHashMap<>();

        for (String symbol : new LinkedHashSet<>(universe)) {
            if (restricted.contains(symbol)) {
                excluded.put(symbol, ExclusionReason.RESTRICTED);
            } else if (prices.barCountUpTo(symbol, date) < requiredHistory) {
                excluded.put(symbol, ExclusionReason.INSUFFICIENT_HISTORY);
            } else {
                eligible.add(symbol);
            }
        }
        return new EligibleUniverse(date, eligible, excluded);
    }
}
