package com.momentumquant.rebalancer.domain;

import java.time.LocalDate;
import java.util.Set;

/**
 * Symbols under exchange surveillance that must not be bought on a date.
 */
public interface RestrictionListProvider {

    Set<String> getRestrictedSymbols(LocalDate date);

    static RestrictionListProvider none() {
        return date -> Set.of();
    }
}
