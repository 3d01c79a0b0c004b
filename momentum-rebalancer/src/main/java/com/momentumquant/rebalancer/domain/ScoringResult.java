package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ranked symbols for a date together with the symbols left out and why.
 */
@Value
public class ScoringResult {

    LocalDate asOfDate;
    WeightCandidate weights;
    List<RankedSymbol> ranked;
    SortedMap<String, ExclusionReason> excluded;

    public ScoringResult(LocalDate asOfDate, WeightCandidate weights, List<RankedSymbol> ranked,
                         Map<String, ExclusionReason> excluded) {
        this.asOfDate = asOfDate;
        this.weights = weights;
        this.ranked = List.copyOf(ranked);
        this.excluded = Collections.unmodifiableSortedMap(new TreeMap<>(excluded));
    }

    public boolean isEmpty() {
        return ranked.isEmpty();
    }

    public int size() {
        return ranked.size();
    }

    public List<RankedSymbol> topN(int n) {
        return ranked.subList(0, Math.min(n, ranked.size()));
    }

    public Optional<RankedSymbol> find(String symbol) {
        return ranked.stream().filter(r -> r.getSymbol().equals(symbol)).findFirst();
    }

    /**
     * Same ranking with further exclusions, e.g. those of the universe filter.
     */
    public ScoringResult withExclusions(Map<String, ExclusionReason> more) {
        Map<String, ExclusionReason> merged = new TreeMap<>(more);
        merged.putAll(excluded);
        return new ScoringResult(asOfDate, weights, ranked, merged);
    }

    public Map<String, RankedSymbol> bySymbol() {
        Map<String, RankedSymbol> map = new LinkedHashMap<>();
        ranked.forEach(r -> map.put(r.getSymbol(), r));
        return map;
    }
}
