package com.momentumquant.rebalancer.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A symbol's place in the composite ranking. Rank 1 is strongest.
 */
@Value
@Builder(toBuilder = true)
public class RankedSymbol {

    String symbol;
    int rank;
    double compositeScore;
    double returnSubRank;
    double rsiSubRank;
    double proximitySubRank;
    SymbolSnapshot snapshot;
}
