package com.momentumquant.rebalancer.service;

import lombok.Builder;
import lombok.Value;

/**
 * Counts from one CSV ingestion.
 */
@Value
@Builder
public class IngestionResult {
    String symbol;
    int inserted;
    int duplicates;
    int rejected;
    long totalStored;
}
