package com.momentumquant.rebalancer.domain;

/**
 * Lifecycle of one simulator run.
 */
public enum SimulatorState {
    WARMING_UP,
    REBALANCING,
    HOLDING,
    FINALIZED
}
