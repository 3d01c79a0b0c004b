package com.momentumquant.rebalancer.broker;

/**
 * Port to a brokerage account used by live rebalancing.
 */
public interface BrokerGateway {

    BrokerAccount fetchAccount();

    /**
     * Submit one order. Implementations report failures in the result rather
     * than throwing.
     */
    OrderResult submit(OrderRequest request);
}
