package com.momentumquant.rebalancer.broker;

import lombok.Value;

/**
 * Broker response to one order.
 */
@Value
public class OrderResult {

    public enum Status {
        FILLED,
        FAILED
    }

    OrderRequest request;
    Status status;
    String message;

    public static OrderResult filled(OrderRequest request) {
        return new OrderResult(request, Status.FILLED, null);
    }

    public static OrderResult failed(OrderRequest request, String message) {
        return new OrderResult(request, Status.FAILED, message);
    }

    public boolean isFilled() {
        return status == Status.FILLED;
    }
}
