package com.momentumquant.rebalancer.broker;

import com.momentumquant.rebalancer.domain.Trade;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Market order in whole shares. The reference price is the close the
 * decision was sized on.
 */
@Value
@Builder
public class OrderRequest {
    String symbol;
    Trade.TradeType side;
    int quantity;
    BigDecimal referencePrice;
}
