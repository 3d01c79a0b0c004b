package com.momentumquant.rebalancer.broker;

import com.momentumquant.rebalancer.domain.Holding;
import com.momentumquant.rebalancer.domain.Portfolio;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cash and positions as reported by the broker.
 */
@Value
public class BrokerAccount {

    BigDecimal cash;
    List<Holding> holdings;

    public BrokerAccount(BigDecimal cash, List<Holding> holdings) {
        this.cash = cash;
        this.holdings = List.copyOf(holdings);
    }

    public Portfolio toPortfolio() {
        return Portfolio.of(cash, holdings);
    }
}
