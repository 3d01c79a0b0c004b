package com.momentumquant.rebalancer.broker;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.Portfolio;
import com.momentumquant.rebalancer.domain.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;

/**
 * Paper broker that logs every order and fills it at the reference price
 * against an in-memory account. A real broker adapter registered as a
 * {@code @Primary} bean takes its place.
 */
@Component
@Slf4j
public class LoggingBrokerGateway implements BrokerGateway {

    private final Portfolio account;

    @Autowired
    public LoggingBrokerGateway(MomentumProperties properties) {
        this(properties.getInitialCapital());
    }

    LoggingBrokerGateway(BigDecimal startingCash) {
        this.account = new Portfolio(startingCash);
    }

    @Override
    public synchronized BrokerAccount fetchAccount() {
        return new BrokerAccount(account.getCash(), new ArrayList<>(account.getHoldings()));
    }

    @Override
    public synchronized OrderResult submit(OrderRequest request) {
        log.info("Paper order: {} {} x {} @ {}", request.getSide(), request.getQuantity(), request.getSymbol(),
                request.getReferencePrice());
        boolean filled = request.getSide() == Trade.TradeType.BUY
                ? account.buy(LocalDate.now(), request.getSymbol(), request.getReferencePrice(),
                        request.getQuantity(), BigDecimal.ZERO)
                : account.sell(LocalDate.now(), request.getSymbol(), request.getReferencePrice(),
                        request.getQuantity(), BigDecimal.ZERO);
        if (!filled) {
            String reason = request.getSide() == Trade.TradeType.BUY ? "insufficient cash" : "insufficient shares";
            log.warn("Paper order rejected: {} {} x {} ({})", request.getSide(), request.getQuantity(),
                    request.getSymbol(), reason);
            return OrderResult.failed(request, reason);
        }
        return OrderResult.filled(request);
    }
}
