package com.momentumquant.rebalancer.broker;

import com.momentumquant.rebalancer.domain.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the paper broker.
 */
class LoggingBrokerGatewayTest {

    private LoggingBrokerGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new LoggingBrokerGateway(new BigDecimal("1000.00"));
    }

    @Test
    void testSubmit_BuyFillsAgainstCash() {
        // Act
        OrderResult result = gateway.submit(order("AAA", Trade.TradeType.BUY, 5, "100.00"));

        // Assert
        assertTrue(result.isFilled());
        BrokerAccount account = gateway.fetchAccount();
        assertEquals(0, new BigDecimal("500.00").compareTo(account.getCash()));
        assertEquals(1, account.getHoldings().size());
        assertEquals(5, account.getHoldings().get(0).getQuantity());
    }

    @Test
    void testSubmit_UnaffordableBuyFails() {
        // Act
        OrderResult result = gateway.submit(order("AAA", Trade.TradeType.BUY, 11, "100.00"));

        // Assert
        assertFalse(result.isFilled());
        assertEquals("insufficient cash", result.getMessage());
        assertTrue(gateway.fetchAccount().getHoldings().isEmpty());
    }

    @Test
    void testSubmit_SellMoreThanHeldFails() {
        // Arrange
        gateway.submit(order("AAA", Trade.TradeType.BUY, 2, "100.00"));

        // Act
        OrderResult result = gateway.submit(order("AAA", Trade.TradeType.SELL, 3, "100.00"));

        // Assert
        assertEquals(OrderResult.Status.FAILED, result.getStatus());
        assertEquals("insufficient shares", result.getMessage());
        assertEquals(2, gateway.fetchAccount().toPortfolio().quantityOf("AAA"));
    }

    private static OrderRequest order(String symbol, Trade.TradeType side, int quantity, String price) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .referencePrice(new BigDecimal(price))
                .build();
    }
}
