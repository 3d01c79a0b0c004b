package com.momentumquant.rebalancer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Trade values.
 */
class TradeTest {

    @Test
    void testTradeBuilder() {
        // Act
        Trade trade = trade(Trade.TradeType.BUY);

        // Assert
        assertEquals(LocalDate.of(2024, 1, 3), trade.getDate());
        assertEquals("RELIANCE.NS", trade.getSymbol());
        assertEquals(Trade.TradeType.BUY, trade.getType());
        assertEquals(new BigDecimal("100.00"), trade.getPrice());
        assertEquals(50, trade.getQuantity());
        assertEquals(new BigDecimal("5.00"), trade.getCommission());
    }

    @Test
    void testGetGrossValue() {
        assertEquals(new BigDecimal("5000.00"), trade(Trade.TradeType.SELL).getGrossValue());
    }

    @Test
    void testGetCashImpact_BuyPaysCommission() {
        // (100 * 50) + 5 leaves the account
        assertEquals(new BigDecimal("-5005.00"), trade(Trade.TradeType.BUY).getCashImpact());
    }

    @Test
    void testGetCashImpact_SellNetOfCommission() {
        // (100 * 50) - 5 arrives
        assertEquals(new BigDecimal("4995.00"), trade(Trade.TradeType.SELL).getCashImpact());
    }

    private static Trade trade(Trade.TradeType type) {
        return Trade.builder()
                .date(LocalDate.of(2024, 1, 3))
                .symbol("RELIANCE.NS")
                .type(type)
                .price(new BigDecimal("100.00"))
                .quantity(50)
                .commission(new BigDecimal("5.00"))
                .build();
    }
}
