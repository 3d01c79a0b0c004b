package com.momentumquant.rebalancer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetrics calculations.
 */
class PerformanceMetricsTest {

    private static final BigDecimal ZERO = new BigDecimal("0.0000");
    private static final LocalDate START = LocalDate.of(2023, 1, 2);
    private static final LocalDate ONE_YEAR_LATER = LocalDate.of(2024, 1, 2);

    @Test
    void testCalculateTotalReturn_WithProfit() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = new BigDecimal("12000");

        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(initialCapital, finalValue);

        assertEquals(new BigDecimal("20.0000"), totalReturn);
    }

    @Test
    void testCalculateTotalReturn_WithLoss() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = new BigDecimal("8000");

        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(initialCapital, finalValue);

        assertEquals(new BigDecimal("-20.0000"), totalReturn);
    }

    @Test
    void testCalculateTotalReturn_NoChange() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = new BigDecimal("10000");

        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(initialCapital, finalValue);

        assertEquals(new BigDecimal("0.0000"), totalReturn);
    }

    @Test
    void testCalculateTotalReturn_ZeroInitialCapital() {
        BigDecimal initialCapital = BigDecimal.ZERO;
        BigDecimal finalValue = new BigDecimal("1000");

        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(initialCapital, finalValue);

        assertEquals(BigDecimal.ZERO, totalReturn);
    }

    @Test
    void testCalculateSharpeRatio_WithPositiveReturns() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10100"),
                new BigDecimal("10200"),
                new BigDecimal("10300"),
                new BigDecimal("10400"),
                new BigDecimal("10500"));

        BigDecimal sharpeRatio = PerformanceMetrics.calculateSharpeRatio(portfolioValues, 0.0);

        assertNotNull(sharpeRatio);
        assertTrue(sharpeRatio.compareTo(BigDecimal.ZERO) > 0, "Sharpe ratio should be positive for consistent gains");
    }

    @Test
    void testCalculateSharpeRatio_WithVolatileReturns() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10500"),
                new BigDecimal("9800"),
                new BigDecimal("10300"),
                new BigDecimal("9900"),
                new BigDecimal("10600"));

        BigDecimal sharpeRatio = PerformanceMetrics.calculateSharpeRatio(portfolioValues, 0.0);

        BigDecimal steady = PerformanceMetrics.calculateSharpeRatio(Arrays.asList(
                new BigDecimal("10000"), new BigDecimal("10100"), new BigDecimal("10200"),
                new BigDecimal("10300"), new BigDecimal("10400"), new BigDecimal("10500")), 0.0);
        assertTrue(sharpeRatio.compareTo(steady) < 0, "Volatile gains should score below steady gains");
    }

    @Test
    void testCalculateSharpeRatio_InsufficientData() {
        List<BigDecimal> portfolioValues = List.of(new BigDecimal("10000"));

        BigDecimal sharpeRatio = PerformanceMetrics.calculateSharpeRatio(portfolioValues, 0.0);

        assertEquals(ZERO, sharpeRatio);
    }

    @Test
    void testCalculateSharpeRatio_EmptyList() {
        List<BigDecimal> portfolioValues = new ArrayList<>();

        BigDecimal sharpeRatio = PerformanceMetrics.calculateSharpeRatio(portfolioValues, 0.0);

        assertEquals(ZERO, sharpeRatio);
    }

    @Test
    void testCalculateMaxDrawdown_WithDrawdown() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("12000"),
                new BigDecimal("11000"),
                new BigDecimal("9000"),
                new BigDecimal("10000"));

        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(portfolioValues);

        // Max drawdown from 12000 to 9000 = -25%
        assertTrue(maxDrawdown.compareTo(new BigDecimal("-20")) < 0, "Should have significant drawdown");
        assertTrue(maxDrawdown.compareTo(new BigDecimal("-30")) > 0, "Drawdown should be approximately -25%");
    }

    @Test
    void testCalculateMaxDrawdown_NoDrawdown() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10500"),
                new BigDecimal("11000"),
                new BigDecimal("11500"));

        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(portfolioValues);

        assertEquals(ZERO, maxDrawdown);
    }

    @Test
    void testCalculateMaxDrawdown_EmptyList() {
        List<BigDecimal> portfolioValues = new ArrayList<>();

        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(portfolioValues);

        assertEquals(ZERO, maxDrawdown);
    }

    @Test
    void testCalculateCAGR_PositiveGrowth() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = new BigDecimal("15000");

        BigDecimal cagr = PerformanceMetrics.calculateCAGR(initialCapital, finalValue, START, ONE_YEAR_LATER);

        assertNotNull(cagr);
        assertTrue(cagr.compareTo(new BigDecimal("40")) > 0, "CAGR should be around 50%");
        assertTrue(cagr.compareTo(new BigDecimal("60")) < 0, "CAGR should be around 50%");
    }

    @Test
    void testCalculateCAGR_NegativeGrowth() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = new BigDecimal("8000");

        BigDecimal cagr = PerformanceMetrics.calculateCAGR(initialCapital, finalValue, START, ONE_YEAR_LATER);

        assertTrue(cagr.compareTo(BigDecimal.ZERO) < 0, "CAGR should be negative");
    }

    @Test
    void testCalculateCAGR_ZeroInitialCapital() {
        BigDecimal initialCapital = BigDecimal.ZERO;
        BigDecimal finalValue = new BigDecimal("10000");

        BigDecimal cagr = PerformanceMetrics.calculateCAGR(initialCapital, finalValue, START, ONE_YEAR_LATER);

        assertEquals(ZERO, cagr);
    }

    @Test
    void testCalculateCAGR_TotalLoss() {
        BigDecimal initialCapital = new BigDecimal("10000");
        BigDecimal finalValue = BigDecimal.ZERO;

        BigDecimal cagr = PerformanceMetrics.calculateCAGR(initialCapital, finalValue, START, ONE_YEAR_LATER);

        assertEquals(new BigDecimal("-100.0000"), cagr);
    }

    @Test
    void testCalculateVolatility_ConsistentReturns() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10100"),
                new BigDecimal("10200"),
                new BigDecimal("10300"));

        BigDecimal volatility = PerformanceMetrics.calculateVolatility(portfolioValues);

        assertNotNull(volatility);
        assertTrue(volatility.compareTo(BigDecimal.ZERO) > 0, "Volatility should be positive");
        // Low volatility for consistent returns
    }

    @Test
    void testCalculateVolatility_HighVolatility() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("12000"),
                new BigDecimal("8000"),
                new BigDecimal("11000"),
                new BigDecimal("9000"));

        BigDecimal volatility = PerformanceMetrics.calculateVolatility(portfolioValues);

        assertNotNull(volatility);
        assertTrue(volatility.compareTo(new BigDecimal("10")) > 0, "Should have high volatility");
    }

    @Test
    void testCalculateVolatility_InsufficientData() {
        List<BigDecimal> portfolioValues = List.of(new BigDecimal("10000"));

        BigDecimal volatility = PerformanceMetrics.calculateVolatility(portfolioValues);

        assertEquals(ZERO, volatility);
    }

    @Test
    void testCalculateSortinoRatio_OnlyPositiveReturns() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10100"),
                new BigDecimal("10200"),
                new BigDecimal("10300"));

        BigDecimal sortinoRatio = PerformanceMetrics.calculateSortinoRatio(portfolioValues, 0.0);

        // No downside deviation to divide by
        assertEquals(ZERO, sortinoRatio);
    }

    @Test
    void testCalculateSortinoRatio_WithDownside() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("10000"),
                new BigDecimal("10500"),
                new BigDecimal("9800"),
                new BigDecimal("10300"),
                new BigDecimal("9900"));

        BigDecimal sortinoRatio = PerformanceMetrics.calculateSortinoRatio(portfolioValues, 0.0);

        assertNotNull(sortinoRatio);
        assertTrue(sortinoRatio.signum() < 0, "Net loss over the period");
    }

    @Test
    void testCalculateSortinoRatio_InsufficientData() {
        List<BigDecimal> portfolioValues = List.of(new BigDecimal("10000"));

        BigDecimal sortinoRatio = PerformanceMetrics.calculateSortinoRatio(portfolioValues, 0.0);

        assertEquals(ZERO, sortinoRatio);
    }

    @Test
    void testCalculateCAGR_SameDayIsZero() {
        BigDecimal cagr = PerformanceMetrics.calculateCAGR(new BigDecimal("10000"), new BigDecimal("11000"),
                START, START);

        assertEquals(ZERO, cagr);
    }

    @Test
    void testCalculateMaxDrawdown_ExactValue() {
        List<BigDecimal> portfolioValues = Arrays.asList(
                new BigDecimal("100"),
                new BigDecimal("120"),
                new BigDecimal("90"),
                new BigDecimal("130"));

        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(portfolioValues);

        assertEquals(new BigDecimal("-25.0000"), maxDrawdown);
    }

    @Test
    void testSummarize_WithBenchmarkAlpha() {
        // Arrange
        List<EquityPoint> curve = List.of(
                new EquityPoint(START, new BigDecimal("10000"), new BigDecimal("10000"), Map.of()),
                new EquityPoint(START.plusDays(180), new BigDecimal("9000"), BigDecimal.ZERO, Map.of("AAA", 90)),
                new EquityPoint(ONE_YEAR_LATER, new BigDecimal("12000"), BigDecimal.ZERO, Map.of("AAA", 100)));

        // Act
        PerformanceSummary summary = PerformanceMetrics.summarize(curve, 4, 0.0, new BigDecimal("5.0000"));

        // Assert
        assertEquals(new BigDecimal("20.0000"), summary.getTotalReturn());
        assertEquals(new BigDecimal("-10.0000"), summary.getMaxDrawdown());
        assertEquals(4, summary.getTotalTrades());
        assertEquals(0, summary.getAlpha().compareTo(summary.getCagr().subtract(new BigDecimal("5"))));
        assertTrue(summary.getCagr().compareTo(new BigDecimal("19")) > 0);
    }

    @Test
    void testSummarize_WithoutBenchmark() {
        List<EquityPoint> curve = List.of(
                new EquityPoint(START, new BigDecimal("10000"), new BigDecimal("10000"), Map.of()));

        PerformanceSummary summary = PerformanceMetrics.summarize(curve, 0, 0.0, null);

        assertNull(summary.getAlpha());
        assertEquals(ZERO, summary.getVolatility());
    }

    @Test
    void testSummarize_EmptyCurveRejected() {
        assertThrows(IllegalArgumentException.class, () -> PerformanceMetrics.summarize(List.of(), 0, 0.0, null));
    }
}
