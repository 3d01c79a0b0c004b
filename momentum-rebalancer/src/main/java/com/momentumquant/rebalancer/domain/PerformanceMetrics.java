package com.momentumquant.rebalancer.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

/**
 * Calculator for equity-curve performance metrics.
 */
@Slf4j
public final class PerformanceMetrics {

    static final int TRADING_DAYS_PER_YEAR = 252;
    static final double DAYS_PER_YEAR = 365.25;

    private PerformanceMetrics() {
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialValue, BigDecimal finalValue) {
        if (initialValue.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialValue)
                .divide(initialValue, 6, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Compound annual growth rate in percent, using calendar days / 365.25 as years.
     */
    public static BigDecimal calculateCAGR(BigDecimal initialValue, BigDecimal finalValue,
                                           LocalDate startDate, LocalDate endDate) {
        long days = ChronoUnit.DAYS.between(startDate, endDate);
        if (days <= 0 || initialValue.signum() <= 0 || finalValue.signum() < 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        double years = days / DAYS_PER_YEAR;
        double growth = finalValue.doubleValue() / initialValue.doubleValue();
        double cagr = (Math.pow(growth, 1.0 / years) - 1.0) * 100.0;
        return toDecimal(cagr);
    }

    /**
     * Annualised standard deviation of daily returns, in percent.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> values) {
        double[] returns = dailyReturns(values);
        if (returns.length < 2) {
            return BigDecimal.ZERO.setScale(4);
        }
        return toDecimal(sampleStdDev(returns) * Math.sqrt(TRADING_DAYS_PER_YEAR) * 100.0);
    }

    /**
     * Annualised Sharpe ratio of daily returns over the given annual risk-free rate.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> values, double riskFreeRate) {
        double[] returns = dailyReturns(values);
        if (returns.length < 2) {
            return BigDecimal.ZERO.setScale(4);
        }
        double dailyRiskFree = riskFreeRate / TRADING_DAYS_PER_YEAR;
        double stdDev = sampleStdDev(returns);
        if (stdDev == 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        return toDecimal((mean(returns) - dailyRiskFree) / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Annualised Sortino ratio; only returns below the risk-free rate count as risk.
     */
    public static BigDecimal calculateSortinoRatio(List<BigDecimal> values, double riskFreeRate) {
        double[] returns = dailyReturns(values);
        if (returns.length < 2) {
            return BigDecimal.ZERO.setScale(4);
        }
        double dailyRiskFree = riskFreeRate / TRADING_DAYS_PER_YEAR;
        double downsideSquares = 0;
        for (double r : returns) {
            double shortfall = Math.min(0.0, r - dailyRiskFree);
            downsideSquares += shortfall * shortfall;
        }
        double downsideDeviation = Math.sqrt(downsideSquares / returns.length);
        if (downsideDeviation == 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        return toDecimal((mean(returns) - dailyRiskFree) / downsideDeviation * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Calculate maximum peak-to-trough drawdown percentage.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO.setScale(4);
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = values.get(0);

        for (BigDecimal value : values) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .divide(peak, 6, RoundingMode.HALF_UP)
                        .multiply(BigDecimal.valueOf(100));

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.setScale(4, RoundingMode.HALF_UP).negate(); // Return as negative percentage
    }

    /**
     * Build the full summary for an equity curve.
     */
    public static PerformanceSummary summarize(List<EquityPoint> curve, int totalTrades, double riskFreeRate,
                                               BigDecimal benchmarkCagr) {
        if (curve.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarise an empty equity curve");
        }
        List<BigDecimal> values = curve.stream().map(EquityPoint::getTotalValue).toList();
        EquityPoint first = curve.get(0);
        EquityPoint last = curve.get(curve.size() - 1);

        BigDecimal cagr = calculateCAGR(first.getTotalValue(), last.getTotalValue(), first.getDate(), last.getDate());

        return PerformanceSummary.builder()
                .initialValue(first.getTotalValue())
                .finalValue(last.getTotalValue())
                .totalReturn(calculateTotalReturn(first.getTotalValue(), last.getTotalValue()))
                .cagr(cagr)
                .maxDrawdown(calculateMaxDrawdown(values))
                .volatility(calculateVolatility(values))
                .sharpeRatio(calculateSharpeRatio(values, riskFreeRate))
                .sortinoRatio(calculateSortinoRatio(values, riskFreeRate))
                .totalTrades(totalTrades)
                .benchmarkCagr(benchmarkCagr)
                .alpha(benchmarkCagr == null ? null : cagr.subtract(benchmarkCagr))
                .build();
    }

    static double[] dailyReturns(List<BigDecimal> values) {
        if (values.size() < 2) {
            return new double[0];
        }
        double[] returns = new double[values.size() - 1];
        int count = 0;
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1).doubleValue();
            if (previous > 0) {
                returns[count++] = values.get(i).doubleValue() / previous - 1.0;
            }
        }
        return count == returns.length ? returns : Arrays.copyOf(returns, count);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double sampleStdDev(double[] values) {
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    private static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.warn("Non-finite metric value {}, reporting zero", value);
            return BigDecimal.ZERO.setScale(4);
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
