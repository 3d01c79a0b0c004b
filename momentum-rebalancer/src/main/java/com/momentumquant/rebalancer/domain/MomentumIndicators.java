package com.momentumquant.rebalancer.domain;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Price-series indicators over close arrays ordered oldest first.
 * Each indicator returns empty when the series is too short.
 */
public final class MomentumIndicators {

    private MomentumIndicators() {
    }

    /**
     * Percentage change from the close N bars back (inclusive) to the latest close.
     */
    public static OptionalDouble totalReturn(double[] closes, int lookback) {
        if (lookback < 1 || closes.length < lookback) {
            return OptionalDouble.empty();
        }
        double recent = closes[closes.length - 1];
        double past = closes[closes.length - lookback];
        if (past == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((recent - past) / past * 100.0);
    }

    /**
     * Relative strength index from simple averages of the last N gains and losses.
     * Returns 100 when there are no losses in the window.
     */
    public static OptionalDouble rsi(double[] closes, int period) {
        if (period < 1 || closes.length < period + 1) {
            return OptionalDouble.empty();
        }
        double gains = 0;
        double losses = 0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double delta = closes[i] - closes[i - 1];
            if (delta > 0) {
                gains += delta;
            } else {
                losses -= delta;
            }
        }
        double averageGain = gains / period;
        double averageLoss = losses / period;
        if (averageLoss == 0) {
            return OptionalDouble.of(100.0);
        }
        double relativeStrength = averageGain / averageLoss;
        return OptionalDouble.of(100.0 - 100.0 / (1.0 + relativeStrength));
    }

    /**
     * Distance of the latest close below the highest close of the window, in percent.
     * Zero means the latest close is the high.
     */
    public static OptionalDouble percentFromHigh(double[] closes, int lookback) {
        if (lookback < 1 || closes.length < lookback) {
            return OptionalDouble.empty();
        }
        double high = Double.NEGATIVE_INFINITY;
        for (int i = closes.length - lookback; i < closes.length; i++) {
            high = Math.max(high, closes[i]);
        }
        if (high <= 0) {
            return OptionalDouble.empty();
        }
        double current = closes[closes.length - 1];
        return OptionalDouble.of((high - current) / high * 100.0);
    }

    public static OptionalDouble simpleMovingAverage(double[] closes, int window) {
        if (window < 1 || closes.length < window) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (int i = closes.length - window; i < closes.length; i++) {
            sum += closes[i];
        }
        return OptionalDouble.of(sum / window);
    }

    /**
     * Fractional change over the last bar, e.g. 0.05 for +5%.
     */
    public static OptionalDouble dailyReturn(double[] closes) {
        if (closes.length < 2 || closes[closes.length - 2] == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(closes[closes.length - 1] / closes[closes.length - 2] - 1.0);
    }

    /**
     * Median of close x volume over the last N bars.
     */
    public static OptionalDouble medianTradedValue(double[] closes, double[] volumes, int window) {
        if (window < 1 || closes.length < window || volumes.length < window) {
            return OptionalDouble.empty();
        }
        double[] traded = new double[window];
        int offsetCloses = closes.length - window;
        int offsetVolumes = volumes.length - window;
        for (int i = 0; i < window; i++) {
            traded[i] = closes[offsetCloses + i] * volumes[offsetVolumes + i];
        }
        Arrays.sort(traded);
        int mid = window / 2;
        double median = window % 2 == 1 ? traded[mid] : (traded[mid - 1] + traded[mid]) / 2.0;
        return OptionalDouble.of(median);
    }

    public static OptionalDouble averageVolume(double[] volumes, int window) {
        return simpleMovingAverage(volumes, window);
    }
}
