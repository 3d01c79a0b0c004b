package com.momentumquant.rebalancer.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Factor weights applied to the return, RSI and 52-week-high proximity
 * sub-ranks. Components are non-negative and sum to 1.0.
 */
@Value
public class WeightCandidate {

    public static final double SUM_TOLERANCE = 1e-9;

    double returnWeight;
    double rsiWeight;
    double proximityWeight;

    public WeightCandidate(double returnWeight, double rsiWeight, double proximityWeight) {
        if (Double.isNaN(returnWeight) || Double.isNaN(rsiWeight) || Double.isNaN(proximityWeight)) {
            throw new IllegalArgumentException("Weights must be numbers");
        }
        if (returnWeight < 0 || rsiWeight < 0 || proximityWeight < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Weights must be non-negative: %s,%s,%s", returnWeight, rsiWeight, proximityWeight));
        }
        double sum = returnWeight + rsiWeight + proximityWeight;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Weights must sum to 1.0 but sum to %s", sum));
        }
        this.returnWeight = returnWeight;
        this.rsiWeight = rsiWeight;
        this.proximityWeight = proximityWeight;
    }

    public static WeightCandidate of(double returnWeight, double rsiWeight, double proximityWeight) {
        return new WeightCandidate(returnWeight, rsiWeight, proximityWeight);
    }

    /**
     * Parse a comma separated triple such as {@code "0.8,0.1,0.1"}.
     */
    public static WeightCandidate parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Weights string is empty");
        }
        String[] parts = text.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected three comma separated weights but got: " + text);
        }
        double[] values = new double[3];
        for (int i = 0; i < 3; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid weight '" + parts[i].trim() + "' in: " + text, e);
            }
        }
        return new WeightCandidate(values[0], values[1], values[2]);
    }

    /**
     * Every triple on the simplex whose components are multiples of the step,
     * ordered by return weight, then RSI weight. The step must divide 1.0.
     */
    public static List<WeightCandidate> gridOf(double step) {
        int steps = stepsFor(step);
        BigDecimal increment = BigDecimal.ONE.divide(BigDecimal.valueOf(steps), 12, RoundingMode.HALF_UP);
        List<WeightCandidate> grid = new ArrayList<>();
        for (int r = 0; r <= steps; r++) {
            for (int s = 0; s <= steps - r; s++) {
                int p = steps - r - s;
                double returnWeight = increment.multiply(BigDecimal.valueOf(r)).doubleValue();
                double rsiWeight = increment.multiply(BigDecimal.valueOf(s)).doubleValue();
                double proximityWeight = p == 0 ? 0.0 : Math.max(0.0, 1.0 - returnWeight - rsiWeight);
                grid.add(new WeightCandidate(returnWeight, rsiWeight, proximityWeight));
            }
        }
        return grid;
    }

    static int stepsFor(double step) {
        if (!(step > 0) || step > 1.0) {
            throw new IllegalArgumentException("Grid step must be in (0, 1]: " + step);
        }
        long steps = Math.round(1.0 / step);
        if (steps < 1 || Math.abs(steps * step - 1.0) > 1e-9) {
            throw new IllegalArgumentException("Grid step must divide 1.0 evenly: " + step);
        }
        return (int) steps;
    }

    /**
     * Same triple within the sum tolerance.
     */
    public boolean isCloseTo(WeightCandidate other) {
        return Math.abs(returnWeight - other.returnWeight) <= SUM_TOLERANCE
                && Math.abs(rsiWeight - other.rsiWeight) <= SUM_TOLERANCE
                && Math.abs(proximityWeight - other.proximityWeight) <= SUM_TOLERANCE;
    }

    public String format() {
        return String.format(Locale.ROOT, "%.4f,%.4f,%.4f", returnWeight, rsiWeight, proximityWeight);
    }
}
