package com.reporting.domain.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Descriptive statistics over plain doubles. Empty inputs yield empty results
 * rather than NaN.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double sum(List<Double> values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    public static OptionalDouble average(List<Double> values) {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sum(values) / values.size());
    }

    public static OptionalDouble min(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min();
    }

    public static OptionalDouble max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max();
    }

    public static OptionalDouble median(List<Double> values) {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        List<Double> sorted = sorted(values);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return OptionalDouble.of(sorted.get(middle));
        }
        return OptionalDouble.of((sorted.get(middle - 1) + sorted.get(middle)) / 2.0);
    }

    /**
     * Nearest-rank percentile, {@code percentile} in (0, 100].
     */
    public static OptionalDouble percentile(List<Double> values, double percentile) {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        List<Double> sorted = sorted(values);
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.size());
        rank = Math.max(1, Math.min(sorted.size(), rank));
        return OptionalDouble.of(sorted.get(rank - 1));
    }

    /** Population variance. */
    public static OptionalDouble variance(List<Double> values) {
        OptionalDouble mean = average(values);
        if (mean.isEmpty()) {
            return OptionalDouble.empty();
        }
        double m = mean.getAsDouble();
        double squares = 0;
        for (double value : values) {
            squares += (value - m) * (value - m);
        }
        return OptionalDouble.of(squares / values.size());
    }

    public static OptionalDouble standardDeviation(List<Double> values) {
        OptionalDouble variance = variance(values);
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : variance;
    }

    private static List<Double> sorted(List<Double> values) {
        List<Double> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }
}
