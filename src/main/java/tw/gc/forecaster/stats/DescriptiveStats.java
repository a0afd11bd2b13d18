package tw.gc.forecaster.stats;

import java.util.Objects;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Location and scale aggregates over a window.
 *
 * <p>Standard deviation and variance are population estimates (divisor n) and
 * quantiles interpolate linearly between order statistics, so the quartiles of
 * {@code 1..6} are 2.25 and 4.75.
 */
public final class DescriptiveStats {

    private DescriptiveStats() {
        throw new AssertionError("Utility class");
    }

    public static double mean(double[] values) {
        requireNonEmpty(values);
        return StatUtils.mean(values);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    public static double standardDeviation(double[] values) {
        requireNonEmpty(values);
        return new StandardDeviation(false).evaluate(values);
    }

    public static double variance(double[] values) {
        requireNonEmpty(values);
        return new Variance(false).evaluate(values);
    }

    /**
     * Quantile with linear interpolation between closest ranks.
     *
     * @param probability in [0, 1]
     */
    public static double quantile(double[] values, double probability) {
        requireNonEmpty(values);
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be in [0, 1], got: " + probability);
        }
        if (probability == 0.0) {
            return StatUtils.min(values);
        }
        return new Percentile()
            .withEstimationType(Percentile.EstimationType.R_7)
            .evaluate(values, probability * 100.0);
    }

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
    }
}
