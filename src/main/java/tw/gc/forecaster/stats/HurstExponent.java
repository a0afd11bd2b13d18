package tw.gc.forecaster.stats;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Simplified rescaled-range (R/S) estimate of the Hurst exponent, treating the
 * input as a random walk.
 *
 * <p>For each window size the series is cut into consecutive non-overlapping
 * chunks; a chunk's statistic is its range divided by the sample standard
 * deviation of its increments. The exponent is the slope of
 * {@code log10(mean R/S)} against {@code log10(window size)}.
 * <ul>
 *   <li>H &lt; 0.5: mean-reverting</li>
 *   <li>H ~ 0.5: random walk</li>
 *   <li>H &gt; 0.5: persistent</li>
 * </ul>
 */
public final class HurstExponent {

    public static final int MIN_OBSERVATIONS = 100;
    public static final int MIN_WINDOW = 10;

    private static final double LOG_STEP = 0.25;

    private HurstExponent() {
        throw new AssertionError("Utility class");
    }

    /**
     * @return the exponent, or NaN when some window size has no chunk with a
     *     defined R/S ratio (e.g. a constant series)
     * @throws IllegalArgumentException below {@value #MIN_OBSERVATIONS} observations
     */
    public static double estimate(double[] series) {
        Objects.requireNonNull(series, "series");
        if (series.length < MIN_OBSERVATIONS) {
            throw new IllegalArgumentException("Hurst exponent needs at least %d observations, got: %d"
                .formatted(MIN_OBSERVATIONS, series.length));
        }

        List<Integer> windowSizes = windowSizes(series.length);
        SimpleRegression regression = new SimpleRegression(true);
        for (int size : windowSizes) {
            double sum = 0.0;
            int count = 0;
            for (int start = 0; start + size <= series.length; start += size) {
                double rs = rescaledRange(series, start, size);
                if (rs != 0.0) {
                    sum += rs;
                    count++;
                }
            }
            if (count == 0) {
                return Double.NaN;
            }
            regression.addData(Math.log10(size), Math.log10(sum / count));
        }
        return regression.getSlope();
    }

    static List<Integer> windowSizes(int length) {
        List<Integer> sizes = new ArrayList<>();
        double upper = Math.log10(length - 1);
        double lower = Math.log10(MIN_WINDOW);
        int steps = (int) Math.ceil((upper - lower) / LOG_STEP);
        for (int i = 0; i < steps; i++) {
            sizes.add((int) Math.pow(10.0, lower + i * LOG_STEP));
        }
        sizes.add(length);
        return sizes;
    }

    /**
     * Range of the chunk over the population standard deviation of its
     * increments; 0 when either is 0.
     */
    static double rescaledRange(double[] series, int start, int size) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int i = start; i < start + size; i++) {
            max = Math.max(max, series[i]);
            min = Math.min(min, series[i]);
        }
        double range = max - min;
        if (size < 3) {
            return 0.0;
        }
        int increments = size - 1;
        double mean = (series[start + size - 1] - series[start]) / increments;
        double squares = 0.0;
        for (int i = start + 1; i < start + size; i++) {
            double d = series[i] - series[i - 1] - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / increments);
        if (range == 0.0 || std == 0.0) {
            return 0.0;
        }
        return range / std;
    }
}
