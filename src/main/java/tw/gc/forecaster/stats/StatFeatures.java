package tw.gc.forecaster.stats;

import java.util.Objects;

/**
 * Scalar descriptors of a numeric window, used as forecasting features.
 *
 * <p>Every function is pure. Degenerate inputs (zero mean, constant window,
 * failed decomposition) produce {@code Double.NaN} rather than an exception so
 * that a rolling computation can drop the affected row.
 */
public final class StatFeatures {

    private StatFeatures() {
        throw new AssertionError("Utility class");
    }

    /**
     * Trend and seasonal strength from a single decomposition.
     */
    public record Strengths(double trend, double seasonal) {
    }

    /**
     * Decomposes the window once and derives both strengths.
     * NaN for both when the window is shorter than the period or the
     * decomposition is not finite.
     */
    public static Strengths strengths(double[] window, int period) {
        Objects.requireNonNull(window, "window");
        validatePeriod(period);
        if (window.length < period) {
            return new Strengths(Double.NaN, Double.NaN);
        }
        StlDecomposition.Result decomposition = new StlDecomposition(period).decompose(window);
        return new Strengths(
            strength(decomposition.residual(), decomposition.trend()),
            strength(decomposition.residual(), decomposition.seasonal()));
    }

    /**
     * {@code max(0, 1 - var(R) / var(R + S))}: close to 1 for a dominant
     * seasonal pattern, 0 for none.
     */
    public static double seasonalStrength(double[] window, int period) {
        return strengths(window, period).seasonal();
    }

    /**
     * {@code max(0, 1 - var(R) / var(R + T))}: close to 1 for a dominant trend,
     * 0 for a constant window.
     */
    public static double trendStrength(double[] window, int period) {
        return strengths(window, period).trend();
    }

    /**
     * Share of values strictly above the median, in [0, 1].
     */
    public static double spikiness(double[] window) {
        requireNonEmpty(window);
        double median = DescriptiveStats.median(window);
        int above = 0;
        for (double v : window) {
            if (v > median) {
                above++;
            }
        }
        return (double) above / window.length;
    }

    /**
     * Variance over squared mean; NaN when the mean is 0.
     */
    public static double lumpiness(double[] window) {
        requireNonEmpty(window);
        double mean = DescriptiveStats.mean(window);
        if (mean == 0.0) {
            return Double.NaN;
        }
        return DescriptiveStats.variance(window) / (mean * mean);
    }

    /**
     * Mean of the second difference; NaN below 3 values.
     */
    public static double curvature(double[] window) {
        requireNonEmpty(window);
        if (window.length < 3) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = 2; i < window.length; i++) {
            sum += window[i] - 2.0 * window[i - 1] + window[i - 2];
        }
        return sum / (window.length - 2);
    }

    /**
     * Shannon entropy (bits) of the normalised Welch spectral density. Low for
     * a clean signal, high for noise; NaN for a constant window.
     */
    public static double spectralEntropy(double[] window) {
        requireNonEmpty(window);
        if (window.length < 2) {
            return Double.NaN;
        }
        double[] density = SpectralDensity.welch(window);
        double total = 0.0;
        for (double d : density) {
            total += d;
        }
        if (!(total > 0.0) || !Double.isFinite(total)) {
            return Double.NaN;
        }
        double entropy = 0.0;
        for (double d : density) {
            double p = d / total;
            if (p > 0.0) {
                entropy -= p * Math.log(p) / Math.log(2.0);
            }
        }
        return entropy;
    }

    /**
     * Simplified rescaled-range Hurst exponent.
     *
     * @throws IllegalArgumentException below {@value HurstExponent#MIN_OBSERVATIONS} values
     */
    public static double hurstExponent(double[] window) {
        requireNonEmpty(window);
        return HurstExponent.estimate(window);
    }

    /**
     * p-value of the augmented Dickey-Fuller test; NaN for degenerate windows.
     */
    public static double adfPValue(double[] window) {
        requireNonEmpty(window);
        return AugmentedDickeyFuller.pValue(window);
    }

    /**
     * Autocorrelations at lags {@code 1..period + 5}.
     */
    public static double[] autocorrelation(double[] window, int period) {
        requireNonEmpty(window);
        validatePeriod(period);
        return Autocorrelation.acf(window, period + 5);
    }

    /**
     * Partial autocorrelations at lags {@code 1..period + 5}.
     */
    public static double[] partialAutocorrelation(double[] window, int period) {
        requireNonEmpty(window);
        validatePeriod(period);
        return Autocorrelation.pacf(window, period + 5);
    }

    private static double strength(double[] residual, double[] component) {
        double[] combined = new double[residual.length];
        for (int i = 0; i < residual.length; i++) {
            combined[i] = residual[i] + component[i];
        }
        double residualVariance = DescriptiveStats.variance(residual);
        double combinedVariance = DescriptiveStats.variance(combined);
        if (!Double.isFinite(residualVariance) || !Double.isFinite(combinedVariance)) {
            return Double.NaN;
        }
        if (combinedVariance == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - residualVariance / combinedVariance);
    }

    private static void validatePeriod(int period) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
    }

    private static void requireNonEmpty(double[] window) {
        Objects.requireNonNull(window, "window");
        if (window.length == 0) {
            throw new IllegalArgumentException("window cannot be empty");
        }
    }
}
