package tw.gc.forecaster.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sample autocorrelation and partial autocorrelation.
 *
 * <p>Both use the biased autocovariance (divisor n), which keeps the
 * autocorrelation sequence positive semi-definite; partial autocorrelations
 * come from the Durbin-Levinson recursion and therefore stay within [-1, 1].
 * Vectors start at lag 1.
 */
public final class Autocorrelation {

    private Autocorrelation() {
        throw new AssertionError("Utility class");
    }

    /**
     * Autocorrelations at lags {@code 1..maxLag}; lags beyond the series are 0.
     * All NaN for a constant series.
     */
    public static double[] acf(double[] x, int maxLag) {
        double[] full = acfWithLagZero(x, maxLag);
        double[] result = new double[maxLag];
        System.arraycopy(full, 1, result, 0, maxLag);
        return result;
    }

    /**
     * Partial autocorrelations at lags {@code 1..maxLag}. All NaN for a
     * constant series.
     */
    public static double[] pacf(double[] x, int maxLag) {
        double[] rho = acfWithLagZero(x, maxLag);
        double[] result = new double[maxLag];
        if (Double.isNaN(rho[0])) {
            Arrays.fill(result, Double.NaN);
            return result;
        }

        double[] phi = new double[maxLag + 1];
        double[] previous = new double[maxLag + 1];
        double variance = 1.0;
        for (int k = 1; k <= maxLag; k++) {
            double numerator = rho[k];
            for (int j = 1; j < k; j++) {
                numerator -= previous[j] * rho[k - j];
            }
            double reflection = variance <= 0.0 ? 0.0 : numerator / variance;
            reflection = Math.max(-1.0, Math.min(1.0, reflection));
            phi[k] = reflection;
            for (int j = 1; j < k; j++) {
                phi[j] = previous[j] - reflection * previous[k - j];
            }
            variance *= 1.0 - reflection * reflection;
            result[k - 1] = reflection;
            System.arraycopy(phi, 0, previous, 0, maxLag + 1);
        }
        return result;
    }

    private static double[] acfWithLagZero(double[] x, int maxLag) {
        Objects.requireNonNull(x, "x");
        if (maxLag < 1) {
            throw new IllegalArgumentException("maxLag must be positive, got: " + maxLag);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("autocorrelation needs at least 2 values, got: " + x.length);
        }
        int n = x.length;
        double mean = 0.0;
        for (double v : x) {
            mean += v;
        }
        mean /= n;

        double[] rho = new double[maxLag + 1];
        double c0 = 0.0;
        for (double v : x) {
            c0 += (v - mean) * (v - mean);
        }
        if (c0 == 0.0) {
            Arrays.fill(rho, Double.NaN);
            return rho;
        }
        rho[0] = 1.0;
        for (int lag = 1; lag <= maxLag && lag < n; lag++) {
            double c = 0.0;
            for (int t = 0; t + lag < n; t++) {
                c += (x[t] - mean) * (x[t + lag] - mean);
            }
            rho[lag] = c / c0;
        }
        return rho;
    }
}
