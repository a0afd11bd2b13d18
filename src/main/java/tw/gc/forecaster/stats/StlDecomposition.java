package tw.gc.forecaster.stats;

import java.util.Objects;

/**
 * Additive Seasonal-Trend decomposition by Loess (Cleveland et al., 1990).
 *
 * <p>Non-robust variant: two inner passes, no outer robustness iterations, local
 * linear fits for the seasonal, low-pass and trend smoothers, evaluated at
 * every position. Default spans follow the usual STL conventions:
 * <ul>
 *   <li>seasonal span 7</li>
 *   <li>low-pass span: smallest odd integer greater than the period</li>
 *   <li>trend span: smallest odd integer {@code >= 1.5 * period / (1 - 1.5 / seasonalSpan)}</li>
 * </ul>
 *
 * <p>Cycle-subseries holding a single observation are smoothed to that
 * observation, so a window exactly one period long still decomposes.
 */
public final class StlDecomposition {

    public static final int DEFAULT_SEASONAL_SPAN = 7;
    public static final int DEFAULT_INNER_ITERATIONS = 2;

    private static final int DEGREE = 1;

    private final int period;
    private final int seasonalSpan;
    private final int trendSpan;
    private final int lowPassSpan;
    private final int innerIterations;

    public StlDecomposition(int period) {
        this(period, DEFAULT_SEASONAL_SPAN);
    }

    public StlDecomposition(int period, int seasonalSpan) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        if (seasonalSpan < 3 || seasonalSpan % 2 == 0) {
            throw new IllegalArgumentException("seasonalSpan must be an odd integer >= 3, got: " + seasonalSpan);
        }
        this.period = period;
        this.seasonalSpan = seasonalSpan;
        this.trendSpan = nextOdd((int) Math.ceil(1.5 * period / (1.0 - 1.5 / seasonalSpan)));
        this.lowPassSpan = nextOdd(period + 1);
        this.innerIterations = DEFAULT_INNER_ITERATIONS;
    }

    /**
     * Trend, seasonal and remainder components; they sum back to the input.
     */
    public record Result(double[] trend, double[] seasonal, double[] residual) {
    }

    public int period() {
        return period;
    }

    public int trendSpan() {
        return trendSpan;
    }

    public int lowPassSpan() {
        return lowPassSpan;
    }

    /**
     * Decomposes {@code y}, which must hold at least one full period.
     */
    public Result decompose(double[] y) {
        Objects.requireNonNull(y, "y");
        int n = y.length;
        if (n < period) {
            throw new IllegalArgumentException("series of length %d is shorter than period %d".formatted(n, period));
        }

        double[] trend = new double[n];
        double[] seasonal = new double[n];
        double[] work = new double[n];

        for (int iteration = 0; iteration < innerIterations; iteration++) {
            for (int i = 0; i < n; i++) {
                work[i] = y[i] - trend[i];
            }
            double[] cycle = smoothCycleSubseries(work);
            double[] lowPass = smooth(lowPassFilter(cycle), lowPassSpan);
            for (int i = 0; i < n; i++) {
                seasonal[i] = cycle[period + i] - lowPass[i];
            }
            for (int i = 0; i < n; i++) {
                work[i] = y[i] - seasonal[i];
            }
            trend = smooth(work, trendSpan);
        }

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = y[i] - seasonal[i] - trend[i];
        }
        return new Result(trend, seasonal, residual);
    }

    /**
     * Smooths every cycle-subseries and extends each one by a position at both
     * ends, giving an array of length {@code n + 2 * period}.
     */
    private double[] smoothCycleSubseries(double[] y) {
        int n = y.length;
        double[] cycle = new double[n + 2 * period];
        for (int k = 0; k < period; k++) {
            int m = (n - k + period - 1) / period;
            double[] subseries = new double[m];
            for (int j = 0; j < m; j++) {
                subseries[j] = y[k + j * period];
            }
            double[] smoothed = smooth(subseries, seasonalSpan);

            double before = estimate(subseries, 0, 1, Math.min(seasonalSpan, m), seasonalSpan, smoothed[0]);
            double after = estimate(subseries, m + 1, Math.max(1, m - seasonalSpan + 1), m, seasonalSpan,
                smoothed[m - 1]);

            cycle[k] = before;
            for (int j = 0; j < m; j++) {
                cycle[k + (j + 1) * period] = smoothed[j];
            }
            cycle[k + (m + 1) * period] = after;
        }
        return cycle;
    }

    private double[] lowPassFilter(double[] cycle) {
        double[] first = movingAverage(cycle, period);
        double[] second = movingAverage(first, period);
        return movingAverage(second, 3);
    }

    private static double[] movingAverage(double[] x, int length) {
        int outLength = x.length - length + 1;
        double[] out = new double[outLength];
        double sum = 0.0;
        for (int i = 0; i < length; i++) {
            sum += x[i];
        }
        out[0] = sum / length;
        for (int i = 1; i < outLength; i++) {
            sum += x[i + length - 1] - x[i - 1];
            out[i] = sum / length;
        }
        return out;
    }

    /**
     * Loess smoothing evaluated at every position, neighbourhoods sliding with
     * the evaluation point.
     */
    private static double[] smooth(double[] y, int span) {
        int n = y.length;
        double[] out = new double[n];
        if (n < 2) {
            System.arraycopy(y, 0, out, 0, n);
            return out;
        }
        if (span >= n) {
            for (int i = 1; i <= n; i++) {
                out[i - 1] = estimate(y, i, 1, n, span, y[i - 1]);
            }
            return out;
        }
        int half = (span + 1) / 2;
        int left = 1;
        int right = span;
        for (int i = 1; i <= n; i++) {
            if (i > half && right != n) {
                left++;
                right++;
            }
            out[i - 1] = estimate(y, i, left, right, span, y[i - 1]);
        }
        return out;
    }

    /**
     * Tricube-weighted local linear estimate at position {@code xs} (1-based)
     * from the points {@code left..right}.
     */
    private static double estimate(double[] y, double xs, int left, int right, int span, double fallback) {
        int n = y.length;
        double range = n - 1.0;
        double h = Math.max(xs - left, right - xs);
        if (span > n) {
            h += (span - n) / 2;
        }
        double upper = 0.999 * h;
        double lower = 0.001 * h;

        double[] weights = new double[right - left + 1];
        double total = 0.0;
        for (int j = left; j <= right; j++) {
            double r = Math.abs(j - xs);
            double w = 0.0;
            if (r <= upper) {
                if (r <= lower) {
                    w = 1.0;
                } else {
                    double ratio = r / h;
                    double inner = 1.0 - ratio * ratio * ratio;
                    w = inner * inner * inner;
                }
            }
            weights[j - left] = w;
            total += w;
        }
        if (total <= 0.0) {
            return fallback;
        }
        for (int j = 0; j < weights.length; j++) {
            weights[j] /= total;
        }

        if (h > 0.0 && DEGREE > 0) {
            double center = 0.0;
            for (int j = left; j <= right; j++) {
                center += weights[j - left] * j;
            }
            double slope = xs - center;
            double spread = 0.0;
            for (int j = left; j <= right; j++) {
                double d = j - center;
                spread += weights[j - left] * d * d;
            }
            if (Math.sqrt(spread) > 0.001 * range) {
                slope /= spread;
                for (int j = left; j <= right; j++) {
                    weights[j - left] *= slope * (j - center) + 1.0;
                }
            }
        }

        double estimate = 0.0;
        for (int j = left; j <= right; j++) {
            estimate += weights[j - left] * y[j - 1];
        }
        return estimate;
    }

    private static int nextOdd(int value) {
        return value % 2 == 0 ? value + 1 : value;
    }
}
