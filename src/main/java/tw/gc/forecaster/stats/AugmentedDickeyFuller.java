package tw.gc.forecaster.stats;

import java.util.Objects;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Augmented Dickey-Fuller unit-root test with a constant term.
 *
 * <p>Regresses {@code dy_t} on a constant, {@code y_(t-1)} and {@code p} lagged
 * differences; {@code p} is picked by minimum AIC between 0 and
 * {@code ceil(12 * (n / 100)^(1/4))}, all candidates fitted on the same
 * sample. The statistic is the t-value of the {@code y_(t-1)} coefficient and
 * the p-value comes from MacKinnon's (1994) response-surface approximation.
 */
public final class AugmentedDickeyFuller {

    // MacKinnon (1994) coefficients, constant-only regression, one variable
    private static final double TAU_MAX = 2.74;
    private static final double TAU_MIN = -18.83;
    private static final double TAU_STAR = -1.61;
    private static final double[] TAU_SMALL_P = {2.1659, 1.4412, 0.038269};
    private static final double[] TAU_LARGE_P = {1.7339, 0.93202, -0.12745, -0.010368};

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private AugmentedDickeyFuller() {
        throw new AssertionError("Utility class");
    }

    /**
     * Test outcome.
     *
     * @param statistic t-value of the lagged level coefficient
     * @param pValue MacKinnon approximate p-value
     * @param usedLag number of lagged differences retained
     * @param observations regression sample size
     */
    public record Result(double statistic, double pValue, int usedLag, int observations) {
    }

    public static int defaultMaxLag(int length) {
        int maxLag = (int) Math.ceil(12.0 * Math.pow(length / 100.0, 0.25));
        return Math.min(length / 2 - 2, maxLag);
    }

    /**
     * Runs the test; a degenerate regression (constant input, too few points)
     * yields NaN statistic and p-value instead of an exception.
     */
    public static Result test(double[] y) {
        Objects.requireNonNull(y, "y");
        int maxLag = defaultMaxLag(y.length);
        if (maxLag < 0) {
            return new Result(Double.NaN, Double.NaN, 0, 0);
        }
        double[] diff = new double[y.length - 1];
        for (int i = 1; i < y.length; i++) {
            diff[i - 1] = y[i] - y[i - 1];
        }

        try {
            int bestLag = selectLagByAic(y, diff, maxLag);
            int observations = diff.length - bestLag;
            double[][] design = design(y, diff, observations, bestLag);
            double[] response = tail(diff, observations);

            OLSMultipleLinearRegression ols = fit(response, design);
            double coefficient = ols.estimateRegressionParameters()[1];
            double standardError = ols.estimateRegressionParametersStandardErrors()[1];
            double statistic = coefficient / standardError;
            return new Result(statistic, mackinnonPValue(statistic), bestLag, observations);
        } catch (MathIllegalArgumentException e) {
            return new Result(Double.NaN, Double.NaN, 0, 0);
        }
    }

    public static double pValue(double[] y) {
        return test(y).pValue();
    }

    /**
     * MacKinnon approximate p-value of a Dickey-Fuller statistic.
     */
    public static double mackinnonPValue(double statistic) {
        if (Double.isNaN(statistic)) {
            return Double.NaN;
        }
        if (statistic > TAU_MAX) {
            return 1.0;
        }
        if (statistic < TAU_MIN) {
            return 0.0;
        }
        double[] coefficients = statistic <= TAU_STAR ? TAU_SMALL_P : TAU_LARGE_P;
        double polynomial = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            polynomial = polynomial * statistic + coefficients[i];
        }
        return STANDARD_NORMAL.cumulativeProbability(polynomial);
    }

    private static int selectLagByAic(double[] y, double[] diff, int maxLag) {
        int observations = diff.length - maxLag;
        double[] response = tail(diff, observations);
        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            double[][] design = design(y, diff, observations, lag);
            OLSMultipleLinearRegression ols = fit(response, design);
            int regressors = lag + 2;
            double ssr = ols.calculateResidualSumOfSquares();
            double logLikelihood = -observations / 2.0
                * (Math.log(2.0 * Math.PI) + Math.log(ssr / observations) + 1.0);
            double aic = -2.0 * logLikelihood + 2.0 * regressors;
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        return bestLag;
    }

    /**
     * Columns: constant, {@code y_(t-1)}, then {@code lags} lagged differences,
     * one row per each of the last {@code observations} differences.
     */
    private static double[][] design(double[] y, double[] diff, int observations, int lags) {
        double[][] x = new double[observations][lags + 2];
        for (int row = 0; row < observations; row++) {
            int t = diff.length - observations + row;
            x[row][0] = 1.0;
            x[row][1] = y[t];
            for (int lag = 1; lag <= lags; lag++) {
                x[row][lag + 1] = diff[t - lag];
            }
        }
        return x;
    }

    private static double[] tail(double[] values, int count) {
        double[] out = new double[count];
        System.arraycopy(values, values.length - count, out, 0, count);
        return out;
    }

    private static OLSMultipleLinearRegression fit(double[] response, double[][] design) {
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        ols.setNoIntercept(true);
        ols.newSampleData(response, design);
        return ols;
    }
}
