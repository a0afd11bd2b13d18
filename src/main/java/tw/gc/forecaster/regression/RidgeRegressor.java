package tw.gc.forecaster.regression;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;

/**
 * L2-penalised least squares on standardised features.
 *
 * <p>Columns are centred and scaled to unit population standard deviation
 * (constant columns keep scale 1), the target is centred, and
 * {@code (Z'Z + alpha I) b = Z'y} is solved by Cholesky decomposition. The
 * coefficients are mapped back to the original feature scale, so the
 * intercept is never penalised. The window statistics live on very different
 * scales, which is why the penalty is applied after standardisation.
 */
public class RidgeRegressor implements Regressor {

    public static final double DEFAULT_ALPHA = 1.0;

    private final double alpha;

    public RidgeRegressor() {
        this(DEFAULT_ALPHA);
    }

    public RidgeRegressor(double alpha) {
        if (!(alpha > 0.0) || !Double.isFinite(alpha)) {
            throw new IllegalArgumentException("alpha must be a positive finite number, got: " + alpha);
        }
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public TrainedRegressor train(double[][] features, double[] target) {
        int columns = Matrices.validateTrainingData(features, target);
        int rows = features.length;

        double[] means = new double[columns];
        double[] scales = new double[columns];
        double[][] standardized = new double[rows][columns];
        for (int c = 0; c < columns; c++) {
            double[] column = new double[rows];
            for (int r = 0; r < rows; r++) {
                column[r] = features[r][c];
            }
            means[c] = StatUtils.mean(column);
            double scale = Math.sqrt(StatUtils.populationVariance(column, means[c]));
            scales[c] = scale > 0.0 ? scale : 1.0;
            for (int r = 0; r < rows; r++) {
                standardized[r][c] = (column[r] - means[c]) / scales[c];
            }
        }

        double targetMean = StatUtils.mean(target);
        double[] centred = new double[rows];
        for (int r = 0; r < rows; r++) {
            centred[r] = target[r] - targetMean;
        }

        RealMatrix z = new Array2DRowRealMatrix(standardized, false);
        RealMatrix gram = z.transpose().multiply(z);
        for (int c = 0; c < columns; c++) {
            gram.addToEntry(c, c, alpha);
        }
        RealVector rhs = z.transpose().operate(new ArrayRealVector(centred, false));
        double[] scaledBeta = new CholeskyDecomposition(gram).getSolver().solve(rhs).toArray();

        double[] coefficients = new double[columns];
        double intercept = targetMean;
        for (int c = 0; c < columns; c++) {
            coefficients[c] = scaledBeta[c] / scales[c];
            intercept -= coefficients[c] * means[c];
        }
        return new LinearModel(intercept, coefficients);
    }

    @Override
    public String name() {
        return "ridge(alpha=" + alpha + ")";
    }
}
