package tw.gc.forecaster.regression;

import java.util.Arrays;

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Linear least squares with intercept, solved by QR decomposition.
 * Needs more rows than columns.
 */
public class OrdinaryLeastSquaresRegressor implements Regressor {

    @Override
    public TrainedRegressor train(double[][] features, double[] target) {
        int columns = Matrices.validateTrainingData(features, target);
        if (features.length <= columns + 1) {
            throw new IllegalArgumentException("OLS needs more than %d rows for %d columns, got: %d"
                .formatted(columns + 1, columns, features.length));
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(target, features);
        double[] beta = ols.estimateRegressionParameters();
        return new LinearModel(beta[0], Arrays.copyOfRange(beta, 1, beta.length));
    }

    @Override
    public String name() {
        return "ols";
    }
}
