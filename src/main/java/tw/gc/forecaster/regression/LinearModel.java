package tw.gc.forecaster.regression;

/**
 * {@code y = intercept + coefficients . x}
 */
public record LinearModel(double intercept, double[] coefficients) implements TrainedRegressor {

    public LinearModel {
        if (coefficients == null) {
            throw new IllegalArgumentException("coefficients cannot be null");
        }
        coefficients = coefficients.clone();
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public double[] predict(double[][] features) {
        Matrices.validateColumns(features, coefficients.length);
        double[] predictions = new double[features.length];
        for (int r = 0; r < features.length; r++) {
            double sum = intercept;
            for (int c = 0; c < coefficients.length; c++) {
                sum += coefficients[c] * features[r][c];
            }
            predictions[r] = sum;
        }
        return predictions;
    }
}
