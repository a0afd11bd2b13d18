package tw.gc.forecaster.regression;

/**
 * A fitted model, immutable once returned by {@link Regressor#train}.
 */
@FunctionalInterface
public interface TrainedRegressor {

    double[] predict(double[][] features);

    default double predict(double[] row) {
        return predict(new double[][] {row})[0];
    }
}
