package tw.gc.forecaster.regression;

/**
 * Base regression capability: fits one scalar target from a feature matrix.
 *
 * <p>Implementations must not keep state between {@link #train} calls; the
 * returned model owns everything it learned, so a single regressor can train
 * several models concurrently.
 */
public interface Regressor {

    /**
     * @param features row-major {@code rows x columns} matrix
     * @param target one value per row
     * @return an independent trained model
     */
    TrainedRegressor train(double[][] features, double[] target);

    /**
     * Short label used in logs and reports.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
