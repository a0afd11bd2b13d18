package tw.gc.forecaster.estimator;

/**
 * Lifecycle of a {@link MultiOutputForecastEstimator}. A fit moves it to
 * {@link #FITTED}; re-fitting replaces the fitted state as a whole.
 */
public enum EstimatorState {
    UNFITTED,
    FITTED
}
