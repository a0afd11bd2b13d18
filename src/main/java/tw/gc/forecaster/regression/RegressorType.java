package tw.gc.forecaster.regression;

/**
 * Regressors selectable through configuration.
 */
public enum RegressorType {
    RIDGE,
    OLS,
    MEAN;

    /**
     * @param alpha penalty, used by {@link #RIDGE} only
     */
    public Regressor create(double alpha) {
        return switch (this) {
            case RIDGE -> new RidgeRegressor(alpha);
            case OLS -> new OrdinaryLeastSquaresRegressor();
            case MEAN -> new MeanRegressor();
        };
    }
}
