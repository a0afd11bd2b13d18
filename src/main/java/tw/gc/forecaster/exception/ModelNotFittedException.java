package tw.gc.forecaster.exception;

/**
 * Raised when an operation needs a fitted estimator and {@code fit} has not
 * completed yet. The caller recovers by fitting first.
 */
public class ModelNotFittedException extends ForecasterException {

    public static final String DEFAULT_MESSAGE = "Model must be fitted first";

    public ModelNotFittedException() {
        super(DEFAULT_MESSAGE);
    }

    public ModelNotFittedException(String operation) {
        super(DEFAULT_MESSAGE + " (called " + operation + ")");
    }
}
