package tw.gc.forecaster.exception;

/**
 * A per-step regressor could not be trained.
 */
public class ModelTrainingException extends ForecasterException {

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
