package tw.gc.forecaster.exception;

/**
 * Root of the forecasting pipeline's unchecked exceptions.
 */
public class ForecasterException extends RuntimeException {

    public ForecasterException(String message) {
        super(message);
    }

    public ForecasterException(String message, Throwable cause) {
        super(message, cause);
    }
}
