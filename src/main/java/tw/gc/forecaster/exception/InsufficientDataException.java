package tw.gc.forecaster.exception;

/**
 * A whole run cannot proceed because the input holds fewer observations than
 * the requested windows, lags or folds need.
 */
public class InsufficientDataException extends ForecasterException {

    private final int required;
    private final int available;

    public InsufficientDataException(String message, int required, int available) {
        super("%s: required %d, available %d".formatted(message, required, available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
