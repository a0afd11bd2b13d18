package tw.gc.forecaster.exception;

/**
 * Feature and target tables share no usable rows, or their row keys differ.
 */
public class AlignmentMismatchException extends ForecasterException {

    public AlignmentMismatchException(String message) {
        super(message);
    }
}
