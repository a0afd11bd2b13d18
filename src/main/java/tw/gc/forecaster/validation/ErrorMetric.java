package tw.gc.forecaster.validation;

/**
 * Scores predictions against actual values; lower is better.
 */
@FunctionalInterface
public interface ErrorMetric {

    double score(double[] actual, double[] predicted);

    /**
     * Label used in reports. Anonymous classes have no simple name and fall
     * back to the binary class name.
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
