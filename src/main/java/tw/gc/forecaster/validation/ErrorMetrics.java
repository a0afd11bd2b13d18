package tw.gc.forecaster.validation;

import java.util.Locale;

/**
 * Built-in error metrics. All reject vectors of different or zero length.
 */
public enum ErrorMetrics implements ErrorMetric {

    MAE {
        @Override
        public double score(double[] actual, double[] predicted) {
            validate(actual, predicted);
            double sum = 0.0;
            for (int i = 0; i < actual.length; i++) {
                sum += Math.abs(actual[i] - predicted[i]);
            }
            return sum / actual.length;
        }
    },

    MSE {
        @Override
        public double score(double[] actual, double[] predicted) {
            validate(actual, predicted);
            double sum = 0.0;
            for (int i = 0; i < actual.length; i++) {
                double error = actual[i] - predicted[i];
                sum += error * error;
            }
            return sum / actual.length;
        }
    },

    RMSE {
        @Override
        public double score(double[] actual, double[] predicted) {
            return Math.sqrt(MSE.score(actual, predicted));
        }
    },

    /**
     * Mean absolute percentage error as a fraction; undefined where an actual value is 0.
     */
    MAPE {
        @Override
        public double score(double[] actual, double[] predicted) {
            validate(actual, predicted);
            double sum = 0.0;
            for (int i = 0; i < actual.length; i++) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
            }
            return sum / actual.length;
        }
    };

    public static final ErrorMetrics DEFAULT = MAE;

    /**
     * Lower-case label such as {@code mae}, as used in reports.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static void validate(double[] actual, double[] predicted) {
        if (actual == null || predicted == null) {
            throw new IllegalArgumentException("actual and predicted are required");
        }
        if (actual.length == 0 || actual.length != predicted.length) {
            throw new IllegalArgumentException("actual (%d) and predicted (%d) must have the same non-zero length"
                .formatted(actual.length, predicted.length));
        }
    }
}
