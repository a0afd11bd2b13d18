package tw.gc.forecaster.regression;

/**
 * Shape checks shared by the regressors.
 */
final class Matrices {

    private Matrices() {
        throw new AssertionError("Utility class");
    }

    static int validateTrainingData(double[][] features, double[] target) {
        if (features == null || target == null) {
            throw new IllegalArgumentException("features and target are required");
        }
        if (features.length == 0) {
            throw new IllegalArgumentException("Cannot train on zero rows");
        }
        if (features.length != target.length) {
            throw new IllegalArgumentException("features (%d rows) and target (%d values) differ in length"
                .formatted(features.length, target.length));
        }
        return validateColumns(features, features[0].length);
    }

    static int validateColumns(double[][] features, int expectedColumns) {
        if (features == null) {
            throw new IllegalArgumentException("features are required");
        }
        for (int r = 0; r < features.length; r++) {
            if (features[r].length != expectedColumns) {
                throw new IllegalArgumentException("Row %d has %d columns, expected %d"
                    .formatted(r, features[r].length, expectedColumns));
            }
        }
        return expectedColumns;
    }
}
