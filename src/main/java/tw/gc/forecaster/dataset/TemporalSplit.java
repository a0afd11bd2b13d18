package tw.gc.forecaster.dataset;

/**
 * Chronological train/test split without shuffling.
 */
public final class TemporalSplit {

    private TemporalSplit() {
        throw new AssertionError("Utility class");
    }

    /**
     * Holds out the last {@code floor(N * testSize)} rows.
     *
     * @param testSize fraction of rows in the test set, in (0, 1)
     */
    public static TrainTestSplit split(AlignedDataset dataset, double testSize) {
        if (dataset == null) {
            throw new IllegalArgumentException("dataset cannot be null");
        }
        if (!(testSize > 0.0 && testSize < 1.0)) {
            throw new IllegalArgumentException("testSize must be in (0, 1), got: " + testSize);
        }
        int rows = dataset.rowCount();
        int testRows = (int) Math.floor(rows * testSize);
        int boundary = rows - testRows;
        return new TrainTestSplit(dataset.slice(0, boundary), dataset.slice(boundary, rows));
    }
}
