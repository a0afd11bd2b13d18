package tw.gc.forecaster.dataset;

/**
 * Earlier rows for training, the most recent rows for testing.
 */
public record TrainTestSplit(AlignedDataset train, AlignedDataset test) {

    public TrainTestSplit {
        if (train == null || test == null) {
            throw new IllegalArgumentException("train and test are required");
        }
        if (!train.isEmpty() && !test.isEmpty()
            && !train.index().get(train.rowCount() - 1).isBefore(test.index().get(0))) {
            throw new IllegalArgumentException("Training rows must precede test rows");
        }
    }
}
