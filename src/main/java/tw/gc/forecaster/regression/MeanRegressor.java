package tw.gc.forecaster.regression;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Baseline that always predicts the training mean.
 */
public class MeanRegressor implements Regressor {

    @Override
    public TrainedRegressor train(double[][] features, double[] target) {
        int columns = Matrices.validateTrainingData(features, target);
        double mean = StatUtils.mean(target);
        return rows -> {
            Matrices.validateColumns(rows, columns);
            double[] predictions = new double[rows.length];
            Arrays.fill(predictions, mean);
            return predictions;
        };
    }

    @Override
    public String name() {
        return "mean";
    }
}
