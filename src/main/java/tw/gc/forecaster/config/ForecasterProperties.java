package tw.gc.forecaster.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.forecaster.regression.RegressorType;
import tw.gc.forecaster.regression.RidgeRegressor;
import tw.gc.forecaster.validation.ErrorMetrics;

@Data
@Component
@ConfigurationProperties(prefix = "forecaster")
public class ForecasterProperties {

    /** Number of steps forecast ahead */
    private int horizon = 1;

    /** Feature window length, also the walk-forward holdout */
    private int seasonalPeriod = 12;

    /** Offset alias of the series: min, H, D, W, M, Q or Y */
    private String frequency = "D";

    private int lagsToConsider = 5;

    /** Pool size for feature computation and per-step training */
    private int workers = Runtime.getRuntime().availableProcessors();

    private RegressorSettings regressor = new RegressorSettings();
    @Data
    public static class RegressorSettings {
        private RegressorType type = RegressorType.RIDGE;
        private double alpha = RidgeRegressor.DEFAULT_ALPHA;
    }

    private Validation validation = new Validation();
    @Data
    public static class Validation {
        private int folds = 5;
        private ErrorMetrics metric = ErrorMetrics.MAE;
    }
}
