package tw.gc.forecaster.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.config.ForecasterProperties;
import tw.gc.forecaster.estimator.Forecast;
import tw.gc.forecaster.estimator.MultiOutputForecastEstimator;
import tw.gc.forecaster.exception.ForecasterException;
import tw.gc.forecaster.features.FeatureRow;
import tw.gc.forecaster.features.FeatureTable;
import tw.gc.forecaster.regression.Regressor;
import tw.gc.forecaster.series.Frequency;
import tw.gc.forecaster.series.TimeSeries;
import tw.gc.forecaster.validation.ValidationReport;
import tw.gc.forecaster.validation.WalkForwardValidator;

/**
 * Entry point wiring the forecasting pipeline to the configured properties.
 *
 * <p>Each call creates its own estimator; nothing fitted is kept in the
 * service, so concurrent callers never share model state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastingService {

    private final ForecasterProperties properties;
    private final Regressor regressor;
    private final WalkForwardValidator walkForwardValidator;
    private final ObjectMapper objectMapper;

    /**
     * Unfitted estimator with the configured horizon, seasonal period,
     * frequency, workers and regressor.
     */
    public MultiOutputForecastEstimator newEstimator() {
        return new MultiOutputForecastEstimator(
            regressor,
            properties.getHorizon(),
            properties.getSeasonalPeriod(),
            Frequency.fromCode(properties.getFrequency()),
            properties.getWorkers());
    }

    public MultiOutputForecastEstimator fit(TimeSeries series) {
        return newEstimator().fit(series, properties.getLagsToConsider());
    }

    public Forecast fitAndForecast(TimeSeries series) {
        return fit(series).forecast();
    }

    public ValidationReport validate(MultiOutputForecastEstimator estimator) {
        ValidationReport report = walkForwardValidator.validate(estimator);
        log.info("\n{}", report.generateReport());
        return report;
    }

    /**
     * Fits on the series, then runs walk-forward validation.
     */
    public ValidationReport fitAndValidate(TimeSeries series) {
        return validate(fit(series));
    }

    // ========== JSON Export ==========

    /**
     * Feature rows as JSON, restricted to {@code columns} when not empty.
     */
    public String exportFeatures(FeatureTable features, List<String> columns) {
        FeatureTable selected = columns == null || columns.isEmpty() ? features : features.select(columns);
        List<FeatureRow> rows = selected.rows();
        return toJson(rows, "feature table");
    }

    public String exportForecast(Forecast forecast) {
        List<Map<String, Object>> points = new ArrayList<>(forecast.horizon());
        for (Forecast.Point point : forecast.points()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", point.timestamp());
            entry.put(Forecast.COLUMN, point.value());
            points.add(entry);
        }
        return toJson(points, "forecast");
    }

    public String exportValidationReport(ValidationReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("metric", report.metricName());
        summary.put("meanError", report.meanError());
        summary.put("errorsByTrainingSize", report.errorsByTrainingSize());
        summary.put("folds", report.folds());
        return toJson(summary, "validation report");
    }

    private String toJson(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ForecasterException("Failed to serialize " + what, e);
        }
    }
}
