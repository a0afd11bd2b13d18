package tw.gc.forecaster.validation;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of a walk-forward validation, folds in ascending training size.
 *
 * @param metric error metric every fold was scored with
 * @param folds evaluated folds
 */
public record ValidationReport(ErrorMetric metric, List<ValidationFold> folds) {

    public ValidationReport {
        Objects.requireNonNull(metric, "metric");
        if (folds == null || folds.isEmpty()) {
            throw new IllegalArgumentException("A report needs at least one fold");
        }
        folds = List.copyOf(folds);
        for (int i = 1; i < folds.size(); i++) {
            if (folds.get(i).trainingRows() <= folds.get(i - 1).trainingRows()) {
                throw new IllegalArgumentException("Folds must be ordered by strictly increasing training size");
            }
        }
    }

    public String metricName() {
        return metric.name();
    }

    /**
     * Training-set size to error, in fold order.
     */
    public Map<Integer, Double> errorsByTrainingSize() {
        Map<Integer, Double> errors = new LinkedHashMap<>();
        for (ValidationFold fold : folds) {
            errors.put(fold.trainingRows(), fold.error());
        }
        return Collections.unmodifiableMap(errors);
    }

    public double meanError() {
        return folds.stream().mapToDouble(ValidationFold::error).average().orElse(Double.NaN);
    }

    public Optional<ValidationFold> bestFold() {
        return folds.stream()
            .filter(f -> !Double.isNaN(f.error()))
            .min(Comparator.comparingDouble(ValidationFold::error));
    }

    public String generateReport() {
        String foldLines = folds.stream()
            .map(ValidationFold::describe)
            .collect(Collectors.joining("\n  • ", "  • ", ""));
        return """
            ═══════════════════════════════════════════════════════════════
            Walk-Forward Validation Report (%s)
            ═══════════════════════════════════════════════════════════════

            Folds: %d
            Mean error: %.4f
            Best fold: %s

            %s

            ═══════════════════════════════════════════════════════════════
            """.formatted(
                metricName(),
                folds.size(),
                meanError(),
                bestFold().map(f -> "#" + f.foldNumber() + " (" + f.trainingRows() + " rows)").orElse("None"),
                foldLines
            );
    }
}
