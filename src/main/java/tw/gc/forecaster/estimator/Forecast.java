package tw.gc.forecaster.estimator;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Predicted values for the next {@code horizon} timestamps.
 */
public record Forecast(List<Point> points) {

    public static final String COLUMN = "Forecast";

    public record Point(LocalDateTime timestamp, double value) {

        public Point {
            if (timestamp == null) {
                throw new IllegalArgumentException("timestamp cannot be null");
            }
        }
    }

    public Forecast {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("A forecast needs at least one point");
        }
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Forecast timestamps must be strictly increasing");
            }
        }
    }

    public int horizon() {
        return points.size();
    }

    public List<LocalDateTime> timestamps() {
        return points.stream().map(Point::timestamp).toList();
    }

    public double[] values() {
        return points.stream().mapToDouble(Point::value).toArray();
    }

    /**
     * Value {@code step} observations ahead, 1-based.
     */
    public double step(int step) {
        return points.get(step - 1).value();
    }
}
