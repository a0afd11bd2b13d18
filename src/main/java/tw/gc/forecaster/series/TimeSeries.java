package tw.gc.forecaster.series;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable univariate series: strictly increasing timestamps, one finite value each.
 */
public final class TimeSeries {

    private final List<LocalDateTime> timestamps;
    private final double[] values;

    public TimeSeries(List<LocalDateTime> timestamps, double[] values) {
        Objects.requireNonNull(timestamps, "timestamps");
        Objects.requireNonNull(values, "values");
        if (timestamps.size() != values.length) {
            throw new IllegalArgumentException("timestamps (%d) and values (%d) must be the same length"
                .formatted(timestamps.size(), values.length));
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("A time series needs at least one observation");
        }
        for (int i = 0; i < values.length; i++) {
            if (timestamps.get(i) == null) {
                throw new IllegalArgumentException("Timestamp at position %d is null".formatted(i));
            }
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Value at %s is not finite: %s"
                    .formatted(timestamps.get(i), values[i]));
            }
            if (i > 0 && !timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing: %s is not after %s"
                    .formatted(timestamps.get(i), timestamps.get(i - 1)));
            }
        }
        this.timestamps = List.copyOf(timestamps);
        this.values = values.clone();
    }

    /**
     * Builds a regularly sampled series starting at {@code start}.
     */
    public static TimeSeries of(LocalDateTime start, Frequency frequency, double[] values) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(values, "values");
        List<LocalDateTime> timestamps = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            timestamps.add(frequency.plus(start, i));
        }
        return new TimeSeries(timestamps, values);
    }

    public int size() {
        return values.length;
    }

    public LocalDateTime timestamp(int index) {
        return timestamps.get(index);
    }

    public double value(int index) {
        return values[index];
    }

    public List<LocalDateTime> timestamps() {
        return timestamps;
    }

    /**
     * Copy of the observations in chronological order.
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Copy of the {@code length} observations ending at {@code endInclusive}.
     */
    public double[] window(int endInclusive, int length) {
        int start = endInclusive - length + 1;
        if (start < 0 || endInclusive >= values.length) {
            throw new IndexOutOfBoundsException("Window [%d, %d] outside series of size %d"
                .formatted(start, endInclusive, values.length));
        }
        return Arrays.copyOfRange(values, start, endInclusive + 1);
    }

    public LocalDateTime firstTimestamp() {
        return timestamps.get(0);
    }

    public LocalDateTime lastTimestamp() {
        return timestamps.get(timestamps.size() - 1);
    }

    @Override
    public String toString() {
        return "TimeSeries[%d points, %s -> %s]".formatted(size(), firstTimestamp(), lastTimestamp());
    }
}
