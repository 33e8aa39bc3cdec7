package com.sensorwatch.core.sensor;

import java.util.Arrays;

/**
 * Deterministic {@link ReadingSource} that cycles through a fixed array.
 */
final class CyclingReadingSource implements ReadingSource {

    private final double[] values;
    private int position;

    CyclingReadingSource(double... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("At least one value is required");
        }
        this.values = Arrays.copyOf(values, values.length);
    }

    @Override
    public double next() {
        double value = values[position];
        position = (position + 1) % values.length;
        return value;
    }
}
