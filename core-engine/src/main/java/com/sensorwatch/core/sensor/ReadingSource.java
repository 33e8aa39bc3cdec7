package com.sensorwatch.core.sensor;

import java.util.Random;

/**
 * Supplies raw (uncalibrated) values to a sensor.
 *
 * <p>
 * There is no hardware behind a sensor; every value comes from one of these.
 * Implementations may throw to signal a failed read, which the alert manager
 * reports as a failed sensor for that cycle.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReadingSource {

    /**
     * @return the next raw value
     */
    double next();

    /**
     * Seeded uniform random values in {@code [lower, upper)}.
     *
     * @param lower inclusive lower bound
     * @param upper exclusive upper bound; must be greater than {@code lower}
     * @param seed  random seed, so the sequence is reproducible
     * @return bounded random source
     * @throws IllegalArgumentException if {@code lower >= upper}
     */
    static ReadingSource uniform(double lower, double upper, long seed) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException(
                    "lower must be < upper, got: [" + lower + ", " + upper + ")");
        }
        Random random = new Random(seed);
        return () -> lower + random.nextDouble() * (upper - lower);
    }

    /**
     * Replay the given values in order, starting over after the last one.
     *
     * @param values values to replay; at least one
     * @return deterministic source
     * @throws IllegalArgumentException if no values are given
     */
    static ReadingSource fixed(double... values) {
        return new CyclingReadingSource(values);
    }
}
