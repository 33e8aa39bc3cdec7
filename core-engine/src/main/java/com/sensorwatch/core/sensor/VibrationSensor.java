package com.sensorwatch.core.sensor;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.SensorReading;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Vibration sensor evaluated on the root-mean-square of its recent readings.
 *
 * <p>
 * Keeps a sliding window of the last {@code windowSize} readings. The RMS used
 * to evaluate a reading covers the window with that reading as its newest
 * entry; a reading that is not in the window yet is considered appended, but
 * evaluation never modifies the window itself.
 * </p>
 *
 * <p>
 * A breach is {@code rms > rmsLimit}; its magnitude is
 * {@code (rms - rmsLimit) / rmsLimit}.
 * </p>
 *
 * @since 1.0.0
 */
public class VibrationSensor extends Sensor {

    /** Default number of readings in the RMS window. */
    public static final int DEFAULT_WINDOW_SIZE = 5;

    /** Default sampling frequency in Hz. */
    public static final int DEFAULT_FREQUENCY_HZ = 1000;

    private final double rmsLimit;
    private final int windowSize;
    private final int frequencyHz;

    /** Sliding window of recent readings, oldest first. */
    private final Deque<SensorReading> window = new ArrayDeque<>();

    /**
     * Vibration sensor with the default window and frequency and a seeded
     * random source over {@code [0, 5)}.
     */
    public VibrationSensor(String id, double rmsLimit) {
        this(id, rmsLimit, DEFAULT_WINDOW_SIZE, DEFAULT_FREQUENCY_HZ, null, 0.0,
                ReadingSource.uniform(0.0, 5.0, id == null ? 0 : id.hashCode()),
                Clock.systemUTC());
    }

    /**
     * @throws InvalidConfigurationException if {@code rmsLimit <= 0},
     *                                       {@code windowSize < 1} or
     *                                       {@code frequencyHz <= 0}
     */
    public VibrationSensor(String id, double rmsLimit, int windowSize, int frequencyHz, String location,
            double calibration, ReadingSource source, Clock clock) {
        super(id, location, calibration, source, clock);
        requireFinite(id, "rmsLimit", rmsLimit);
        if (rmsLimit <= 0) {
            throw new InvalidConfigurationException(
                    "Sensor '" + id + "' requires 'rmsLimit' > 0, got: " + rmsLimit);
        }
        if (windowSize < 1) {
            throw new InvalidConfigurationException(
                    "Sensor '" + id + "' requires 'windowSize' >= 1, got: " + windowSize);
        }
        if (frequencyHz <= 0) {
            throw new InvalidConfigurationException(
                    "Sensor '" + id + "' requires 'frequencyHz' > 0, got: " + frequencyHz);
        }
        this.rmsLimit = rmsLimit;
        this.windowSize = windowSize;
        this.frequencyHz = frequencyHz;
    }

    @Override
    protected void onReading(SensorReading reading) {
        window.addLast(reading);
        if (window.size() > windowSize) {
            window.pollFirst();
        }
    }

    @Override
    public double breachMagnitude(SensorReading reading) {
        double rms = rmsWith(checkOwnership(reading));
        return rms > rmsLimit ? (rms - rmsLimit) / rmsLimit : 0.0;
    }

    /**
     * @return RMS of the current window, {@code 0} when empty
     */
    public double currentRms() {
        List<Double> values = new ArrayList<>(window.size());
        for (SensorReading r : window) {
            values.add(r.getValue());
        }
        return rms(values);
    }

    /**
     * RMS of the window as if {@code reading} were its newest entry.
     */
    double rmsWith(SensorReading reading) {
        List<Double> values = new ArrayList<>(window.size() + 1);
        for (SensorReading r : window) {
            values.add(r.getValue());
        }
        if (window.peekLast() != reading) {
            values.add(reading.getValue());
            if (values.size() > windowSize) {
                values.remove(0);
            }
        }
        return rms(values);
    }

    private static double rms(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sumOfSquares = 0;
        for (double v : values) {
            sumOfSquares += v * v;
        }
        return Math.sqrt(sumOfSquares / values.size());
    }

    @Override
    public SensorType getType() {
        return SensorType.VIBRATION;
    }

    @Override
    public String describe() {
        return "Vibration @ " + frequencyHz + "Hz";
    }

    public double getRmsLimit() {
        return rmsLimit;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getFrequencyHz() {
        return frequencyHz;
    }
}
