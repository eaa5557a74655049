package com.signal.anomaly.signal;

import com.signal.anomaly.model.SignalPoint;
import com.signal.anomaly.model.SignalSettings;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Random;

/**
 * Synthetic test signal:
 *
 *   value(t) = baseline + amplitude * sin(2*pi*frequency*t) + U(-noise, noise) + drift(t) + spike(t)
 *
 * where drift(t) = driftRate * (t - driftStart) once t >= driftStart, and with
 * probability anomalyProbability a spike of magnitude U(min, max) and random sign is
 * added. Timestamps advance one second per point from {@code startMillis}.
 *
 * All state lives in the iterator, so every {@link #iterator()} replays the same
 * sequence for the same settings.
 */
public class SyntheticSignalSource implements SignalSource {

    private static final long STEP_MILLIS = 1000L;

    private final SignalSettings settings;
    private final long startMillis;

    public SyntheticSignalSource(SignalSettings settings, long startMillis) {
        this.settings = settings;
        this.startMillis = startMillis;
    }

    public SyntheticSignalSource(SignalSettings settings) {
        this(settings, 0L);
    }

    @Override
    public Iterator<SignalPoint> iterator() {
        return new Iterator<>() {
            private final Random random = new Random(settings.getSeed());
            private long t;

            @Override
            public boolean hasNext() {
                return settings.getLength() <= 0 || t < settings.getLength();
            }

            @Override
            public SignalPoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                SignalPoint point = new SignalPoint(startMillis + t * STEP_MILLIS, valueAt(t, random));
                t++;
                return point;
            }
        };
    }

    private double valueAt(long t, Random random) {
        double seasonal = settings.getAmplitude() * Math.sin(2 * Math.PI * settings.getFrequency() * t);

        double noise = uniform(random, -settings.getNoiseLevel(), settings.getNoiseLevel());

        double drift = 0.0;
        if (t >= settings.getDriftStart()) {
            drift = settings.getDriftRate() * (t - settings.getDriftStart());
        }

        double spike = 0.0;
        if (random.nextDouble() < settings.getAnomalyProbability()) {
            double magnitude = uniform(random, settings.getAnomalyMinMagnitude(), settings.getAnomalyMaxMagnitude());
            spike = random.nextBoolean() ? magnitude : -magnitude;
        }

        return settings.getBaseline() + seasonal + noise + drift + spike;
    }

    private static double uniform(Random random, double lo, double hi) {
        return lo + random.nextDouble() * (hi - lo);
    }

    @Override
    public String describe() {
        return String.format("synthetic[length=%d, seed=%d, anomalyProbability=%.2f]",
                settings.getLength(), settings.getSeed(), settings.getAnomalyProbability());
    }

    public SignalSettings getSettings() {
        return settings;
    }
}
