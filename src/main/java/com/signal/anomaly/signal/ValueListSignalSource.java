package com.signal.anomaly.signal;

import com.signal.anomaly.model.SignalPoint;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Finite source over a fixed list of values. Timestamps are the value positions.
 */
public class ValueListSignalSource implements SignalSource {

    private final List<Double> values;

    public ValueListSignalSource(List<Double> values) {
        this.values = List.copyOf(values);
    }

    public static ValueListSignalSource of(double... values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) boxed[i] = values[i];
        return new ValueListSignalSource(List.of(boxed));
    }

    @Override
    public Iterator<SignalPoint> iterator() {
        return new Iterator<>() {
            private int position;

            @Override
            public boolean hasNext() {
                return position < values.size();
            }

            @Override
            public SignalPoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                SignalPoint point = new SignalPoint(position, values.get(position));
                position++;
                return point;
            }
        };
    }

    @Override
    public String describe() {
        return "values[" + values.size() + "]";
    }

    public int size() {
        return values.size();
    }
}
