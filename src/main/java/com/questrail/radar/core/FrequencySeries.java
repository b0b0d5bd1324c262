package com.questrail.radar.core;

import com.questrail.radar.api.TimeInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * FrequencySeries
 * -----------------------------------------------------------------------------
 * Sorted mapping from time (s) to frequency (Hz), used to follow the center
 * frequency of a receive channel as the controller program selects local
 * oscillator paths and NCO entries.
 *
 * A frequency is in effect from its time until the next recorded time.
 * Recording twice at the same time keeps the later value.
 */
public final class FrequencySeries
{
    /**
     * Vertices of a step line, ready to be drawn by a renderer.
     */
    public record StepLine(List<Double> times, List<Double> values) {
        public StepLine {
            times = List.copyOf(times);
            values = List.copyOf(values);
        }
    }

    private final NavigableMap<Double, Double> frequencies = new TreeMap<>();

    public void record(double time, double frequency) {
        frequencies.put(time, frequency);
    }

    public boolean isEmpty() {
        return frequencies.isEmpty();
    }

    public int size() {
        return frequencies.size();
    }

    /**
     * Unmodifiable view of the time → frequency entries in time order.
     */
    public NavigableMap<Double, Double> entries() {
        return Collections.unmodifiableNavigableMap(frequencies);
    }

    /**
     * Distinct frequencies in order of first appearance.
     */
    public List<Double> frequencies() {
        return new ArrayList<>(new LinkedHashSet<>(frequencies.values()));
    }

    /**
     * Returns the frequency in effect at {@code interval.begin()} (keyed at
     * that time) followed by every change strictly inside the interval.
     *
     * @throws IllegalArgumentException if the interval begins before the first
     *         recorded frequency
     */
    public FrequencySeries shiftsWithin(TimeInterval interval) {
        Map.Entry<Double, Double> first = frequencies.floorEntry(interval.begin());
        if (first == null) {
            throw new IllegalArgumentException("TimeInterval begins before first frequency is defined!");
        }
        FrequencySeries out = new FrequencySeries();
        out.record(interval.begin(), first.getValue());
        for (Map.Entry<Double, Double> e : frequencies.subMap(interval.begin(), false, interval.end(), false).entrySet()) {
            out.record(e.getKey(), e.getValue());
        }
        return out;
    }

    /**
     * Step-line vertices of the frequency over {@code interval}: each
     * frequency is held until the next change, the last one until
     * {@code interval.end()}.
     */
    public StepLine asLine(TimeInterval interval) {
        List<Map.Entry<Double, Double>> shifts = new ArrayList<>(shiftsWithin(interval).frequencies.entrySet());
        List<Double> times = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < shifts.size(); i++) {
            double until = i + 1 < shifts.size() ? shifts.get(i + 1).getKey() : interval.end();
            times.add(shifts.get(i).getKey());
            times.add(until);
            values.add(shifts.get(i).getValue());
            values.add(shifts.get(i).getValue());
        }
        return new StepLine(times, values);
    }

    @Override
    public String toString() {
        return "FrequencySeries" + frequencies;
    }
}
