package com.questrail.radar.core;

import com.questrail.radar.api.TimeInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * IntervalStream
 * -----------------------------------------------------------------------------
 * On/off history of one named hardware line, kept as a sequence of time
 * intervals.
 *
 * <h2>Open and closed entries</h2>
 * Unlike {@link TimeInterval}, an entry in a stream may be <em>open</em>: the
 * line was turned on but has not been turned off yet. Only the last entry may
 * be open; every earlier entry is closed.
 *
 * <h2>Lifecycle</h2>
 * A stream starts off and empty. Streams are created once per subcycle and
 * discarded at the subcycle boundary, so unrelated subcycles cannot leak state
 * into each other.
 *
 * Violations of the on/off protocol throw {@link IllegalStateException}. The
 * controller interpreter adds the offending source line.
 */
public final class IntervalStream
{
    private final String name;
    private final List<double[]> entries = new ArrayList<>();

    public IntervalStream(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public boolean isOn() {
        return !entries.isEmpty() && entries.get(entries.size() - 1).length == 1;
    }

    public boolean isOff() {
        return !isOn();
    }

    /**
     * Number of entries, open or closed.
     */
    public int size() {
        return entries.size();
    }

    /**
     * @throws IllegalStateException if the stream is already on
     */
    public void turnOn(double time) {
        if (isOn()) {
            throw new IllegalStateException("Data stream " + name + " is already on!");
        }
        entries.add(new double[] { time });
    }

    /**
     * @throws IllegalStateException if the stream is already off, or if
     *         {@code time} precedes the time the stream was turned on
     */
    public void turnOff(double time) {
        if (isOff()) {
            throw new IllegalStateException("Data stream " + name + " is already off!");
        }
        int last = entries.size() - 1;
        double on = entries.get(last)[0];
        if (time < on) {
            throw new IllegalStateException("Data stream " + name + " turned off at " + time
                    + " before it was turned on at " + on);
        }
        entries.set(last, new double[] { on, time });
    }

    /**
     * Returns the closed on-intervals of this stream in time order.
     *
     * @throws IllegalStateException if the stream is on
     */
    public List<TimeInterval> intervals() {
        if (isOn()) {
            throw new IllegalStateException("Stream " + name + " is on. Cannot return open intervals.");
        }
        List<TimeInterval> out = new ArrayList<>(entries.size());
        for (double[] entry : entries) {
            out.add(new TimeInterval(entry[0], entry[1]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * @throws IllegalStateException if the stream has never been turned on
     */
    public double lastTurnOn() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Stream " + name + " has not been turned on yet!");
        }
        return entries.get(entries.size() - 1)[0];
    }

    /**
     * @throws IllegalStateException if the stream has never been turned off
     */
    public double lastTurnOff() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Stream " + name + " has not been turned on yet!");
        }
        if (isOff()) {
            return entries.get(entries.size() - 1)[1];
        }
        if (entries.size() == 1) {
            throw new IllegalStateException("Stream " + name + " is on, but has not been turned off yet!");
        }
        return entries.get(entries.size() - 2)[1];
    }

    @Override
    public String toString() {
        return "IntervalStream{" + name + ", entries=" + entries.size() + (isOn() ? ", on" : ", off") + "}";
    }
}
