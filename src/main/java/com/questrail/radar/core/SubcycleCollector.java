package com.questrail.radar.core;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.api.TimeInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SubcycleCollector
 * -----------------------------------------------------------------------------
 * Hierarchical interval collector: the subcycles of a cycle, each with a
 * snapshot of every hardware stream taken when the subcycle closed.
 *
 * <h2>Why snapshots</h2>
 * Streams are discarded at each subcycle boundary. Copying their closed
 * intervals at close time gives every subcycle its own independent,
 * order-preserving timeline that later stages can replay.
 *
 * <h2>Close-time invariant</h2>
 * A subcycle may only close when every stream of the supplied
 * {@link StreamSet} is off. Otherwise {@link #turnOff} throws
 * {@link IllegalStateException} naming the lines still on.
 */
public final class SubcycleCollector
{
    /**
     * Frozen timeline of one subcycle.
     *
     * @param index    0-based subcycle index within the cycle
     * @param interval time span of the subcycle
     * @param streams  closed intervals of every hardware line
     */
    public record Snapshot(int index,
                           TimeInterval interval,
                           Map<HardwareLine, List<TimeInterval>> streams) {
        public Snapshot {
            Objects.requireNonNull(interval, "interval");
            Map<HardwareLine, List<TimeInterval>> ordered = new EnumMap<>(HardwareLine.class);
            ordered.putAll(streams);
            streams = Collections.unmodifiableMap(ordered);
        }

        public List<TimeInterval> intervals(HardwareLine line) {
            return streams.getOrDefault(line, List.of());
        }
    }

    private final IntervalStream subcycles = new IntervalStream("SUBCYCLE");
    private final List<Snapshot> snapshots = new ArrayList<>();

    public boolean isOn() {
        return subcycles.isOn();
    }

    public boolean isOff() {
        return subcycles.isOff();
    }

    public void turnOn(double time) {
        subcycles.turnOn(time);
    }

    /**
     * Closes the running subcycle at {@code time} and snapshots {@code streams}.
     *
     * @throws IllegalStateException if no subcycle is running or a stream is
     *         still on
     */
    public void turnOff(double time, StreamSet streams) {
        Objects.requireNonNull(streams, "streams");
        if (subcycles.isOff()) {
            throw new IllegalStateException("No subcycle has been started yet!");
        }
        Map<HardwareLine, List<TimeInterval>> frozen = streams.snapshot();
        double begin = subcycles.lastTurnOn();
        subcycles.turnOff(time);
        snapshots.add(new Snapshot(snapshots.size(), new TimeInterval(begin, time), frozen));
    }

    /**
     * Number of closed subcycles.
     */
    public int size() {
        return snapshots.size();
    }

    /**
     * Intervals of the closed subcycles.
     */
    public List<TimeInterval> intervals() {
        List<TimeInterval> out = new ArrayList<>(snapshots.size());
        for (Snapshot s : snapshots) {
            out.add(s.interval());
        }
        return Collections.unmodifiableList(out);
    }

    public Snapshot snapshot(int index) {
        return snapshots.get(index);
    }

    public List<Snapshot> snapshots() {
        return Collections.unmodifiableList(snapshots);
    }
}
