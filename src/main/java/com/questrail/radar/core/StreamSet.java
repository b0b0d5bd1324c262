package com.questrail.radar.core;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.api.TimeInterval;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One {@link IntervalStream} per {@link HardwareLine}, covering a single
 * subcycle. A new set is created at every subcycle boundary.
 */
public final class StreamSet
{
    private final Map<HardwareLine, IntervalStream> streams = new EnumMap<>(HardwareLine.class);

    public StreamSet() {
        for (HardwareLine line : HardwareLine.values()) {
            streams.put(line, new IntervalStream(line.streamName()));
        }
    }

    public IntervalStream get(HardwareLine line) {
        return streams.get(line);
    }

    /**
     * Lines whose stream is currently on, in declaration order.
     */
    public Set<HardwareLine> openLines() {
        Set<HardwareLine> open = EnumSet.noneOf(HardwareLine.class);
        for (Map.Entry<HardwareLine, IntervalStream> e : streams.entrySet()) {
            if (e.getValue().isOn()) {
                open.add(e.getKey());
            }
        }
        return open;
    }

    /**
     * Copies the closed intervals of every stream.
     *
     * @throws IllegalStateException if any stream is still on
     */
    public Map<HardwareLine, List<TimeInterval>> snapshot() {
        Set<HardwareLine> open = openLines();
        if (!open.isEmpty()) {
            throw new IllegalStateException("Data stream " + names(open) + " is still on!");
        }
        Map<HardwareLine, List<TimeInterval>> copy = new EnumMap<>(HardwareLine.class);
        for (Map.Entry<HardwareLine, IntervalStream> e : streams.entrySet()) {
            copy.put(e.getKey(), e.getValue().intervals());
        }
        return Collections.unmodifiableMap(copy);
    }

    private static String names(Set<HardwareLine> lines) {
        StringBuilder sb = new StringBuilder();
        for (HardwareLine line : lines) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(line.streamName());
        }
        return sb.toString();
    }
}
