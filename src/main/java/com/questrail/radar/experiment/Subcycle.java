package com.questrail.radar.experiment;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.api.TimedEvent;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.Phase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Everything a renderer needs to draw one subcycle.
 *
 * @param index       0-based position in the cycle
 * @param interval    time span of the subcycle, seconds from cycle start
 * @param transmit    intervals with RF on
 * @param receive     sampling intervals per receive channel (1..6); channels
 *                    that never sample are absent
 * @param settings    intervals of the other lines by stream name
 *                    ({@code RXPROT}, {@code LOPROT}, {@code CAL},
 *                    {@code BEAM}, {@code +}, {@code -})
 * @param phaseShifts phase settings within the subcycle, see
 *                    {@code PhaseShifter.phaseShiftsWithin}
 * @param frequencies center frequency (Hz) per channel, restricted to the
 *                    subcycle
 * @param baudLength  estimated baud length in seconds, if the subcycle holds
 *                    a phase code
 */
public record Subcycle(
    int index,
    TimeInterval interval,
    List<TimeInterval> transmit,
    Map<Integer, List<TimeInterval>> receive,
    Map<String, List<TimeInterval>> settings,
    List<TimedEvent<Phase>> phaseShifts,
    Map<Integer, FrequencySeries> frequencies,
    OptionalDouble baudLength
) {
    public Subcycle {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        Objects.requireNonNull(interval, "interval");
        transmit = List.copyOf(transmit);
        receive = Collections.unmodifiableMap(new TreeMap<>(receive));
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        phaseShifts = List.copyOf(phaseShifts);
        frequencies = Collections.unmodifiableMap(new TreeMap<>(frequencies));
        Objects.requireNonNull(baudLength, "baudLength");
    }

    public List<TimeInterval> receive(int channel) {
        return receive.getOrDefault(channel, List.of());
    }

    public List<TimeInterval> setting(HardwareLine line) {
        return settings.getOrDefault(line.streamName(), List.of());
    }

    /**
     * Number the subcycle is shown under, counting from 1.
     */
    public int number() {
        return index + 1;
    }
}
