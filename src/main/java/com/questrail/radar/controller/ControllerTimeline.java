package com.questrail.radar.controller;

import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.PhaseShifter;
import com.questrail.radar.core.SubcycleCollector;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * ControllerTimeline
 * -----------------------------------------------------------------------------
 * Validated result of replaying one controller cycle.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the cycle interval, from 0 to {@code REP}</li>
 *   <li>one snapshot per subcycle, holding the closed intervals of every
 *       hardware line</li>
 *   <li>the phase shifter, spanning the whole cycle</li>
 *   <li>the center frequency (Hz) of every receive channel over time</li>
 *   <li>the time the FIR filters were started, if they were</li>
 * </ul>
 *
 * All times are absolute seconds from the start of the cycle.
 */
public final class ControllerTimeline
{
    private final TimeInterval cycle;
    private final List<SubcycleCollector.Snapshot> subcycles;
    private final PhaseShifter phaseShifter;
    private final Map<Integer, FrequencySeries> frequencies;
    private final Double filterStart;

    public ControllerTimeline(TimeInterval cycle,
                              List<SubcycleCollector.Snapshot> subcycles,
                              PhaseShifter phaseShifter,
                              Map<Integer, FrequencySeries> frequencies,
                              Double filterStart) {
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.subcycles = List.copyOf(subcycles);
        this.phaseShifter = Objects.requireNonNull(phaseShifter, "phaseShifter");
        this.frequencies = Collections.unmodifiableMap(new TreeMap<>(frequencies));
        this.filterStart = filterStart;
    }

    public TimeInterval cycle() {
        return cycle;
    }

    /**
     * Length of the program, i.e. the time of {@code REP}.
     */
    public double endTime() {
        return cycle.end();
    }

    public List<SubcycleCollector.Snapshot> subcycles() {
        return subcycles;
    }

    public SubcycleCollector.Snapshot subcycle(int index) {
        return subcycles.get(index);
    }

    public PhaseShifter phaseShifter() {
        return phaseShifter;
    }

    /**
     * Center frequency series of receive channel 1..6. Empty if no frequency
     * was ever defined for the channel.
     */
    public FrequencySeries frequencies(int channel) {
        FrequencySeries series = frequencies.get(channel);
        if (series == null) {
            throw new IllegalArgumentException("Receive channels are numbered 1..6, not " + channel);
        }
        return series;
    }

    public Map<Integer, FrequencySeries> allFrequencies() {
        return frequencies;
    }

    public OptionalDouble filterStart() {
        return filterStart == null ? OptionalDouble.empty() : OptionalDouble.of(filterStart);
    }
}
