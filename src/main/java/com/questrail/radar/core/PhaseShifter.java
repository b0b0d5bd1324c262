package com.questrail.radar.core;

import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.api.TimedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * PhaseShifter
 * -----------------------------------------------------------------------------
 * Records the phase settings of the transmitter phase shifter over a whole
 * cycle.
 *
 * <h2>Ordering</h2>
 * Events are kept sorted by time. An event inserted at the same time as an
 * existing one is placed after it, so several settings issued at one instant
 * keep program order.
 *
 * <h2>Baud length</h2>
 * {@link #estimateBaudLength(TimeInterval)} takes the greatest common divisor
 * of the gaps between phase changes. This only works if every baud boundary of
 * the code is visible as a change: a code that holds the same phase for two or
 * more consecutive bauds everywhere yields a multiple of the real baud length,
 * and this is not detected.
 */
public final class PhaseShifter
{
    private static final double NANOS_PER_SECOND = 1e9;

    private final List<TimedEvent<Phase>> shifts = new ArrayList<>();

    public void setPhase(double time, Phase phase) {
        Objects.requireNonNull(phase, "phase");
        TimedEvent<Phase> event = new TimedEvent<>(time, phase);
        int index = shifts.size();
        while (index > 0 && shifts.get(index - 1).time() > time) {
            index--;
        }
        shifts.add(index, event);
    }

    /**
     * All recorded settings in time order.
     */
    public List<TimedEvent<Phase>> phaseShifts() {
        return Collections.unmodifiableList(shifts);
    }

    /**
     * Phase of the latest recorded setting, if any.
     */
    public Optional<Phase> currentPhase() {
        return shifts.isEmpty() ? Optional.empty() : Optional.of(shifts.get(shifts.size() - 1).event());
    }

    /**
     * Phase in effect at {@code time}: the last setting at or before it.
     */
    public Optional<Phase> phaseAt(double time) {
        Phase phase = null;
        for (TimedEvent<Phase> shift : shifts) {
            if (shift.time() > time) {
                break;
            }
            phase = shift.event();
        }
        return Optional.ofNullable(phase);
    }

    /**
     * Returns the settings inside {@code interval} (bounds included). If a
     * setting precedes the interval, the phase then in effect is prepended as
     * a synthetic event at {@code interval.begin()}.
     * <p>
     * A real setting exactly at {@code interval.begin()} already states the
     * phase there, so no synthetic event is added in that case and the list
     * never holds two events at the begin.
     */
    public List<TimedEvent<Phase>> phaseShiftsWithin(TimeInterval interval) {
        List<TimedEvent<Phase>> out = new ArrayList<>();
        Phase before = null;
        boolean atBegin = false;
        for (TimedEvent<Phase> shift : shifts) {
            if (shift.time() < interval.begin()) {
                before = shift.event();
            } else if (shift.time() <= interval.end()) {
                if (shift.time() == interval.begin()) {
                    atBegin = true;
                }
                out.add(shift);
            }
        }
        if (before != null && !atBegin) {
            out.add(0, new TimedEvent<>(interval.begin(), before));
        }
        return out;
    }

    /**
     * Estimates the baud length in seconds of the code transmitted inside
     * {@code interval}.
     * <p>
     * The first setting inside the interval marks the start of the code; after
     * that only settings that change the phase count. Gaps between those
     * times are rounded to whole nanoseconds before the GCD is taken.
     *
     * @return the estimate, or empty if fewer than two boundaries are found
     */
    public OptionalDouble estimateBaudLength(TimeInterval interval) {
        List<Double> boundaries = new ArrayList<>();
        Phase previous = null;
        for (TimedEvent<Phase> shift : shifts) {
            if (!interval.contains(shift.time())) {
                continue;
            }
            if (previous == null || shift.event() != previous) {
                boundaries.add(shift.time());
            }
            previous = shift.event();
        }
        if (boundaries.size() < 2) {
            return OptionalDouble.empty();
        }

        long gcd = 0;
        for (int i = 1; i < boundaries.size(); i++) {
            long gapNanos = Math.round((boundaries.get(i) - boundaries.get(i - 1)) * NANOS_PER_SECOND);
            gcd = gcd(gcd, gapNanos);
        }
        if (gcd == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(gcd / NANOS_PER_SECOND);
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return Math.abs(a);
    }
}
