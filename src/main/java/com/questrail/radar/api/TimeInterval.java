package com.questrail.radar.api;

import java.util.Collection;

/**
 * TimeInterval
 * -----------------------------------------------------------------------------
 * A closed span of time {@code [begin, end]} in seconds during which a hardware
 * line (transmitter, receive channel, protector, ...) is on.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code begin >= 0}</li>
 *   <li>{@code end >= begin}</li>
 * </ul>
 *
 * Intervals are immutable value objects. Arithmetic helpers return new
 * instances.
 *
 * <h2>Boundary semantics</h2>
 * {@link #within(TimeInterval)} allows shared boundaries. {@link #overlaps}
 * treats intervals that only touch at one boundary as non-overlapping, so a
 * receive window may start at the very instant the transmit window ends.
 * Numerical noise is not compensated for.
 */
public record TimeInterval(double begin, double end)
{
    public TimeInterval {
        if (Double.isNaN(begin) || Double.isNaN(end)) {
            throw new IllegalArgumentException("Interval bounds must be numbers");
        }
        if (begin < 0) {
            throw new IllegalArgumentException("Interval must not begin before 0, was " + begin);
        }
        if (end < begin) {
            throw new IllegalArgumentException(
                    "Start of interval must come before end: [" + begin + ", " + end + "]");
        }
    }

    /**
     * Duration of the interval in seconds.
     */
    public double length() {
        return end - begin;
    }

    /**
     * Returns a new interval whose bounds are multiplied by {@code factor}.
     *
     * @param factor non-negative scale factor (e.g. {@code 1e-6} to convert µs to s)
     */
    public TimeInterval scale(double factor) {
        return new TimeInterval(begin * factor, end * factor);
    }

    /**
     * Returns a new interval whose bounds are divided by {@code divisor}.
     */
    public TimeInterval divide(double divisor) {
        if (divisor == 0) {
            throw new IllegalArgumentException("divisor must not be zero");
        }
        return new TimeInterval(begin / divisor, end / divisor);
    }

    /**
     * Returns {@code true} if this interval shares more than a boundary with
     * {@code other}.
     */
    public boolean overlaps(TimeInterval other) {
        if (begin <= other.end && end <= other.begin) {
            return false;
        }
        return !(other.begin <= end && other.end <= begin);
    }

    public boolean overlapsAny(Collection<TimeInterval> others) {
        for (TimeInterval other : others) {
            if (overlaps(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws OverlapException if this interval overlaps {@code other}
     */
    public void checkOverlap(TimeInterval other) {
        if (overlaps(other)) {
            throw new OverlapException(this, other);
        }
    }

    /**
     * Returns {@code true} if this interval lies inside {@code other}. Shared
     * boundaries are allowed.
     */
    public boolean within(TimeInterval other) {
        return other.begin <= begin && end <= other.end;
    }

    public boolean withinAny(Collection<TimeInterval> others) {
        for (TimeInterval other : others) {
            if (within(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if {@code time} lies inside the interval, bounds
     * included.
     */
    public boolean contains(double time) {
        return begin <= time && time <= end;
    }
}
