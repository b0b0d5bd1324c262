package com.questrail.radar.api;

import java.util.Objects;

/**
 * An event that happens at a point in time, e.g. a phase shift to 180°.
 *
 * @param time  time of the event in seconds
 * @param event payload of the event (must not be {@code null})
 */
public record TimedEvent<E>(double time, E event) implements Comparable<TimedEvent<E>>
{
    public TimedEvent {
        Objects.requireNonNull(event, "event");
    }

    /**
     * Orders by time only; events at the same time compare equal.
     */
    @Override
    public int compareTo(TimedEvent<E> other) {
        return Double.compare(time, other.time);
    }
}
