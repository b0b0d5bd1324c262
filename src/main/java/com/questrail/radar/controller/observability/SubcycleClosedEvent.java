package com.questrail.radar.controller.observability;

import com.questrail.radar.api.TimeInterval;

import java.util.Objects;

/**
 * Record emitted each time a subcycle is closed and its streams are
 * snapshotted.
 */
public record SubcycleClosedEvent(
    int index,
    TimeInterval interval,
    int line
) {
    public SubcycleClosedEvent {
        Objects.requireNonNull(interval, "interval");
    }
}
