package com.questrail.radar.api;

/**
 * Raised when a transmit interval and a receive interval overlap, i.e. the
 * radar would be transmitting while receiving.
 */
public final class OverlapException extends RuntimeException
{
    private final TimeInterval first;
    private final TimeInterval second;

    public OverlapException(TimeInterval first, TimeInterval second) {
        super("The radar transmits while receiving! " + first + " overlaps " + second);
        this.first = first;
        this.second = second;
    }

    public TimeInterval first() {
        return first;
    }

    public TimeInterval second() {
        return second;
    }
}
