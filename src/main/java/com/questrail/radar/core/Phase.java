package com.questrail.radar.core;

/**
 * The two settings of the transmitter phase shifter.
 */
public enum Phase
{
    DEG_0(0),
    DEG_180(180);

    private final int degrees;

    Phase(int degrees) {
        this.degrees = degrees;
    }

    public int degrees() {
        return degrees;
    }

    public Phase opposite() {
        return this == DEG_0 ? DEG_180 : DEG_0;
    }
}
