package com.questrail.radar.experiment;

import com.questrail.radar.api.OverlapException;
import com.questrail.radar.api.TimeInterval;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RangeCalculatorTest
{
    private static final double US = 1e-6;

    private static final TimeInterval TX = new TimeInterval(0, 100 * US);
    private static final TimeInterval RX = new TimeInterval(400 * US, 1000 * US);

    @Test
    void nearestRangeIncludesOneBaud() {
        assertEquals(RangeCalculator.C * 310 * US / 2, RangeCalculator.nearestRange(TX, RX, 10 * US), 1e-6);
        assertEquals(RangeCalculator.C * 300 * US / 2, RangeCalculator.nearestRange(TX, RX, 0), 1e-6);
    }

    @Test
    void furthestFullRangeRunsToTheEndOfSampling() {
        assertEquals(RangeCalculator.C * 900 * US / 2, RangeCalculator.furthestFullRange(TX, RX), 1e-6);
    }

    @Test
    void velocityCanBeGiven() {
        assertEquals(300 * US, RangeCalculator.nearestRange(TX, RX, 0, 2), 1e-15);
        assertEquals(900 * US, RangeCalculator.furthestFullRange(TX, RX, 2), 1e-15);
    }

    @Test
    void receptionRightAfterTransmissionIsAllowed() {
        TimeInterval rx = new TimeInterval(100 * US, 200 * US);
        assertEquals(0, RangeCalculator.nearestRange(TX, rx, 0), 1e-9);
    }

    @Test
    void overlappingIntervalsFail() {
        TimeInterval rx = new TimeInterval(50 * US, 200 * US);
        assertThrows(OverlapException.class, () -> RangeCalculator.nearestRange(TX, rx, 0));
        assertThrows(OverlapException.class, () -> RangeCalculator.furthestFullRange(TX, rx));
    }
}
