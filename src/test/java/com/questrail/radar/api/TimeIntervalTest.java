package com.questrail.radar.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeIntervalTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link TimeInterval}: construction invariants, arithmetic
 * helpers and the boundary semantics of overlap and containment.
 */
final class TimeIntervalTest
{
    private final TimeInterval a = new TimeInterval(1, 2);
    private final TimeInterval b = new TimeInterval(0, 4);
    private final TimeInterval c = new TimeInterval(2, 4);
    private final TimeInterval empty = new TimeInterval(0, 0);

    // -------------------------------------------------------------------------
    // Construction
    // -------------------------------------------------------------------------

    @Test
    void lengthIsEndMinusBegin() {
        assertEquals(1.0, a.length());
        assertEquals(4.0, b.length());
        assertEquals(0.0, empty.length());
        assertEquals(2.5e-6, new TimeInterval(40e-6, 42.5e-6).length(), 1e-15);
    }

    @Test
    void endBeforeBeginIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TimeInterval(1, 0));
    }

    @Test
    void negativeBeginIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TimeInterval(-1, 0));
    }

    @Test
    void nanIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TimeInterval(Double.NaN, 1));
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    @Test
    void scaleMultipliesBothBounds() {
        assertEquals(c, a.scale(2));
        assertEquals(empty, a.scale(0));
        assertEquals(empty, empty.scale(20));
    }

    @Test
    void divideByZeroIsRejected() {
        assertEquals(new TimeInterval(0.5, 1), a.divide(2));
        assertThrows(IllegalArgumentException.class, () -> a.divide(0));
    }

    // -------------------------------------------------------------------------
    // Overlap and containment
    // -------------------------------------------------------------------------

    /** Touching at a single boundary is not an overlap. */
    @Test
    void overlapIgnoresSharedBoundary() {
        assertTrue(a.overlaps(b));
        assertFalse(a.overlaps(c));
        assertFalse(a.overlaps(empty));

        assertTrue(b.overlaps(a));
        assertTrue(b.overlaps(c));
        assertFalse(b.overlaps(empty));

        assertFalse(c.overlaps(a));
        assertTrue(c.overlaps(b));
        assertFalse(c.overlaps(empty));
    }

    @Test
    void checkOverlapThrowsWithBothIntervals() {
        OverlapException e = assertThrows(OverlapException.class, () -> a.checkOverlap(b));
        assertEquals(a, e.first());
        assertEquals(b, e.second());

        assertDoesNotThrow(() -> a.checkOverlap(c));
        assertDoesNotThrow(() -> a.checkOverlap(empty));
    }

    @Test
    void overlapsAnyChecksEveryCandidate() {
        assertTrue(a.overlapsAny(List.of(c, empty, b)));
        assertFalse(a.overlapsAny(List.of(c, empty)));
        assertFalse(a.overlapsAny(List.of()));
    }

    @Test
    void withinAllowsSharedBoundaries() {
        assertTrue(a.within(b));
        assertTrue(c.within(b));
        assertTrue(b.within(b));
        assertFalse(b.within(a));
        assertTrue(c.withinAny(List.of(a, b)));
        assertFalse(b.withinAny(List.of(a, c)));
    }

    @Test
    void containsIncludesBounds() {
        assertTrue(a.contains(1));
        assertTrue(a.contains(2));
        assertTrue(a.contains(1.5));
        assertFalse(a.contains(2.0001));
    }
}
