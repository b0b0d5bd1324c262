package com.questrail.radar.experiment;

import com.questrail.radar.api.OverlapException;
import com.questrail.radar.api.TimeInterval;

/**
 * RangeCalculator
 * -----------------------------------------------------------------------------
 * Converts transmit/receive timing into target range.
 *
 * <h2>Ranges</h2>
 * <ul>
 *   <li>Nearest range: the closest target whose echo of the whole transmit
 *       pulse starts arriving while the receiver samples,
 *       {@code v·(rx.begin − tx.end + baud)/2}.</li>
 *   <li>Furthest full range: the furthest target whose complete echo is
 *       still sampled, {@code v·(rx.end − tx.end)/2}.</li>
 * </ul>
 * Both fail with {@link OverlapException} when transmission and reception
 * overlap. Times are seconds, ranges are metres.
 */
public final class RangeCalculator
{
    /**
     * Speed of light in vacuum, m/s.
     */
    public static final double C = 299_792_458.0;

    private RangeCalculator() {
    }

    public static double nearestRange(TimeInterval transmit, TimeInterval receive, double baud) {
        return nearestRange(transmit, receive, baud, C);
    }

    public static double nearestRange(TimeInterval transmit, TimeInterval receive, double baud, double velocity) {
        transmit.checkOverlap(receive);
        return velocity * (receive.begin() - transmit.end() + baud) / 2;
    }

    public static double furthestFullRange(TimeInterval transmit, TimeInterval receive) {
        return furthestFullRange(transmit, receive, C);
    }

    public static double furthestFullRange(TimeInterval transmit, TimeInterval receive, double velocity) {
        transmit.checkOverlap(receive);
        return velocity * (receive.end() - transmit.end()) / 2;
    }
}
