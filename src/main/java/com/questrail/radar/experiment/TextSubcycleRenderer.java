package com.questrail.radar.experiment;

import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.api.TimedEvent;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.Phase;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plain-text listing of a subcycle, in microseconds and kilometres.
 *
 * <pre>
 * Subcycle 1: 0.0-5580.0 us, baud 20.0 us
 *   RF    82.0-722.0
 *   CH1   1037.0-5357.0  range 50.2-694.8 km
 *   +     82.0-102.0
 *   phase 82.0:0 102.0:180
 *   f CH1 82.0:1.0E8
 * </pre>
 *
 * A receive interval is paired with the last transmission that ends before
 * it; ranges are left out when there is none.
 */
public final class TextSubcycleRenderer implements SubcycleRenderer<String>
{
    private static final double MICROS = 1e6;
    private static final double KILOMETRES = 1e-3;

    @Override
    public String render(Subcycle subcycle) {
        StringBuilder sb = new StringBuilder();
        sb.append("Subcycle ").append(subcycle.number()).append(": ")
                .append(micros(subcycle.interval())).append(" us");
        subcycle.baudLength().ifPresent(b -> sb.append(", baud ").append(micros(b)).append(" us"));
        sb.append('\n');

        for (TimeInterval tx : subcycle.transmit()) {
            row(sb, "RF", micros(tx));
        }
        for (Map.Entry<Integer, List<TimeInterval>> e : subcycle.receive().entrySet()) {
            for (TimeInterval rx : e.getValue()) {
                String text = micros(rx);
                Optional<TimeInterval> tx = lastTransmitBefore(subcycle.transmit(), rx);
                if (tx.isPresent()) {
                    double baud = subcycle.baudLength().orElse(0);
                    text += String.format(Locale.ROOT, "  range %.1f-%.1f km",
                            RangeCalculator.nearestRange(tx.get(), rx, baud) * KILOMETRES,
                            RangeCalculator.furthestFullRange(tx.get(), rx) * KILOMETRES);
                }
                row(sb, "CH" + e.getKey(), text);
            }
        }
        for (Map.Entry<String, List<TimeInterval>> e : subcycle.settings().entrySet()) {
            for (TimeInterval interval : e.getValue()) {
                row(sb, e.getKey(), micros(interval));
            }
        }
        if (!subcycle.phaseShifts().isEmpty()) {
            StringBuilder phases = new StringBuilder();
            for (TimedEvent<Phase> shift : subcycle.phaseShifts()) {
                if (phases.length() > 0) {
                    phases.append(' ');
                }
                phases.append(micros(shift.time())).append(':').append(shift.event().degrees());
            }
            row(sb, "phase", phases.toString());
        }
        for (Map.Entry<Integer, FrequencySeries> e : subcycle.frequencies().entrySet()) {
            StringBuilder steps = new StringBuilder();
            for (Map.Entry<Double, Double> step : e.getValue().entries().entrySet()) {
                if (steps.length() > 0) {
                    steps.append(' ');
                }
                steps.append(micros(step.getKey())).append(':').append(step.getValue());
            }
            row(sb, "f CH" + e.getKey(), steps.toString());
        }
        return sb.toString();
    }

    private static Optional<TimeInterval> lastTransmitBefore(List<TimeInterval> transmit, TimeInterval rx) {
        TimeInterval last = null;
        for (TimeInterval tx : transmit) {
            if (tx.end() <= rx.begin() && (last == null || tx.end() > last.end())) {
                last = tx;
            }
        }
        return Optional.ofNullable(last);
    }

    private static void row(StringBuilder sb, String label, String text) {
        sb.append(String.format(Locale.ROOT, "  %-5s %s\n", label, text));
    }

    private static String micros(TimeInterval interval) {
        return micros(interval.begin()) + "-" + micros(interval.end());
    }

    private static String micros(double seconds) {
        return Double.toString(Math.round(seconds * MICROS * 1000) / 1000.0);
    }
}
