package com.questrail.radar.experiment;

import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.api.TimedEvent;
import com.questrail.radar.controller.config.ReceiverConfig;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.Phase;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

final class TextSubcycleRendererTest
{
    private static final double US = 1e-6;

    private static TimeInterval us(double begin, double end) {
        return new TimeInterval(begin * US, end * US);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void listsEveryLineOfTheSubcycle() {
        FrequencySeries f = new FrequencySeries();
        f.record(0, 1e8);
        Subcycle subcycle = new Subcycle(0, us(0, 5580),
                List.of(us(82, 722)),
                Map.of(1, List.of(us(1037, 5357))),
                Map.of("+", List.of(us(82, 102))),
                List.of(new TimedEvent<>(82 * US, Phase.DEG_0), new TimedEvent<>(102 * US, Phase.DEG_180)),
                Map.of(1, f),
                OptionalDouble.of(20 * US));

        assertEquals(lines(
                "Subcycle 1: 0.0-5580.0 us, baud 20.0 us",
                "  RF    82.0-722.0",
                "  CH1   1037.0-5357.0  range 50.2-694.8 km",
                "  +     82.0-102.0",
                "  phase 82.0:0 102.0:180",
                "  f CH1 0.0:1.0E8"), new TextSubcycleRenderer().render(subcycle));
    }

    @Test
    void receptionWithoutEarlierTransmissionHasNoRange() {
        Subcycle subcycle = new Subcycle(1, us(0, 1000),
                List.of(us(600, 700)),
                Map.of(2, List.of(us(100, 500))),
                Map.of(), List.of(), Map.of(), OptionalDouble.empty());

        assertEquals(lines(
                "Subcycle 2: 0.0-1000.0 us",
                "  RF    600.0-700.0",
                "  CH2   100.0-500.0"), new TextSubcycleRenderer().render(subcycle));
    }

    @Test
    void rendersTheBeataProgram() throws URISyntaxException {
        Path program = Path.of(getClass().getResource("/experiments/beata/beata.tlan").toURI());
        List<String> text = Experiment.fromControllerProgram(program, ReceiverConfig.defaults())
                .render(new TextSubcycleRenderer());

        assertEquals(2, text.size());
        assertTrue(text.get(0).startsWith("Subcycle 1: 0.0-2000.0 us, baud 20.0 us\n"), text.get(0));
        assertTrue(text.get(0).contains("  CH1   400.0-1000.0  range 38.7-125.6 km\n"), text.get(0));
        assertTrue(text.get(0).contains("  phase 82.0:0 102.0:180 122.0:0 142.0:180 162.0:0\n"), text.get(0));
        assertTrue(text.get(1).contains("  CH1   2400.0-3000.0  range 35.7-125.6 km\n"), text.get(1));
    }
}
