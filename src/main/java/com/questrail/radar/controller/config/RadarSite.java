package com.questrail.radar.controller.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * RadarSite
 * -----------------------------------------------------------------------------
 * The radar sites a console script may run at, with the local oscillator
 * defaults of each site's receiver.
 *
 * <h2>Receiver paths</h2>
 * A receiver has one entry per path in each oscillator list. Operators name
 * paths with site-specific aliases ({@code ion}/{@code pla} at UHF,
 * {@code I}/{@code II} at VHF, antenna names at ESR); {@link #pathNumber}
 * maps an alias to the 1-based path number.
 *
 * <h2>Remote receivers</h2>
 * {@link #KIR} and {@link #SOD} are UHF receive-only sites and share the UHF
 * receiver layout.
 */
public enum RadarSite
{
    UHF(List.of(812.0), List.of(128.0, 122.0), 2, uhfPaths()),
    VHF(List.of(298.0, 298.0), List.of(84.0, 84.0), 0, Map.of(
            "I", 1, "A", 1,
            "II", 2, "B", 2)),
    ESR(List.of(419.0, 435.0, 419.0, 435.0), List.of(81.25, 81.25, 81.25, 81.25), 1, esrPaths()),
    KIR(List.of(812.0), List.of(128.0, 122.0), 2, uhfPaths()),
    SOD(List.of(812.0), List.of(128.0, 122.0), 2, uhfPaths());

    private final List<Double> lo1;
    private final List<Double> lo2;
    private final int defaultOscillator;
    private final Map<String, Integer> paths;

    RadarSite(List<Double> lo1, List<Double> lo2, int defaultOscillator, Map<String, Integer> paths) {
        this.lo1 = lo1;
        this.lo2 = lo2;
        this.defaultOscillator = defaultOscillator;
        this.paths = paths;
    }

    /**
     * Default first local oscillator frequencies per path, MHz.
     */
    public List<Double> lo1Defaults() {
        return lo1;
    }

    /**
     * Default second local oscillator frequencies per path, MHz.
     */
    public List<Double> lo2Defaults() {
        return lo2;
    }

    /**
     * Oscillator (1 or 2) that {@code selectlo} changes when the script does
     * not name one. Empty at sites where it must be named.
     */
    public OptionalInt defaultOscillator() {
        return defaultOscillator == 0 ? OptionalInt.empty() : OptionalInt.of(defaultOscillator);
    }

    /**
     * 1-based receiver path for an operator alias, e.g. {@code "pla"} → 2 at UHF.
     */
    public Optional<Integer> pathNumber(String alias) {
        return Optional.ofNullable(paths.get(alias));
    }

    /**
     * Case-insensitive lookup by name.
     *
     * @throws IllegalArgumentException if no site has that name
     */
    public static RadarSite of(String name) {
        for (RadarSite site : values()) {
            if (site.name().equalsIgnoreCase(name)) {
                return site;
            }
        }
        throw new IllegalArgumentException("Unknown radar site '" + name + "'");
    }

    private static Map<String, Integer> uhfPaths() {
        return Map.of(
                "i", 1, "ion", 1, "1", 1,
                "p", 2, "pla", 2, "2", 2);
    }

    private static Map<String, Integer> esrPaths() {
        return Map.ofEntries(
                Map.entry("P1", 1), Map.entry("U32", 1), Map.entry("32U", 1), Map.entry("U32m", 1), Map.entry("U", 1),
                Map.entry("P2", 2), Map.entry("D32", 2), Map.entry("32D", 2), Map.entry("D32m", 2), Map.entry("D", 2),
                Map.entry("P3", 3), Map.entry("U42", 3), Map.entry("42U", 3), Map.entry("U42m", 3),
                Map.entry("P4", 4), Map.entry("D42", 4), Map.entry("42D", 4), Map.entry("D42m", 4));
    }
}
