package com.questrail.radar.console.eros;

import com.questrail.radar.console.interp.DomainState;
import com.questrail.radar.controller.config.RadarSite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * ExperimentState
 * -----------------------------------------------------------------------------
 * What the operator commands of a console script have set up so far.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the last compiled controller programs, filter and correlator file
 *       loaded ({@link LoadedFile})</li>
 *   <li>the NCO file bound to each receive channel</li>
 *   <li>first and second local oscillator frequency per receiver path, MHz,
 *       starting from the {@link RadarSite} defaults</li>
 * </ul>
 *
 * <h2>Merging</h2>
 * Every write is stamped from a clock shared by all copies of one root state.
 * {@link #mergeFrom} keeps, per value, whichever side wrote it last, so
 * folding callee states into a caller reproduces the order the script ran
 * in.
 */
public final class ExperimentState implements DomainState
{
    public enum LoadedFile {
        /** Compiled receiver controller program. */
        RBIN,
        /** Compiled transmitter controller program. */
        TBIN,
        FILTER,
        CORRELATOR
    }

    public static final int CHANNELS = 6;

    private record Stamped(Object value, long stamp) {
    }

    private static final class Clock {
        private long now;

        long tick() {
            return ++now;
        }
    }

    private final RadarSite site;
    private final String antenna;
    private final Clock clock;
    private final Map<String, Stamped> values;

    public ExperimentState(RadarSite site) {
        this(site, site.name());
    }

    public ExperimentState(RadarSite site, String antenna) {
        this.site = Objects.requireNonNull(site, "site");
        this.antenna = Objects.requireNonNull(antenna, "antenna");
        this.clock = new Clock();
        this.values = new HashMap<>();
        seed(1, site.lo1Defaults());
        seed(2, site.lo2Defaults());
    }

    private ExperimentState(ExperimentState other) {
        this.site = other.site;
        this.antenna = other.antenna;
        this.clock = other.clock;
        this.values = new HashMap<>(other.values);
    }

    public RadarSite site() {
        return site;
    }

    public String antenna() {
        return antenna;
    }

    // -------------------------------------------------------------------------
    // Loaded files
    // -------------------------------------------------------------------------

    public Optional<String> loadedFile(LoadedFile kind) {
        return Optional.ofNullable((String) value(fileKey(kind)));
    }

    public void setLoadedFile(LoadedFile kind, String file) {
        write(fileKey(kind), Objects.requireNonNull(file, "file"));
    }

    public Optional<String> ncoFile(int channel) {
        return Optional.ofNullable((String) value(ncoKey(channel)));
    }

    public void setNcoFile(int channel, String file) {
        write(ncoKey(channel), Objects.requireNonNull(file, "file"));
    }

    /**
     * NCO file per channel, for the channels that have one.
     */
    public Map<Integer, String> ncoFiles() {
        Map<Integer, String> files = new TreeMap<>();
        for (int ch = 1; ch <= CHANNELS; ch++) {
            int channel = ch;
            ncoFile(ch).ifPresent(f -> files.put(channel, f));
        }
        return Collections.unmodifiableMap(files);
    }

    // -------------------------------------------------------------------------
    // Local oscillators
    // -------------------------------------------------------------------------

    /**
     * Frequencies of oscillator 1 or 2 per receiver path, MHz.
     */
    public List<Double> lo(int oscillator) {
        int paths = defaults(oscillator).size();
        List<Double> frequencies = new ArrayList<>(paths);
        for (int path = 1; path <= paths; path++) {
            frequencies.add((Double) value(loKey(oscillator, path)));
        }
        return Collections.unmodifiableList(frequencies);
    }

    public void setLo(int oscillator, int path, double frequencyMHz) {
        int paths = defaults(oscillator).size();
        if (path < 1 || path > paths) {
            throw new IllegalArgumentException("Local oscillator LO" + oscillator + " at " + site
                    + " has no path " + path + " (paths 1.." + paths + ")");
        }
        write(loKey(oscillator, path), frequencyMHz);
    }

    // -------------------------------------------------------------------------
    // DomainState
    // -------------------------------------------------------------------------

    @Override
    public ExperimentState copy() {
        return new ExperimentState(this);
    }

    @Override
    public void mergeFrom(DomainState callee) {
        if (!(callee instanceof ExperimentState other)) {
            throw new IllegalArgumentException("Cannot merge " + callee.getClass().getSimpleName()
                    + " into an ExperimentState");
        }
        for (Map.Entry<String, Stamped> e : other.values.entrySet()) {
            Stamped mine = values.get(e.getKey());
            if (mine == null || e.getValue().stamp() > mine.stamp()) {
                values.put(e.getKey(), e.getValue());
            }
        }
    }

    @Override
    public String toString() {
        return "ExperimentState{" + site + ", values=" + new TreeMap<>(values) + "}";
    }

    private Object value(String key) {
        Stamped s = values.get(key);
        return s == null ? null : s.value();
    }

    private void write(String key, Object value) {
        values.put(key, new Stamped(value, clock.tick()));
    }

    private void seed(int oscillator, List<Double> frequencies) {
        for (int path = 1; path <= frequencies.size(); path++) {
            values.put(loKey(oscillator, path), new Stamped(frequencies.get(path - 1), 0));
        }
    }

    private List<Double> defaults(int oscillator) {
        return switch (oscillator) {
            case 1 -> site.lo1Defaults();
            case 2 -> site.lo2Defaults();
            default -> throw new IllegalArgumentException("There is no local oscillator LO" + oscillator);
        };
    }

    private static String fileKey(LoadedFile kind) {
        return "file." + kind.name();
    }

    private static String ncoKey(int channel) {
        if (channel < 1 || channel > CHANNELS) {
            throw new IllegalArgumentException("Receive channels are numbered 1.." + CHANNELS + ", not " + channel);
        }
        return "nco." + channel;
    }

    private static String loKey(int oscillator, int path) {
        return "lo" + oscillator + "." + path;
    }
}
