package com.questrail.radar.controller.config;

import com.questrail.radar.nco.NcoTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Receiver configuration a controller program is replayed against.
 *
 * @param lo1       first local oscillator frequency per receiver path, MHz
 * @param lo2       second local oscillator frequency per receiver path, MHz
 * @param ncoTables NCO table loaded into each receive channel (1..6); channels
 *                  without a table record no frequencies
 */
public record ReceiverConfig(
    List<Double> lo1,
    List<Double> lo2,
    Map<Integer, NcoTable> ncoTables
) {
    public ReceiverConfig {
        lo1 = List.copyOf(Objects.requireNonNull(lo1, "lo1"));
        lo2 = List.copyOf(Objects.requireNonNull(lo2, "lo2"));
        Objects.requireNonNull(ncoTables, "ncoTables");
        if (lo1.isEmpty() || lo2.isEmpty()) {
            throw new IllegalArgumentException("Both local oscillators need at least one path");
        }
        for (Integer channel : ncoTables.keySet()) {
            if (channel == null || channel < 1 || channel > 6) {
                throw new IllegalArgumentException("Receive channels are numbered 1..6, not " + channel);
            }
        }
        ncoTables = Collections.unmodifiableMap(new TreeMap<>(ncoTables));
    }

    /**
     * UHF oscillators, no NCO tables.
     */
    public static ReceiverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Double> lo1 = RadarSite.UHF.lo1Defaults();
        private List<Double> lo2 = RadarSite.UHF.lo2Defaults();
        private final Map<Integer, NcoTable> ncoTables = new TreeMap<>();

        /**
         * Takes the oscillator defaults of {@code site}.
         */
        public Builder withSite(RadarSite site) {
            Objects.requireNonNull(site, "site");
            this.lo1 = site.lo1Defaults();
            this.lo2 = site.lo2Defaults();
            return this;
        }

        public Builder withLo1(List<Double> lo1MHz) {
            this.lo1 = new ArrayList<>(lo1MHz);
            return this;
        }

        public Builder withLo2(List<Double> lo2MHz) {
            this.lo2 = new ArrayList<>(lo2MHz);
            return this;
        }

        public Builder withNcoTable(int channel, NcoTable table) {
            this.ncoTables.put(channel, Objects.requireNonNull(table, "table"));
            return this;
        }

        public ReceiverConfig build() {
            return new ReceiverConfig(lo1, lo2, ncoTables);
        }
    }
}
