package com.questrail.radar.nco;

import java.util.Objects;

/**
 * Nco
 * -----------------------------------------------------------------------------
 * Frequency bookkeeping for one receive channel.
 *
 * The signal reaching a channel has been mixed down by two local oscillators
 * before the channel's numerically controlled oscillator shifts it once more.
 * The sky frequency observed by the channel is therefore
 * <pre>
 *   f = lo1 + lo2 - f_nco
 * </pre>
 * All frequencies are in MHz.
 *
 * The frequency is only defined once both oscillators are set, a table has
 * been loaded and an entry has been selected; see {@link #isReady()}.
 */
public final class Nco
{
    private Double lo1;
    private Double lo2;
    private NcoTable table;
    private Integer selected;

    public Nco() {
    }

    public Nco(double lo1, double lo2, NcoTable table) {
        this.lo1 = lo1;
        this.lo2 = lo2;
        this.table = Objects.requireNonNull(table, "table");
    }

    public void setLo1(double lo1) {
        this.lo1 = lo1;
    }

    public void setLo2(double lo2) {
        this.lo2 = lo2;
    }

    public void load(NcoTable table) {
        this.table = Objects.requireNonNull(table, "table");
        this.selected = null;
    }

    public boolean hasTable() {
        return table != null;
    }

    /**
     * Selects the table entry at {@code address}.
     *
     * @throws IllegalStateException    if no table is loaded
     * @throws IllegalArgumentException if the address is not in the table
     */
    public void select(int address) {
        if (table == null) {
            throw new IllegalStateException("No NCO table loaded");
        }
        table.frequency(address);
        this.selected = address;
    }

    public boolean isReady() {
        return lo1 != null && lo2 != null && table != null && selected != null;
    }

    /**
     * Center frequency in MHz.
     *
     * @throws IllegalStateException if the oscillator is not ready
     */
    public double frequency() {
        if (!isReady()) {
            throw new IllegalStateException("NCO frequency requested before "
                    + (table == null ? "a table was loaded" : selected == null ? "an entry was selected" : "both LOs were set"));
        }
        return lo1 + lo2 - table.frequency(selected);
    }

    @Override
    public String toString() {
        return "Nco{lo1=" + lo1 + ", lo2=" + lo2 + ", selected=" + selected + ", table=" + table + "}";
    }
}
