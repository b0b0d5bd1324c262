package com.questrail.radar.controller.model;

import java.util.Objects;

/**
 * One mnemonic of a controller program, with the time it is issued at.
 *
 * <p>{@code time} is the literal time of the statement in seconds, relative to
 * the time control register. A statement such as {@code AT 40 RFON,PHA0}
 * yields two commands that share time and line.</p>
 *
 * <p>Commands compare by time only. Sorting is stable, so commands issued at
 * the same time keep file order.</p>
 *
 * @param time     statement time in seconds
 * @param mnemonic controller mnemonic, e.g. {@code "RFON"} or {@code "SETTCR"}
 * @param line     1-based source line, or 0 if unknown
 */
public record ControllerCommand(double time, String mnemonic, int line) implements Comparable<ControllerCommand>
{
    public static final String SETTCR = "SETTCR";
    public static final String REP = "REP";

    public ControllerCommand {
        Objects.requireNonNull(mnemonic, "mnemonic");
        if (mnemonic.isEmpty()) {
            throw new IllegalArgumentException("mnemonic must not be empty");
        }
    }

    public boolean isSetTcr() {
        return SETTCR.equals(mnemonic);
    }

    public boolean isRep() {
        return REP.equals(mnemonic);
    }

    @Override
    public int compareTo(ControllerCommand other) {
        return Double.compare(time, other.time);
    }

    @Override
    public String toString() {
        return line + ": " + (time * 1e6) + " " + mnemonic;
    }
}
