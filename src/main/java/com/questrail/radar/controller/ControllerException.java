package com.questrail.radar.controller;

/**
 * Indicates that a controller program is structurally invalid and cannot be
 * replayed.
 *
 * This typically reflects:
 * <ul>
 *   <li>A line that is neither an {@code AT} nor a {@code SETTCR} statement</li>
 *   <li>A hardware line switched on twice, or off twice</li>
 *   <li>A line still on when its subcycle or cycle ends</li>
 *   <li>A program that does not end with {@code REP}</li>
 * </ul>
 *
 * The offending source line is part of the message and available through
 * {@link #line()}; it is 0 when no single line is to blame.
 */
public final class ControllerException extends RuntimeException
{
    private final int line;

    public ControllerException(int line, String message) {
        super(format(line, message));
        this.line = line;
    }

    public ControllerException(int line, String message, Throwable cause) {
        super(format(line, message), cause);
        this.line = line;
    }

    public int line() {
        return line;
    }

    private static String format(int line, String message) {
        if (line > 0) {
            return "Controller program error in line " + line + ": " + message;
        }
        return "Controller program error: " + message;
    }
}
