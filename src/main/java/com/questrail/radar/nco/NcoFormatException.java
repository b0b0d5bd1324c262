package com.questrail.radar.nco;

import java.util.Objects;

/**
 * Indicates that an NCO file could not be parsed.
 *
 * The {@link Reason} tells apart the distinct ways a file can be broken:
 * <ul>
 *   <li>No version line before the first entry</li>
 *   <li>A version line naming an unsupported version</li>
 *   <li>An entry line that is not an {@code NCO <index> <frequency>} triple</li>
 *   <li>Entry indices that do not run 0, 1, 2, ...</li>
 *   <li>A frequency that is not a number</li>
 * </ul>
 */
public final class NcoFormatException extends RuntimeException
{
    public enum Reason {
        MISSING_VERSION,
        WRONG_VERSION,
        MALFORMED_ENTRY,
        WRONG_INDEX,
        INVALID_FREQUENCY
    }

    private final Reason reason;
    private final int line;

    public NcoFormatException(Reason reason, int line, String message) {
        super("NCO file error in line " + line + ": " + message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.line = line;
    }

    public NcoFormatException(Reason reason, int line, String message, Throwable cause) {
        super("NCO file error in line " + line + ": " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.line = line;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * 1-based line of the offending text, or 0 if the file ended early.
     */
    public int line() {
        return line;
    }
}
