package com.questrail.radar.controller.observability;

import java.util.Objects;

/**
 * Record representing a recoverable anomaly found while replaying a
 * controller program. Replay continues after such an event.
 */
public record ControllerWarningEvent(
    Kind kind,
    int line,
    String mnemonic,
    String message
) {
    public enum Kind {
        /** Mnemonic not modelled by the interpreter; skipped. */
        UNKNOWN_MNEMONIC,
        /** {@code STFIR} after the filters were already started; ignored. */
        REDUNDANT_STFIR,
        /** {@code SETTCR 0} somewhere other than first or right before {@code REP}. */
        MISPLACED_SETTCR_ZERO
    }

    public ControllerWarningEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(mnemonic, "mnemonic");
        Objects.requireNonNull(message, "message");
    }
}
