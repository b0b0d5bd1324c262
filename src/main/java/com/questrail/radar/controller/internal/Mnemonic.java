package com.questrail.radar.controller.internal;

import java.util.Objects;

/**
 * A controller mnemonic known to the interpreter.
 *
 * @param name        mnemonic as written in programs, e.g. {@code "RFON"}
 * @param description one-line description of what the hardware does
 * @param handler     effect on the replay state
 */
public record Mnemonic(String name, String description, MnemonicHandler handler)
{
    public Mnemonic {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(handler, "handler");
    }
}
