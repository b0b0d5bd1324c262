package com.questrail.radar.console.parser;

import java.util.Objects;

/**
 * One word of a console command.
 *
 * <p>{@code text} is the content without its delimiters. {@code line} is the
 * source line the word starts on; {@code start} and {@code end} are the
 * 1-based columns of its first and last character, delimiters included.</p>
 */
public record Word(String text, WordKind kind, int line, int start, int end)
{
    public Word {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1");
        }
    }
}
