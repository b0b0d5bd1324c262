package com.questrail.radar.console.parser;

import java.util.List;
import java.util.Objects;

/**
 * A non-empty sequence of words forming one console command, together with
 * the name of the source it was read from.
 */
public record ConsoleCommand(List<Word> words, String source)
{
    public ConsoleCommand {
        Objects.requireNonNull(source, "source");
        words = List.copyOf(Objects.requireNonNull(words, "words"));
        if (words.isEmpty()) {
            throw new IllegalArgumentException("A command needs at least one word");
        }
    }

    public Word word(int index) {
        return words.get(index);
    }

    public int size() {
        return words.size();
    }

    public int line() {
        return words.get(0).line();
    }

    public int start() {
        return words.get(0).start();
    }

    public int end() {
        return words.get(words.size() - 1).end();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Word w : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            switch (w.kind()) {
                case QUOTED -> sb.append('"').append(w.text()).append('"');
                case BRACED -> sb.append('{').append(w.text()).append('}');
                case BRACKETED -> sb.append('[').append(w.text()).append(']');
                default -> sb.append(w.text());
            }
        }
        return sb.toString();
    }
}
