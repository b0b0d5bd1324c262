package com.questrail.radar.console.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * ConsoleTokenizer
 * -----------------------------------------------------------------------------
 * Splits console script text into {@link ConsoleCommand}s made of
 * {@link Word}s. No substitution happens here.
 *
 * <h2>Word forms</h2>
 * <ul>
 *   <li>{@code {...}}: literal, nesting-aware, {@link WordKind#BRACED}</li>
 *   <li>{@code "..."}: {@link WordKind#QUOTED}; brackets inside may hold
 *       quotes of their own</li>
 *   <li>{@code [...]} spanning the whole word: {@link WordKind#BRACKETED}</li>
 *   <li>anything else up to the next blank: {@link WordKind#BARE}; bracket
 *       groups inside it are kept whole</li>
 * </ul>
 *
 * <h2>Separators and comments</h2>
 * Commands end at a newline or {@code ;} outside any word. A backslash
 * followed by a newline ({@code \n} or {@code \r\n}) and any blanks counts
 * as a single space, also inside braces and quotes. {@code #} starts a comment only where a command could
 * start.
 *
 * <h2>Errors</h2>
 * Unterminated braces, quotes or brackets, characters glued to a closing
 * brace or quote, and a {@code #} word in the middle of a command raise
 * {@link ConsoleException}.
 */
public final class ConsoleTokenizer
{
    private final String text;
    private final String source;
    private final int firstLine;
    private final int[] lineStarts;
    private int pos;

    private ConsoleTokenizer(String text, String source, int firstLine) {
        this.text = text;
        this.source = source;
        this.firstLine = firstLine;
        this.lineStarts = lineStarts(text);
    }

    public static List<ConsoleCommand> tokenize(String script, String source) {
        return tokenize(script, source, 1);
    }

    /**
     * @param firstLine line number of the first character of {@code script},
     *                  for scripts nested in a larger source
     */
    public static List<ConsoleCommand> tokenize(String script, String source, int firstLine) {
        return new ConsoleTokenizer(script, source, Math.max(firstLine, 1)).run();
    }

    // -------------------------------------------------------------------------
    // Scanning helpers, shared with substitution and list parsing
    // -------------------------------------------------------------------------

    /**
     * Index of the {@code ]} closing the {@code [} at {@code open}, or -1.
     */
    public static int findCloseBracket(String text, int open) {
        int depth = 0;
        boolean wordStart = true;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                wordStart = false;
                continue;
            }
            if (c == '[') {
                depth++;
                wordStart = true;
                i++;
                continue;
            }
            if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
                wordStart = false;
                i++;
                continue;
            }
            if (wordStart && c == '{') {
                int close = findCloseBrace(text, i);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
                wordStart = false;
                continue;
            }
            if (wordStart && c == '"') {
                int close = findCloseQuote(text, i);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
                wordStart = false;
                continue;
            }
            wordStart = Character.isWhitespace(c) || c == ';';
            i++;
        }
        return -1;
    }

    /**
     * Index of the {@code }} closing the {@code {} at {@code open}, or -1.
     */
    public static int findCloseBrace(String text, int open) {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Index of the {@code "} closing the quote at {@code open}, or -1.
     */
    public static int findCloseQuote(String text, int open) {
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i;
            }
            if (c == '[') {
                int close = findCloseBracket(text, i);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
                continue;
            }
            i++;
        }
        return -1;
    }

    /**
     * Length of the backslash-newline at {@code i}: 2 before {@code \n}, 3
     * before {@code \r\n}, 0 if there is none.
     */
    public static int continuationLength(String text, int i) {
        if (i + 1 >= text.length() || text.charAt(i) != '\\') {
            return 0;
        }
        char next = text.charAt(i + 1);
        if (next == '\n') {
            return 2;
        }
        if (next == '\r' && i + 2 < text.length() && text.charAt(i + 2) == '\n') {
            return 3;
        }
        return 0;
    }

    /**
     * Replaces every backslash-newline and the blanks after it with one space.
     */
    public static String collapseContinuations(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                int continuation = continuationLength(s, i);
                if (continuation > 0) {
                    sb.append(' ');
                    i += continuation;
                    while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
                        i++;
                    }
                } else {
                    sb.append(c).append(s.charAt(i + 1));
                    i += 2;
                }
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    // -------------------------------------------------------------------------
    // Command loop
    // -------------------------------------------------------------------------

    private List<ConsoleCommand> run() {
        List<ConsoleCommand> commands = new ArrayList<>();
        List<Word> words = new ArrayList<>();
        while (true) {
            skipBlanks();
            if (pos >= text.length()) {
                break;
            }
            char c = text.charAt(pos);
            if (c == '\n' || c == ';') {
                flush(words, commands);
                pos++;
                continue;
            }
            if (c == '#') {
                if (words.isEmpty()) {
                    skipComment();
                    continue;
                }
                throw error(pos, pos, "Cannot start a comment here, end the command with ';' first");
            }
            words.add(readWord());
        }
        flush(words, commands);
        return commands;
    }

    private Word readWord() {
        int begin = pos;
        char c = text.charAt(pos);
        if (c == '{') {
            int close = findCloseBrace(text, pos);
            if (close < 0) {
                throw error(begin, begin, "Missing close-brace");
            }
            pos = close + 1;
            requireWordEnd("close-brace");
            return word(collapseContinuations(text.substring(begin + 1, close)), WordKind.BRACED, begin, close);
        }
        if (c == '"') {
            int close = findCloseQuote(text, pos);
            if (close < 0) {
                throw error(begin, begin, "Missing close-quote");
            }
            pos = close + 1;
            requireWordEnd("close-quote");
            return word(collapseContinuations(text.substring(begin + 1, close)), WordKind.QUOTED, begin, close);
        }
        if (c == '[') {
            int close = findCloseBracket(text, pos);
            if (close < 0) {
                throw error(begin, begin, "Missing close-bracket");
            }
            if (isWordEnd(close + 1)) {
                pos = close + 1;
                return word(text.substring(begin + 1, close), WordKind.BRACKETED, begin, close);
            }
        }
        return readBare(begin);
    }

    private Word readBare(int begin) {
        while (!isWordEnd(pos)) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos = Math.min(pos + 2, text.length());
                continue;
            }
            if (c == '[') {
                int close = findCloseBracket(text, pos);
                if (close < 0) {
                    throw error(pos, pos, "Missing close-bracket");
                }
                pos = close + 1;
                continue;
            }
            pos++;
        }
        return word(text.substring(begin, pos), WordKind.BARE, begin, pos - 1);
    }

    private void requireWordEnd(String after) {
        if (!isWordEnd(pos)) {
            throw error(pos, pos, "Extra characters after " + after);
        }
    }

    private boolean isWordEnd(int i) {
        if (i >= text.length()) {
            return true;
        }
        char c = text.charAt(i);
        if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == ';') {
            return true;
        }
        return continuationLength(text, i) > 0;
    }

    private void skipBlanks() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (continuationLength(text, pos) > 0) {
                pos += continuationLength(text, pos);
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            int continuation = continuationLength(text, pos);
            pos += continuation > 0 ? continuation : text.charAt(pos) == '\\' ? 2 : 1;
        }
        pos = Math.min(pos, text.length());
    }

    private void flush(List<Word> words, List<ConsoleCommand> commands) {
        if (!words.isEmpty()) {
            commands.add(new ConsoleCommand(words, source));
            words.clear();
        }
    }

    // -------------------------------------------------------------------------
    // Positions
    // -------------------------------------------------------------------------

    private Word word(String content, WordKind kind, int begin, int last) {
        int line = lineOf(begin);
        int start = columnOf(begin);
        int end = lineOf(last) == line ? columnOf(last) : start + (last - begin);
        return new Word(content, kind, line, start, end);
    }

    private ConsoleException error(int offset, int lastOffset, String message) {
        int o = Math.min(offset, Math.max(text.length() - 1, 0));
        int l = Math.min(lastOffset, Math.max(text.length() - 1, 0));
        return new ConsoleException(source, lineOf(o), columnOf(o), columnOf(l), message);
    }

    private int lineIndex(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private int lineOf(int offset) {
        return lineIndex(offset) + firstLine;
    }

    private int columnOf(int offset) {
        return offset - lineStarts[lineIndex(offset)] + 1;
    }

    private static int[] lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
