package com.questrail.radar.console.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion between console list strings and Java lists.
 *
 * <p>A list is a string of whitespace-separated elements; an element holding
 * blanks or special characters is wrapped in braces, or backslash-escaped when
 * its braces are unbalanced.</p>
 */
public final class TclLists
{
    private static final String SPECIAL = "{}[]$;\"\\";

    private TclLists() {
    }

    /**
     * @throws IllegalArgumentException on an unmatched brace or quote, or an
     *         element glued to the brace or quote closing its predecessor
     */
    public static List<String> split(String list) {
        List<String> elements = new ArrayList<>();
        int i = 0;
        int n = list.length();
        while (true) {
            while (i < n && Character.isWhitespace(list.charAt(i))) {
                i++;
            }
            if (i >= n) {
                return elements;
            }
            char c = list.charAt(i);
            if (c == '{') {
                int close = ConsoleTokenizer.findCloseBrace(list, i);
                if (close < 0) {
                    throw new IllegalArgumentException("unmatched open brace in list");
                }
                elements.add(list.substring(i + 1, close));
                i = close + 1;
                requireSpace(list, i, "braces");
            } else if (c == '"') {
                int close = i + 1;
                while (close < n && list.charAt(close) != '"') {
                    close += list.charAt(close) == '\\' ? 2 : 1;
                }
                if (close >= n) {
                    throw new IllegalArgumentException("unmatched open quote in list");
                }
                elements.add(unescape(list.substring(i + 1, close)));
                i = close + 1;
                requireSpace(list, i, "quotes");
            } else {
                int begin = i;
                while (i < n && !Character.isWhitespace(list.charAt(i))) {
                    i += list.charAt(i) == '\\' ? 2 : 1;
                }
                i = Math.min(i, n);
                elements.add(unescape(list.substring(begin, i)));
            }
        }
    }

    public static String format(List<String> elements) {
        StringBuilder sb = new StringBuilder();
        for (String e : elements) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(formatElement(e));
        }
        return sb.toString();
    }

    static String formatElement(String e) {
        if (e.isEmpty()) {
            return "{}";
        }
        if (!needsQuoting(e)) {
            return e;
        }
        if (bracesBalanced(e) && !e.endsWith("\\")) {
            return "{" + e + "}";
        }
        StringBuilder sb = new StringBuilder(e.length() + 8);
        for (int i = 0; i < e.length(); i++) {
            char c = e.charAt(i);
            if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\t') {
                sb.append("\\t");
            } else {
                if (c == ' ' || SPECIAL.indexOf(c) >= 0) {
                    sb.append('\\');
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean needsQuoting(String e) {
        if (e.charAt(0) == '#') {
            return true;
        }
        for (int i = 0; i < e.length(); i++) {
            char c = e.charAt(i);
            if (Character.isWhitespace(c) || SPECIAL.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean bracesBalanced(String e) {
        int depth = 0;
        for (int i = 0; i < e.length(); i++) {
            char c = e.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }

    private static void requireSpace(String list, int i, String delimiter) {
        if (i < list.length() && !Character.isWhitespace(list.charAt(i))) {
            throw new IllegalArgumentException("list element in " + delimiter
                    + " followed by \"" + list.charAt(i) + "\" instead of space");
        }
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
