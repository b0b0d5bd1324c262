package com.questrail.radar.console.interp;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Conversions between console strings and numbers or booleans.
 */
final class TclValues
{
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern HEX = Pattern.compile("[+-]?0[xX][0-9a-fA-F]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private TclValues() {
    }

    /**
     * Parses {@code text} as a {@link Long} or {@link Double}; null when it
     * is not a number.
     */
    static Number parseNumber(String text) {
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(t).matches()) {
            try {
                return Long.parseLong(t.startsWith("+") ? t.substring(1) : t);
            } catch (NumberFormatException e) {
                return Double.parseDouble(t);
            }
        }
        if (HEX.matcher(t).matches()) {
            boolean negative = t.startsWith("-");
            String digits = t.replaceFirst("^[+-]?0[xX]", "");
            long v = Long.parseUnsignedLong(digits, 16);
            return negative ? -v : v;
        }
        if (DECIMAL.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        return null;
    }

    /**
     * Boolean value of {@code text}: a number (non-zero is true) or one of
     * true/false, yes/no, on/off in any case.
     *
     * @throws IllegalArgumentException for anything else
     */
    static boolean isTrue(String text) {
        Number n = parseNumber(text);
        if (n != null) {
            return n instanceof Long ? n.longValue() != 0 : n.doubleValue() != 0.0;
        }
        switch (text.trim().toLowerCase()) {
            case "true", "yes", "on":
                return true;
            case "false", "no", "off":
                return false;
            default:
                throw new IllegalArgumentException("expected boolean value but got \"" + text + "\"");
        }
    }

    static String format(boolean b) {
        return b ? "1" : "0";
    }

    /**
     * Shortest decimal form that reads back as {@code d}, always with a
     * fraction or exponent: {@code 16.0}, {@code 0.5}, {@code 1e-05}.
     */
    static String format(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Inf" : "-Inf";
        }
        double abs = Math.abs(d);
        if (d == 0.0 || (abs >= 1e-4 && abs < 1e16)) {
            String plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        String s = Double.toString(d);
        int e = s.indexOf('E');
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        int exponent = Integer.parseInt(s.substring(e + 1));
        String sign = exponent < 0 ? "-" : "+";
        int magnitude = Math.abs(exponent);
        return mantissa + "e" + sign + (magnitude < 10 ? "0" : "") + magnitude;
    }
}
