package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.ConsoleCommand;
import com.questrail.radar.console.parser.ConsoleException;
import com.questrail.radar.console.parser.ConsoleTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * ExpressionEvaluator
 * -----------------------------------------------------------------------------
 * Recursive-descent evaluator behind {@code expr} and the conditions of
 * {@code if}, {@code for} and {@code while}.
 *
 * <h2>Grammar, lowest precedence first</h2>
 * <pre>
 *   ternary  := or ( '?' ternary ':' ternary )?
 *   or       := and ( '||' and )*
 *   and      := equality ( '&amp;&amp;' equality )*
 *   equality := relation ( ( '==' | '!=' | 'eq' | 'ne' ) relation )*
 *   relation := sum ( ( '&lt;' | '&lt;=' | '&gt;' | '&gt;=' ) sum )*
 *   sum      := product ( ( '+' | '-' ) product )*
 *   product  := unary ( ( '*' | '/' | '%' ) unary )*
 *   unary    := ( '-' | '+' | '!' ) unary | power
 *   power    := primary ( '**' unary )?
 *   primary  := number | $var | [script] | "string" | {string}
 *             | function '(' args ')' | boolean | '(' ternary ')'
 * </pre>
 *
 * <h2>Values</h2>
 * Operands that read as integers stay integers ({@code 7/2} is {@code 3});
 * any double operand makes the result a double. Comparisons are numeric
 * when both sides are numbers and textual otherwise. Logical and relational
 * operators yield {@code 1} or {@code 0}. {@code &&}, {@code ||} and
 * {@code ?:} skip the operand they do not need, including its substitutions.
 * Integer arithmetic that leaves the 64-bit range fails instead of wrapping.
 *
 * <h2>Rejected input</h2>
 * Expressions containing {@code lambda}, {@code __}, {@code exec}, a newline
 * or a semicolon are refused before parsing.
 */
final class ExpressionEvaluator
{
    private static final List<String> FORBIDDEN = List.of("lambda", "__", "\n", ";", "exec");

    private final ConsoleInterpreter interpreter;
    private final Scope scope;
    private final ConsoleCommand command;
    private final int wordIndex;
    private final String src;
    private int pos;
    private int skipping;

    private ExpressionEvaluator(ConsoleInterpreter interpreter, Scope scope, String src,
                                ConsoleCommand command, int wordIndex) {
        this.interpreter = interpreter;
        this.scope = scope;
        this.src = src;
        this.command = command;
        this.wordIndex = wordIndex;
    }

    static String evaluate(ConsoleInterpreter interpreter, Scope scope, String expression,
                           ConsoleCommand command, int wordIndex) {
        for (String word : FORBIDDEN) {
            if (expression.contains(word)) {
                throw ConsoleException.at(command, wordIndex, "Tried to evaluate expression with forbidden word: "
                        + (word.equals("\n") ? "newline" : word));
            }
        }
        if (expression.isBlank()) {
            return "0";
        }
        ExpressionEvaluator e = new ExpressionEvaluator(interpreter, scope, expression, command, wordIndex);
        Value v = e.ternary();
        e.skipSpaces();
        if (e.pos < e.src.length()) {
            throw e.error("unexpected \"" + e.src.substring(e.pos) + "\"");
        }
        return v.text();
    }

    // -------------------------------------------------------------------------
    // Values
    // -------------------------------------------------------------------------

    /**
     * An operand: its text and, when it reads as one, its number.
     */
    private record Value(String text, Number number) {
        static final Value NOTHING = new Value("0", 0L);

        static Value of(String text) {
            return new Value(text, TclValues.parseNumber(text));
        }

        static Value of(long v) {
            return new Value(Long.toString(v), v);
        }

        static Value of(double v) {
            return new Value(TclValues.format(v), v);
        }

        static Value of(boolean b) {
            return of(b ? 1L : 0L);
        }

        boolean isNumber() {
            return number != null;
        }

        boolean isInteger() {
            return number instanceof Long;
        }

        long asLong() {
            return number.longValue();
        }

        double asDouble() {
            return number.doubleValue();
        }
    }

    // -------------------------------------------------------------------------
    // Operators
    // -------------------------------------------------------------------------

    private Value ternary() {
        Value condition = or();
        if (!match("?")) {
            return condition;
        }
        boolean take = skipping > 0 || truth(condition);
        Value yes = lazily(!take, this::ternary);
        expect(":");
        Value no = lazily(take, this::ternary);
        return take ? yes : no;
    }

    private Value or() {
        Value left = and();
        while (match("||")) {
            boolean decided = skipping == 0 && truth(left);
            Value right = lazily(decided, this::and);
            left = skipping > 0 ? Value.NOTHING : Value.of(decided || truth(right));
        }
        return left;
    }

    private Value and() {
        Value left = equality();
        while (match("&&")) {
            boolean decided = skipping == 0 && !truth(left);
            Value right = lazily(decided, this::equality);
            left = skipping > 0 ? Value.NOTHING : Value.of(!decided && truth(right));
        }
        return left;
    }

    private Value equality() {
        Value left = relation();
        while (true) {
            if (match("==")) {
                left = compareWith(left, relation(), c -> c == 0);
            } else if (match("!=")) {
                left = compareWith(left, relation(), c -> c != 0);
            } else if (matchWord("eq")) {
                Value right = relation();
                left = skipping > 0 ? Value.NOTHING : Value.of(left.text().equals(right.text()));
            } else if (matchWord("ne")) {
                Value right = relation();
                left = skipping > 0 ? Value.NOTHING : Value.of(!left.text().equals(right.text()));
            } else {
                return left;
            }
        }
    }

    private Value relation() {
        Value left = sum();
        while (true) {
            if (match("<=")) {
                left = compareWith(left, sum(), c -> c <= 0);
            } else if (match(">=")) {
                left = compareWith(left, sum(), c -> c >= 0);
            } else if (match("<")) {
                left = compareWith(left, sum(), c -> c < 0);
            } else if (match(">")) {
                left = compareWith(left, sum(), c -> c > 0);
            } else {
                return left;
            }
        }
    }

    private Value sum() {
        Value left = product();
        while (true) {
            if (match("+")) {
                left = arithmetic('+', left, product());
            } else if (match("-")) {
                left = arithmetic('-', left, product());
            } else {
                return left;
            }
        }
    }

    private Value product() {
        Value left = unary();
        while (true) {
            if (match("*")) {
                left = arithmetic('*', left, unary());
            } else if (match("/")) {
                left = arithmetic('/', left, unary());
            } else if (match("%")) {
                left = arithmetic('%', left, unary());
            } else {
                return left;
            }
        }
    }

    private Value unary() {
        if (match("-")) {
            Value v = unary();
            if (skipping > 0) {
                return v;
            }
            requireNumber(v, "-");
            return v.isInteger() ? Value.of(Math.negateExact(v.asLong())) : Value.of(-v.asDouble());
        }
        if (match("+")) {
            Value v = unary();
            if (skipping == 0) {
                requireNumber(v, "+");
            }
            return v;
        }
        if (match("!")) {
            Value v = unary();
            return skipping > 0 ? v : Value.of(!truth(v));
        }
        return power();
    }

    private Value power() {
        Value base = primary();
        if (!match("**")) {
            return base;
        }
        Value exponent = unary();
        if (skipping > 0) {
            return base;
        }
        requireNumber(base, "**");
        requireNumber(exponent, "**");
        if (base.isInteger() && exponent.isInteger() && exponent.asLong() >= 0) {
            long result = 1;
            for (long k = 0; k < exponent.asLong(); k++) {
                result = Math.multiplyExact(result, base.asLong());
            }
            return Value.of(result);
        }
        return Value.of(Math.pow(base.asDouble(), exponent.asDouble()));
    }

    // -------------------------------------------------------------------------
    // Operands
    // -------------------------------------------------------------------------

    private Value primary() {
        skipSpaces();
        if (pos >= src.length()) {
            throw error("premature end of expression");
        }
        char c = src.charAt(pos);
        if (c == '(') {
            pos++;
            Value v = ternary();
            expect(")");
            return v;
        }
        if (c == '$') {
            return variable();
        }
        if (c == '[') {
            int close = ConsoleTokenizer.findCloseBracket(src, pos);
            if (close < 0) {
                throw error("missing close-bracket");
            }
            String script = src.substring(pos + 1, close);
            pos = close + 1;
            return skipping > 0 ? Value.NOTHING
                    : Value.of(interpreter.evalNested(scope, script, command, wordIndex).value());
        }
        if (c == '"') {
            int close = ConsoleTokenizer.findCloseQuote(src, pos);
            if (close < 0) {
                throw error("missing close-quote");
            }
            String text = src.substring(pos + 1, close);
            pos = close + 1;
            return skipping > 0 ? Value.NOTHING
                    : Value.of(interpreter.substitute(scope, text, command, wordIndex));
        }
        if (c == '{') {
            int close = ConsoleTokenizer.findCloseBrace(src, pos);
            if (close < 0) {
                throw error("missing close-brace");
            }
            String text = src.substring(pos + 1, close);
            pos = close + 1;
            return Value.of(text);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            return identifier();
        }
        throw error("unexpected \"" + c + "\"");
    }

    private Value variable() {
        int start = pos + 1;
        String name;
        if (start < src.length() && src.charAt(start) == '{') {
            int close = src.indexOf('}', start);
            if (close < 0) {
                throw error("missing close-brace for variable name");
            }
            name = src.substring(start + 1, close);
            pos = close + 1;
        } else {
            int length = Substitutor.nameLength(src, start);
            if (length == 0) {
                throw error("\"$\" must be followed by a variable name");
            }
            name = src.substring(start, start + length);
            pos = start + length;
        }
        return skipping > 0 ? Value.NOTHING : Value.of(Substitutor.lookup(scope, name, command, wordIndex));
    }

    private Value number() {
        int start = pos;
        if (src.startsWith("0x", pos) || src.startsWith("0X", pos)) {
            pos += 2;
            while (pos < src.length() && Character.digit(src.charAt(pos), 16) >= 0) {
                pos++;
            }
        } else {
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                        pos++;
                    }
                } else {
                    pos = mark;
                }
            }
        }
        Value v = Value.of(src.substring(start, pos));
        if (!v.isNumber()) {
            throw error("invalid number \"" + v.text() + "\"");
        }
        return v;
    }

    private Value identifier() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String name = src.substring(start, pos);
        skipSpaces();
        if (pos < src.length() && src.charAt(pos) == '(') {
            pos++;
            List<Value> args = new ArrayList<>();
            skipSpaces();
            if (!match(")")) {
                do {
                    args.add(ternary());
                } while (match(","));
                expect(")");
            }
            return skipping > 0 ? Value.NOTHING : MathFunctions.apply(name, args, this);
        }
        switch (name.toLowerCase()) {
            case "true", "yes", "on":
                return Value.of(true);
            case "false", "no", "off":
                return Value.of(false);
            default:
                throw error("invalid bareword \"" + name + "\"");
        }
    }

    // -------------------------------------------------------------------------
    // Math functions
    // -------------------------------------------------------------------------

    private static final class MathFunctions {
        private MathFunctions() {
        }

        static Value apply(String name, List<Value> args, ExpressionEvaluator e) {
            for (Value a : args) {
                e.requireNumber(a, name);
            }
            switch (name) {
                case "sin": return Value.of(Math.sin(e.one(name, args)));
                case "cos": return Value.of(Math.cos(e.one(name, args)));
                case "tan": return Value.of(Math.tan(e.one(name, args)));
                case "asin": return Value.of(Math.asin(e.one(name, args)));
                case "acos": return Value.of(Math.acos(e.one(name, args)));
                case "atan": return Value.of(Math.atan(e.one(name, args)));
                case "sinh": return Value.of(Math.sinh(e.one(name, args)));
                case "cosh": return Value.of(Math.cosh(e.one(name, args)));
                case "tanh": return Value.of(Math.tanh(e.one(name, args)));
                case "exp": return Value.of(Math.exp(e.one(name, args)));
                case "log": return Value.of(Math.log(e.one(name, args)));
                case "log10": return Value.of(Math.log10(e.one(name, args)));
                case "floor": return Value.of(Math.floor(e.one(name, args)));
                case "ceil": return Value.of(Math.ceil(e.one(name, args)));
                case "double": return Value.of(e.one(name, args));
                case "sqrt": {
                    double x = e.one(name, args);
                    if (x < 0) {
                        throw e.error("domain error: argument not in valid range");
                    }
                    return Value.of(Math.sqrt(x));
                }
                case "int": return Value.of((long) e.one(name, args));
                case "round": {
                    double x = e.one(name, args);
                    return Value.of((long) (Math.signum(x) * Math.floor(Math.abs(x) + 0.5)));
                }
                case "abs": {
                    e.arity(name, args, 1);
                    Value v = args.get(0);
                    return v.isInteger() ? Value.of(Math.abs(v.asLong())) : Value.of(Math.abs(v.asDouble()));
                }
                case "atan2": return Value.of(Math.atan2(e.first(name, args), args.get(1).asDouble()));
                case "pow": return Value.of(Math.pow(e.first(name, args), args.get(1).asDouble()));
                case "hypot": return Value.of(Math.hypot(e.first(name, args), args.get(1).asDouble()));
                case "fmod": return Value.of(e.first(name, args) % args.get(1).asDouble());
                case "min":
                case "max":
                    return extreme(name, args, e);
                default:
                    throw e.error("unknown math function \"" + name + "\"");
            }
        }

        private static Value extreme(String name, List<Value> args, ExpressionEvaluator e) {
            if (args.isEmpty()) {
                throw e.error("too few arguments for math function \"" + name + "\"");
            }
            Value best = args.get(0);
            for (Value v : args.subList(1, args.size())) {
                int c = compareNumbers(v, best);
                if (name.equals("min") ? c < 0 : c > 0) {
                    best = v;
                }
            }
            return best.isInteger() ? Value.of(best.asLong()) : Value.of(best.asDouble());
        }
    }

    private double one(String name, List<Value> args) {
        arity(name, args, 1);
        return args.get(0).asDouble();
    }

    private double first(String name, List<Value> args) {
        arity(name, args, 2);
        return args.get(0).asDouble();
    }

    private void arity(String name, List<Value> args, int expected) {
        if (args.size() < expected) {
            throw error("too few arguments for math function \"" + name + "\"");
        }
        if (args.size() > expected) {
            throw error("too many arguments for math function \"" + name + "\"");
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private interface IntTest {
        boolean test(int comparison);
    }

    private interface Operand {
        Value parse();
    }

    private Value lazily(boolean skip, Operand operand) {
        if (skip) {
            skipping++;
        }
        try {
            return operand.parse();
        } finally {
            if (skip) {
                skipping--;
            }
        }
    }

    private Value compareWith(Value left, Value right, IntTest test) {
        if (skipping > 0) {
            return Value.NOTHING;
        }
        int c = left.isNumber() && right.isNumber()
                ? compareNumbers(left, right)
                : left.text().compareTo(right.text());
        return Value.of(test.test(c));
    }

    private static int compareNumbers(Value a, Value b) {
        if (a.isInteger() && b.isInteger()) {
            return Long.compare(a.asLong(), b.asLong());
        }
        return Double.compare(a.asDouble(), b.asDouble());
    }

    private Value arithmetic(char op, Value a, Value b) {
        if (skipping > 0) {
            return Value.NOTHING;
        }
        requireNumber(a, String.valueOf(op));
        requireNumber(b, String.valueOf(op));
        if (a.isInteger() && b.isInteger()) {
            long x = a.asLong();
            long y = b.asLong();
            switch (op) {
                case '+': return Value.of(Math.addExact(x, y));
                case '-': return Value.of(Math.subtractExact(x, y));
                case '*': return Value.of(Math.multiplyExact(x, y));
                case '/':
                    if (y == 0) {
                        throw error("divide by zero");
                    }
                    return Value.of(Math.floorDiv(x, y));
                default:
                    if (y == 0) {
                        throw error("divide by zero");
                    }
                    return Value.of(Math.floorMod(x, y));
            }
        }
        double x = a.asDouble();
        double y = b.asDouble();
        switch (op) {
            case '+': return Value.of(x + y);
            case '-': return Value.of(x - y);
            case '*': return Value.of(x * y);
            case '/':
                if (y == 0.0) {
                    throw error("divide by zero");
                }
                return Value.of(x / y);
            default:
                if (y == 0.0) {
                    throw error("divide by zero");
                }
                return Value.of(x - y * Math.floor(x / y));
        }
    }

    private boolean truth(Value v) {
        try {
            return TclValues.isTrue(v.text());
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    private void requireNumber(Value v, String operator) {
        if (!v.isNumber()) {
            throw error("can't use non-numeric string \"" + v.text() + "\" as operand of \"" + operator + "\"");
        }
    }

    private void skipSpaces() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private boolean match(String token) {
        skipSpaces();
        if (!src.startsWith(token, pos)) {
            return false;
        }
        pos += token.length();
        return true;
    }

    private boolean matchWord(String word) {
        skipSpaces();
        int end = pos + word.length();
        if (!src.startsWith(word, pos)) {
            return false;
        }
        if (end < src.length() && (Character.isLetterOrDigit(src.charAt(end)) || src.charAt(end) == '_')) {
            return false;
        }
        pos = end;
        return true;
    }

    private void expect(String token) {
        if (!match(token)) {
            throw error(pos < src.length()
                    ? "expected \"" + token + "\" but found \"" + src.substring(pos) + "\""
                    : "expected \"" + token + "\" at end of expression");
        }
    }

    private ConsoleException error(String message) {
        return ConsoleException.at(command, wordIndex, "syntax error in expression \"" + src + "\": " + message);
    }
}
