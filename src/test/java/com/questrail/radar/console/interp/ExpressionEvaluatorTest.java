package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.ConsoleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionEvaluatorTest
 * -----------------------------------------------------------------------------
 * Operators, precedence, number formatting and rejected input of
 * {@code expr}.
 */
final class ExpressionEvaluatorTest
{
    private ConsoleInterpreter sh;

    @BeforeEach
    void setUp() {
        sh = new ConsoleInterpreter(InterpreterConfig.defaults());
    }

    private String expr(String expression) {
        return sh.eval("expr {" + expression + "}");
    }

    private String error(String expression) {
        return assertThrows(ConsoleException.class, () -> expr(expression)).detail();
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    @Test
    void integerArithmeticStaysInteger() {
        assertEquals("7", expr("1 + 2 * 3"));
        assertEquals("9", expr("(1 + 2) * 3"));
        assertEquals("3", expr("7 / 2"));
        assertEquals("1", expr("7 % 3"));
        assertEquals("255", expr("0xff"));
    }

    @Test
    void integerDivisionRoundsTowardsNegativeInfinity() {
        assertEquals("-4", expr("-7 / 2"));
        assertEquals("1", expr("-7 % 2"));
    }

    @Test
    void anyDoubleOperandMakesTheResultDouble() {
        assertEquals("3.5", expr("7 / 2.0"));
        assertEquals("2.0", expr("1.5 + 0.5"));
        assertEquals("1e-05", expr("1 / 100000.0"));
    }

    @Test
    void integerOverflowFailsInsteadOfWrapping() {
        assertEquals("long overflow", error("9223372036854775807 + 1"));
        assertEquals("long overflow", error("-9223372036854775807 - 2"));
        assertEquals("long overflow", error("4294967296 * 4294967296"));
        assertEquals("9.223372036854776e+18", expr("9223372036854775807 + 1.0"));
    }

    @Test
    void exponentiation() {
        assertEquals("8", expr("2 ** 3"));
        assertEquals("-8", expr("-2 ** 3"));
        assertEquals("0.25", expr("2 ** -2"));
    }

    @Test
    void divisionByZeroIsAnError() {
        assertTrue(error("1 / 0").endsWith("divide by zero"));
        assertTrue(error("1.0 % 0").endsWith("divide by zero"));
    }

    @Test
    void nonNumericOperandIsAnError() {
        assertEquals("syntax error in expression \"{abc} + 1\": "
                + "can't use non-numeric string \"abc\" as operand of \"+\"", error("{abc} + 1"));
    }

    // -------------------------------------------------------------------------
    // Comparison and logic
    // -------------------------------------------------------------------------

    @Test
    void comparisonsAreNumericWhenBothSidesAreNumbers() {
        assertEquals("1", expr("10 > 9"));
        assertEquals("1", expr("1.0 == 1"));
        assertEquals("1", expr("{10} < {9x}"));
    }

    @Test
    void eqAndNeCompareText() {
        assertEquals("0", expr("1.0 eq 1"));
        assertEquals("1", expr("{esr} ne {uhf}"));
    }

    @Test
    void logicalOperatorsSkipTheOperandTheyDoNotNeed() {
        assertEquals("0", expr("0 && $undefined"));
        assertEquals("1", expr("1 || [nosuchcommand]"));
        assertEquals("yes", expr("1 ? {yes} : $undefined"));
    }

    @Test
    void booleanWordsAreAccepted() {
        assertEquals("1", expr("true && on"));
        assertEquals("0", expr("!yes"));
    }

    @Test
    void variablesAndCommandsAreSubstituted() {
        sh.eval("set f 930.5");
        assertEquals("1861.0", expr("$f * 2"));
        assertEquals("4", expr("[string length abcd]"));
    }

    // -------------------------------------------------------------------------
    // Functions
    // -------------------------------------------------------------------------

    @Test
    void mathFunctions() {
        assertEquals("5.0", expr("hypot(3, 4)"));
        assertEquals("16.0", expr("sqrt(256)"));
        assertEquals("3", expr("int(3.9)"));
        assertEquals("4", expr("round(3.5)"));
        assertEquals("-4", expr("round(-3.5)"));
        assertEquals("7", expr("max(1, 7, 3)"));
        assertEquals("2.0", expr("abs(-2.0)"));
        assertEquals("1024.0", expr("pow(2, 10)"));
    }

    @Test
    void functionArityIsChecked() {
        assertTrue(error("sin(1, 2)").endsWith("too many arguments for math function \"sin\""));
        assertTrue(error("nosuch(1)").endsWith("unknown math function \"nosuch\""));
    }

    // -------------------------------------------------------------------------
    // Rejected input
    // -------------------------------------------------------------------------

    @Test
    void forbiddenWordsAreRefusedBeforeParsing() {
        assertEquals("Tried to evaluate expression with forbidden word: exec", error("exec(1)"));
        assertEquals("Tried to evaluate expression with forbidden word: __", error("__import__"));
        assertEquals("Tried to evaluate expression with forbidden word: newline", error("1 +\n 2"));
    }

    @Test
    void blankExpressionIsZero() {
        assertEquals("0", expr("  "));
    }

    @Test
    void trailingGarbageIsAnError() {
        assertTrue(error("1 2").contains("unexpected \"2\""));
    }
}
