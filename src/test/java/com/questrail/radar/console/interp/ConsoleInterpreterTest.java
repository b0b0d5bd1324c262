package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.ConsoleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConsoleInterpreterTest
 * -----------------------------------------------------------------------------
 * Runs console scripts and checks what they print and return.
 *
 * The "tutorial" tests follow the lessons of the Tcl tutorial on the Tcl
 * wiki, which the radar console scripts are written against.
 */
final class ConsoleInterpreterTest
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private ConsoleInterpreter sh;

    @BeforeEach
    void setUp() {
        sh = new ConsoleInterpreter(config().build());
    }

    private InterpreterConfig.Builder config() {
        return InterpreterConfig.builder()
                .withOutput(new PrintStream(out, true, StandardCharsets.UTF_8))
                .withSourceName("test");
    }

    private String printed(String script) {
        out.reset();
        sh.eval(script);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private ConsoleException fails(String script) {
        return assertThrows(ConsoleException.class, () -> sh.eval(script));
    }

    // -------------------------------------------------------------------------
    // Tutorial lessons
    // -------------------------------------------------------------------------

    @Test
    void tutorial1_simpleOutput() {
        assertEquals("Hello,\n", printed("puts Hello,"));
        assertEquals("Hello,\nWorld\n", printed(lines("", "puts Hello,", "puts World")));
        assertEquals("Hello,World\n", printed(lines("puts -nonewline Hello,", "puts World", "")));
        assertEquals("Hello, World\n", printed("puts \"Hello, World\""));

        String script = lines(
                "puts \"Hello, World - In quotes\"    ;# Note: comment after a command.",
                "# This is a comment at beginning of a line",
                "puts {Hello, World - In Braces}",
                "",
                "puts \"This is line 1\"; puts \"this is line 2\"",
                "",
                "puts \"Hello, World; - With  a semicolon inside the quotes\"",
                "puts HelloWorld");
        assertEquals(lines(
                "Hello, World - In quotes",
                "Hello, World - In Braces",
                "This is line 1",
                "this is line 2",
                "Hello, World; - With  a semicolon inside the quotes",
                "HelloWorld",
                ""), printed(script));

        fails("puts {Bad comment syntax example}   # *Error* - no semicolon!");
    }

    @Test
    void tutorial2_variables() {
        String script = lines(
                "set X \"This is a string\"",
                "set Y 1.24",
                "puts $X",
                "puts $Y",
                "puts \"...............................\"",
                "set label \"The value in Y is: \"",
                "puts \"$label $Y\"");
        assertEquals(lines(
                "This is a string",
                "1.24",
                "...............................",
                "The value in Y is:  1.24",
                ""), printed(script));
    }

    @Test
    void tutorial3_substitutionAndEscapes() {
        String script = lines(
                "set Z Albany",
                "set Z_LABEL \"The capital of New York is: \"",
                "puts \"$Z_LABEL $Z\"   ;# Prints the value of Z",
                "puts \"$Z_LABEL \\$Z\"  ;# Prints literal $Z instead of the value of Z",
                "puts \"\\nBen Franklin is on the \\$100.00 bill\"",
                "set a 100.00",
                "puts \"Washington is not on the $a bill\"",
                "puts \"Lincoln is not on the $$a bill\"",
                "puts \"Hamilton is not on the \\$a bill\"",
                "puts \"Ben Franklin is on the \\$$a bill\"",
                "puts \"\\n................. examples of escape strings\"",
                "puts \"Tab\\tTab\\tTab\"",
                "puts \"This string prints out \\non two lines\"",
                "puts \"This string comes out\\",
                "on a single line\"");
        assertEquals(lines(
                "The capital of New York is:  Albany",
                "The capital of New York is:  $Z",
                "",
                "Ben Franklin is on the $100.00 bill",
                "Washington is not on the 100.00 bill",
                "Lincoln is not on the $100.00 bill",
                "Hamilton is not on the $a bill",
                "Ben Franklin is on the $100.00 bill",
                "",
                "................. examples of escape strings",
                "Tab\tTab\tTab",
                "This string prints out ",
                "on two lines",
                "This string comes out on a single line",
                ""), printed(script));
    }

    @Test
    void tutorial4_quotesVersusBraces() {
        String script = lines(
                "set Z Albany",
                "set Z_LABEL \"The capital of New York is: \"",
                "puts \"\\n.............. examples of differences between  \\\" and \\{\"",
                "puts \"$Z_LABEL $Z\"",
                "puts {$Z_LABEL $Z}",
                "puts \"\\n....... examples of differences in nesting \\{ and \\\" \"",
                "puts \"$Z_LABEL {$Z}\"",
                "puts {Who said, \"What this country needs is a good $0.05 cigar!\"?}",
                "puts \"\\n.............. examples of escape strings\"",
                "puts {Note: no substitutions done within braces \\n \\r \\x0a \\f \\v}",
                "puts {But:",
                "The escaped newline at the end of a\\",
                "string is replaced by a space}");
        assertEquals(lines(
                "",
                ".............. examples of differences between  \" and {",
                "The capital of New York is:  Albany",
                "$Z_LABEL $Z",
                "",
                "....... examples of differences in nesting { and \" ",
                "The capital of New York is:  {Albany}",
                "Who said, \"What this country needs is a good $0.05 cigar!\"?",
                "",
                ".............. examples of escape strings",
                "Note: no substitutions done within braces \\n \\r \\x0a \\f \\v",
                "But:",
                "The escaped newline at the end of a string is replaced by a space",
                ""), printed(script));
    }

    @Test
    void tutorial5_commandSubstitution() {
        String script = lines(
                "set x abc",
                "puts \"A simple substitution: $x\\n\"",
                "set y [set x \"def\"]",
                "puts \"Remember that set returns the new value of the variable:\"",
                "puts \">>>>X: $x Y: $y\\n\"",
                "set z {[set x \"String within quotes within braces\"]}",
                "puts \"Note curly braces: $z\\n\"",
                "set a \"[set x {String within braces within quotes}]\"",
                "puts \"See how the set is executed: $a\"",
                "puts \"\\$x is: $x\\n\"",
                "set b \"\\[set y {This is a string within braces within quotes}]\"",
                "# Note the \\ escapes the bracket",
                "puts \"Note the \\\\ escapes the bracket:\\n>\\$b is: $b\"",
                "puts \"\\$y is: $y\"");
        assertEquals(lines(
                "A simple substitution: abc",
                "",
                "Remember that set returns the new value of the variable:",
                ">>>>X: def Y: def",
                "",
                "Note curly braces: [set x \"String within quotes within braces\"]",
                "",
                "See how the set is executed: String within braces within quotes",
                "$x is: String within braces within quotes",
                "",
                "Note the \\ escapes the bracket:",
                ">$b is: [set y {This is a string within braces within quotes}]",
                "$y is: def",
                ""), printed(script));
    }

    @Test
    void tutorial6_expressions() {
        String script = lines(
                "set X 100",
                "set Y 256",
                "set Z [expr {$Y + $X}]",
                "set Z_LABEL \"$Y plus $X is \"",
                "puts \"$Z_LABEL $Z\"",
                "puts \"The square root of $Y is [expr { sqrt($Y) }]\\n\"",
                "puts \">  [expr {-3 * 4 + 5}]\"",
                "puts \">  [expr {(5 + -3) * 4}]\"",
                "puts \"The hypotenuse of a triangle: [expr {hypot(3,4)}]\"");
        assertEquals(lines(
                "256 plus 100 is  356",
                "The square root of 256 is 16.0",
                "",
                ">  -7",
                ">  8",
                "The hypotenuse of a triangle: 5.0",
                ""), printed(script));
    }

    @Test
    void tutorial6_floatingPointResults() {
        String script = lines(
                "puts \"1/2 is [expr {1./2}]\"",
                "puts \"1/3 is [expr {1./3}]\"",
                "set a [expr {1.0/3.0}]",
                "puts \"3*(1/3) is [expr {3.0*$a}]\"",
                "set b [expr {10.0/3.0}]",
                "puts \"3*(10/3) is [expr {3.0*$b}]\"",
                "set c [expr {10.0/3.0}]",
                "set d [expr {2.0/3.0}]",
                "puts \"(10.0/3.0) / (2.0/3.0) is [expr {$c/$d}]\"",
                "set e [expr {1.0/10.0}]",
                "puts \"1.2 / 0.1 is [expr {1.2/$e}]\"");
        assertEquals(lines(
                "1/2 is 0.5",
                "1/3 is 0.3333333333333333",
                "3*(1/3) is 1.0",
                "3*(10/3) is 10.0",
                "(10.0/3.0) / (2.0/3.0) is 5.000000000000001",
                "1.2 / 0.1 is 11.999999999999998",
                ""), printed(script));
    }

    @Test
    void tutorial7_ifElse() {
        String script = lines(
                "set x 1",
                "if {$x == 2} {puts \"$x is 2\"} else {puts \"$x is not 2\"}",
                "if {$x != 1} {",
                "    puts \"$x is != 1\"",
                "} else {",
                "    puts \"$x is 1\"",
                "}");
        assertEquals("1 is not 2\n1 is 1\n", printed(script));
    }

    @Test
    void tutorial11_procedures() {
        String script = lines(
                "proc sum {arg1 arg2} {",
                "    set x [expr {$arg1 + $arg2}];",
                "    return $x",
                "}",
                "puts \" The sum of 2 + 3 is: [sum 2 3]\\n\\n\"");
        assertEquals(" The sum of 2 + 3 is: 5\n\n\n", printed(script));

        ConsoleException e = fails("puts \" The sum of 2 + 3 is: [sum 2]\"");
        assertEquals("wrong # args: should be \"sum arg1 arg2\"", e.detail());
    }

    @Test
    void tutorial12_defaultsAndVariadicArguments() {
        String script = lines(
                "proc example {first {second 0} args} {",
                "    if {$second == \"0\"} {",
                "        puts \"There is only one argument and it is: $first\"",
                "        return 1",
                "    } else {",
                "        if {$args == \"\"} {",
                "            puts \"There are two arguments - $first and $second\"",
                "            return 2",
                "        } else {",
                "            puts \"There are many arguments - $first and $second and $args\"",
                "            return \"many\"",
                "        }",
                "    }",
                "}",
                "set count1 [example ONE]",
                "set count2 [example ONE TWO]",
                "set count3 [example ONE TWO THREE ]",
                "set count4 [example ONE TWO THREE FOUR]",
                "puts \">   $count1, $count2, $count3, and $count4\"");
        assertEquals(lines(
                "There is only one argument and it is: ONE",
                "There are two arguments - ONE and TWO",
                "There are many arguments - ONE and TWO and THREE",
                "There are many arguments - ONE and TWO and THREE FOUR",
                ">   1, 2, many, and many",
                ""), printed(script));
    }

    @Test
    void infoExists() {
        assertEquals("0", sh.eval("info exists a"));
        sh.eval("set a 10");
        assertEquals("1", sh.eval("info exists a"));
    }

    // -------------------------------------------------------------------------
    // Built-in commands
    // -------------------------------------------------------------------------

    @Test
    void setWithOneArgumentReadsTheVariable() {
        sh.eval("set a hello");
        assertEquals("hello", sh.eval("set a"));
    }

    @Test
    void incrCreatesMissingVariables() {
        assertEquals("1", sh.eval("incr n"));
        assertEquals("6", sh.eval("incr n 5"));
        assertEquals("expected integer but got \"x\"", fails("incr n x").detail());
    }

    @Test
    void incrBeyondTheIntegerRangeFails() {
        sh.eval("set n 9223372036854775807");

        assertEquals("long overflow", fails("incr n").detail());
        assertEquals("9223372036854775807", sh.eval("set n"));
    }

    @Test
    void appendAndLappend() {
        assertEquals("ab", sh.eval("append s a b"));
        assertEquals("x {y z}", sh.eval("lappend l x {y z}"));
        assertEquals("2", sh.eval("llength $l"));
    }

    @Test
    void lindexSupportsEnd() {
        assertEquals("c", sh.eval("lindex {a b c} end"));
        assertEquals("b", sh.eval("lindex {a b c} end-1"));
        assertEquals("a", sh.eval("lindex {a b c} 0"));
        assertEquals("", sh.eval("lindex {a b c} 7"));
    }

    @Test
    void splitUsesEachCharacterAsSeparator() {
        assertEquals("a b {} c", sh.eval("split {a,b;,c} {,;}"));
        assertEquals("a b c", sh.eval("split abc {}"));
    }

    @Test
    void stringSubcommands() {
        assertEquals("ABC", sh.eval("string toupper abc"));
        assertEquals("3", sh.eval("string length abc"));
        assertEquals("x", sh.eval("string trim {  x  }"));
        assertEquals("1", sh.eval("string equal -nocase ESR esr"));
        assertEquals("0", sh.eval("string equal ESR esr"));
    }

    @Test
    void substHonoursItsOptions() {
        sh.eval("set a 1");
        assertEquals("1 [x]", sh.eval("subst -nocommands {$a [x]}"));
        assertEquals("$a 2", sh.eval("subst -novariables {$a [expr {1 + 1}]}"));
    }

    @Test
    void evalJoinsItsArguments() {
        assertEquals("3", sh.eval("eval expr 1 + 2"));
    }

    @Test
    void loopsHonourBreakAndContinue() {
        String script = lines(
                "set s 0",
                "for {set i 0} {$i < 10} {incr i} {",
                "    if {$i == 3} continue",
                "    if {$i == 6} break",
                "    incr s $i",
                "}",
                "set s");
        assertEquals("12", sh.eval(script));

        assertEquals("12-34-", sh.eval("foreach {a b} {1 2 3 4} {append r $a$b-}; set r"));
        assertEquals("3", sh.eval("set k 0; while {$k < 3} {incr k}; set k"));
    }

    @Test
    void loopsStopAtTheConfiguredIterationCap() {
        sh = new ConsoleInterpreter(config().withMaxLoopIterations(10).build());

        assertEquals("Loop \"while\" exceeded 10 iterations", fails("while {1} {}").detail());
        assertEquals("10", sh.eval("set n 0; while {$n < 10} {incr n}; set n"));
    }

    @Test
    void breakOutsideLoopIsAnError() {
        assertEquals("invoked \"break\" outside of a loop", fails("break").detail());
        sh.eval("proc p {} {continue}");
        assertEquals("invoked \"continue\" outside of a loop", fails("p").detail());
    }

    @Test
    void sourceRunsAFileRelativeToTheWorkingDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("lib.tcl"), "proc twice {x} {expr {2 * $x}}\nset loaded yes\n");
        sh = new ConsoleInterpreter(config().withWorkingDirectory(dir).build());

        sh.eval("source lib.tcl");

        assertEquals("yes", sh.eval("set loaded"));
        assertEquals("14", sh.eval("twice 7"));
        assertTrue(fails("source missing.tcl").detail().startsWith("Could not read file: "));
    }

    @Test
    void sourceReadsLatin1Scripts(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("old.elan"), "# Sodankylä\nset site SOD\n".getBytes(StandardCharsets.ISO_8859_1));

        sh.source(dir.resolve("old.elan"));

        assertEquals("SOD", sh.eval("set site"));
    }

    // -------------------------------------------------------------------------
    // Errors
    // -------------------------------------------------------------------------

    @Test
    void unknownCommandIsLocatedAtItsName() {
        ConsoleException e = fails("set a 1\n  lodradar x");

        assertEquals("Function 'lodradar' is not known in Tcl scope!", e.detail());
        assertEquals(2, e.line());
        assertEquals(3, e.start());
        assertEquals(10, e.end());
        assertEquals("test", e.source());
    }

    @Test
    void unknownVariableIsAnError() {
        assertEquals("Variable 'nope' is not known in Tcl scope!", fails("puts $nope").detail());
    }

    @Test
    void unsupportedEscapesAreRejected() {
        assertEquals("Could not handle escape sequence \\x", fails("puts \"\\x41\"").detail());
    }

    @Test
    void handlerErrorsCarryTheirCause() {
        ConsoleException e = fails("string reverse abc");

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(e.detail().startsWith("unknown or ambiguous subcommand \"reverse\""));
    }

    @Test
    void errorsInNestedBodiesCarryTheirOwnLine() {
        ConsoleException e = fails(lines(
                "if {0} {",
                " puts a",
                "} else {",
                " nosuchcmd",
                "}"));

        assertEquals(4, e.line());
        assertEquals(2, e.start());

        ConsoleException inLoop = fails(lines(
                "set i 0",
                "while {$i < 1} \\",
                "{",
                "  incr i",
                "  nosuchcmd",
                "}"));
        assertEquals(5, inLoop.line());
    }

    @Test
    void procedureBodyErrorsAreLocatedInTheBody() {
        sh.eval(lines(
                "proc p {} \\",
                "{",
                "  nosuchcmd",
                "}"));

        assertEquals(3, fails("p").line());
    }

    @Test
    void substJoinsCrlfContinuations() {
        sh.rootScope().setVariable("t", "a\\\r\n   b");

        assertEquals("a b", sh.eval("subst $t"));
    }

    @Test
    void procedureHidingABuiltinIsStillCalled() {
        sh.eval("proc puts {x} {return \"hidden $x\"}");

        assertEquals("hidden a", sh.eval("puts a"));
    }

    @Test
    void runawayRecursionIsStopped() {
        sh.eval("proc down {} {down}");

        assertTrue(fails("down").detail().startsWith("Too many nested procedure calls"));
    }

    // -------------------------------------------------------------------------
    // Scopes
    // -------------------------------------------------------------------------

    @Test
    void procedureRunsOnACopyOfTheCallersVariables() {
        sh.eval("set a 1; proc change {} {set a 2; set b 3; return $a}");

        assertEquals("2", sh.eval("change"));
        assertEquals("1", sh.eval("set a"));
        assertEquals("0", sh.eval("info exists b"));
    }

    @Test
    void everyCallIsLoggedWithItsChildScope() {
        sh.eval("proc f {x} {set y $x}");
        sh.eval("f 5");

        Scope root = sh.rootScope();
        Scope.LogEntry last = root.lastLogEntry().orElseThrow();
        assertEquals(List.of("f", "5"), last.words());
        assertEquals("5", last.result());
        assertTrue(last.child().isPresent());

        Scope child = sh.scopes().get(last.child().getAsInt());
        assertEquals(root.id(), child.parentId());
        assertEquals("5", child.variable("y").orElseThrow());
        assertFalse(root.log().get(0).child().isPresent());
    }

    @Test
    void effectiveStateFoldsInWhatCalleesChanged() {
        MarkState state = new MarkState();
        CommandHandler mark = (ctx, args) -> {
            ctx.scope().state(MarkState.class).marks.add(args.get(0));
            return ExecResult.EMPTY;
        };
        CommandCatalog catalog = name -> name.equals("mark") ? Optional.of(mark) : Optional.empty();
        sh = new ConsoleInterpreter(config().build(), state, catalog);

        sh.eval("proc inner {} {mark deep}; proc outer {} {mark middle; inner}; mark top; outer");

        assertEquals(List.of("top"), state.marks);
        assertEquals(List.of("top", "middle", "deep"), sh.effectiveState(MarkState.class).marks);
    }

    /**
     * Minimal domain state: a list of marks, merged by appending new ones.
     */
    private static final class MarkState implements DomainState
    {
        final List<String> marks = new ArrayList<>();

        @Override
        public DomainState copy() {
            MarkState copy = new MarkState();
            copy.marks.addAll(marks);
            return copy;
        }

        @Override
        public void mergeFrom(DomainState callee) {
            for (String m : ((MarkState) callee).marks) {
                if (!marks.contains(m)) {
                    marks.add(m);
                }
            }
        }
    }
}
