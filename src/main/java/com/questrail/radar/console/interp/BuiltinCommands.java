package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.TclLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BuiltinCommands
 * -----------------------------------------------------------------------------
 * The Tcl core commands the console language supports.
 *
 * <h2>Variables and values</h2>
 * {@code set}, {@code incr}, {@code append}, {@code lappend}, {@code list},
 * {@code llength}, {@code lindex}, {@code split}, {@code string},
 * {@code info exists}, {@code expr}, {@code subst}.
 *
 * <h2>Control flow</h2>
 * {@code if}, {@code for}, {@code foreach}, {@code while}, {@code break},
 * {@code continue}, {@code proc}, {@code return}, {@code eval},
 * {@code source}.
 *
 * <h2>Other</h2>
 * {@code puts} writes to the configured output. {@code global} is accepted
 * and ignored: procedures see copies of their caller's variables anyway.
 */
final class BuiltinCommands
{
    private static final Logger log = LoggerFactory.getLogger(BuiltinCommands.class);

    private static final String WHITESPACE = " \t\n\r";

    private BuiltinCommands() {
    }

    static Map<String, CommandHandler> create() {
        Map<String, CommandHandler> t = new LinkedHashMap<>();
        t.put("set", BuiltinCommands::set);
        t.put("incr", BuiltinCommands::incr);
        t.put("append", BuiltinCommands::append);
        t.put("lappend", BuiltinCommands::lappend);
        t.put("list", (ctx, args) -> ExecResult.normal(TclLists.format(args)));
        t.put("llength", BuiltinCommands::llength);
        t.put("lindex", BuiltinCommands::lindex);
        t.put("split", BuiltinCommands::split);
        t.put("string", BuiltinCommands::string);
        t.put("info", BuiltinCommands::info);
        t.put("expr", BuiltinCommands::expr);
        t.put("subst", BuiltinCommands::subst);
        t.put("if", BuiltinCommands::ifCommand);
        t.put("for", BuiltinCommands::forLoop);
        t.put("foreach", BuiltinCommands::foreach);
        t.put("while", BuiltinCommands::whileLoop);
        t.put("break", (ctx, args) -> new ExecResult.Break());
        t.put("continue", (ctx, args) -> new ExecResult.Continue());
        t.put("proc", BuiltinCommands::proc);
        t.put("return", (ctx, args) -> new ExecResult.Return(args.isEmpty() ? "" : args.get(args.size() - 1)));
        t.put("eval", (ctx, args) -> ctx.eval(String.join(" ", args), 0));
        t.put("source", BuiltinCommands::source);
        t.put("puts", BuiltinCommands::puts);
        t.put("global", BuiltinCommands::global);
        return Collections.unmodifiableMap(t);
    }

    // -------------------------------------------------------------------------
    // Variables and values
    // -------------------------------------------------------------------------

    private static ExecResult set(CommandContext ctx, List<String> args) {
        if (args.size() == 1) {
            return ExecResult.normal(read(ctx.scope(), args.get(0)));
        }
        requireArgs(args, 2, 2, "set varName ?newValue?");
        ctx.scope().setVariable(args.get(0), args.get(1));
        return ExecResult.normal(args.get(1));
    }

    private static ExecResult incr(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 2, "incr varName ?increment?");
        long value = integer(ctx.scope().variable(args.get(0)).orElse("0"));
        long increment = args.size() == 2 ? integer(args.get(1)) : 1;
        String result = Long.toString(Math.addExact(value, increment));
        ctx.scope().setVariable(args.get(0), result);
        return ExecResult.normal(result);
    }

    private static ExecResult append(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, Integer.MAX_VALUE, "append varName ?value ...?");
        StringBuilder sb = new StringBuilder(ctx.scope().variable(args.get(0)).orElse(""));
        for (String value : args.subList(1, args.size())) {
            sb.append(value);
        }
        ctx.scope().setVariable(args.get(0), sb.toString());
        return ExecResult.normal(sb.toString());
    }

    private static ExecResult lappend(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, Integer.MAX_VALUE, "lappend varName ?value ...?");
        List<String> list = new ArrayList<>(TclLists.split(ctx.scope().variable(args.get(0)).orElse("")));
        list.addAll(args.subList(1, args.size()));
        String result = TclLists.format(list);
        ctx.scope().setVariable(args.get(0), result);
        return ExecResult.normal(result);
    }

    private static ExecResult llength(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 1, "llength list");
        return ExecResult.normal(Integer.toString(TclLists.split(args.get(0)).size()));
    }

    private static ExecResult lindex(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 2, "lindex list ?index?");
        if (args.size() == 1) {
            return ExecResult.normal(args.get(0));
        }
        List<String> list = TclLists.split(args.get(0));
        String spec = args.get(1).trim();
        long index;
        if (spec.equals("end")) {
            index = list.size() - 1;
        } else if (spec.startsWith("end-")) {
            index = list.size() - 1 - integer(spec.substring(4));
        } else {
            index = integer(spec);
        }
        return ExecResult.normal(index < 0 || index >= list.size() ? "" : list.get((int) index));
    }

    private static ExecResult split(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 2, "split string ?splitChars?");
        String s = args.get(0);
        String separators = args.size() == 2 ? args.get(1) : WHITESPACE;
        List<String> parts = new ArrayList<>();
        if (separators.isEmpty()) {
            for (int i = 0; i < s.length(); i++) {
                parts.add(String.valueOf(s.charAt(i)));
            }
            return ExecResult.normal(TclLists.format(parts));
        }
        int begin = 0;
        for (int i = 0; i < s.length(); i++) {
            if (separators.indexOf(s.charAt(i)) >= 0) {
                parts.add(s.substring(begin, i));
                begin = i + 1;
            }
        }
        parts.add(s.substring(begin));
        return ExecResult.normal(TclLists.format(parts));
    }

    private static ExecResult string(CommandContext ctx, List<String> args) {
        requireArgs(args, 2, Integer.MAX_VALUE, "string subcommand ?arg ...?");
        String sub = args.get(0);
        List<String> rest = args.subList(1, args.size());
        switch (sub) {
            case "tolower":
                return ExecResult.normal(rest.get(0).toLowerCase());
            case "toupper":
                return ExecResult.normal(rest.get(0).toUpperCase());
            case "length":
                return ExecResult.normal(Integer.toString(rest.get(0).length()));
            case "trim":
                return ExecResult.normal(trim(rest, true, true));
            case "trimleft":
                return ExecResult.normal(trim(rest, true, false));
            case "trimright":
                return ExecResult.normal(trim(rest, false, true));
            case "equal": {
                boolean nocase = rest.size() == 3 && rest.get(0).equals("-nocase");
                if (rest.size() != 2 && !nocase) {
                    throw new IllegalArgumentException("wrong # args: should be \"string equal ?-nocase? string1 string2\"");
                }
                String a = rest.get(rest.size() - 2);
                String b = rest.get(rest.size() - 1);
                return ExecResult.normal(TclValues.format(nocase ? a.equalsIgnoreCase(b) : a.equals(b)));
            }
            default:
                throw new IllegalArgumentException("unknown or ambiguous subcommand \"" + sub
                        + "\": must be equal, length, tolower, toupper, trim, trimleft, or trimright");
        }
    }

    private static String trim(List<String> rest, boolean left, boolean right) {
        String s = rest.get(0);
        String chars = rest.size() > 1 ? rest.get(1) : WHITESPACE;
        int begin = 0;
        int end = s.length();
        while (left && begin < end && chars.indexOf(s.charAt(begin)) >= 0) {
            begin++;
        }
        while (right && end > begin && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(begin, end);
    }

    private static ExecResult info(CommandContext ctx, List<String> args) {
        if (args.size() == 2 && args.get(0).equals("exists")) {
            return ExecResult.normal(TclValues.format(ctx.scope().hasVariable(args.get(1))));
        }
        throw new IllegalArgumentException("Only \"info exists varName\" is supported");
    }

    private static ExecResult expr(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, Integer.MAX_VALUE, "expr arg ?arg ...?");
        return ExecResult.normal(ctx.expr(String.join(" ", args), 0));
    }

    private static ExecResult subst(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 4, "subst ?-nobackslashes? ?-nocommands? ?-novariables? string");
        boolean commands = true;
        boolean variables = true;
        boolean backslashes = true;
        for (String option : args.subList(0, args.size() - 1)) {
            switch (option) {
                case "-nocommands" -> commands = false;
                case "-novariables" -> variables = false;
                case "-nobackslashes" -> backslashes = false;
                default -> throw new IllegalArgumentException("bad option \"" + option
                        + "\": must be -nobackslashes, -nocommands, or -novariables");
            }
        }
        SubstitutionMode mode = new SubstitutionMode(commands, variables, backslashes);
        return ExecResult.normal(ctx.interpreter().substitute(ctx.scope(), args.get(args.size() - 1),
                mode, ctx.command(), args.size()));
    }

    // -------------------------------------------------------------------------
    // Control flow
    // -------------------------------------------------------------------------

    private static ExecResult ifCommand(CommandContext ctx, List<String> args) {
        int i = 0;
        while (true) {
            if (i >= args.size()) {
                throw new IllegalArgumentException("wrong # args: no expression after \"if\" argument");
            }
            int conditionIndex = i++;
            if (i < args.size() && args.get(i).equals("then")) {
                i++;
            }
            if (i >= args.size()) {
                throw new IllegalArgumentException("wrong # args: no script following \""
                        + args.get(conditionIndex) + "\" argument");
            }
            int bodyIndex = i++;
            if (TclValues.isTrue(ctx.expr(args.get(conditionIndex), conditionIndex))) {
                return ctx.eval(args.get(bodyIndex), bodyIndex);
            }
            if (i >= args.size()) {
                return ExecResult.EMPTY;
            }
            String keyword = args.get(i);
            if (keyword.equals("elseif")) {
                i++;
                continue;
            }
            if (keyword.equals("else")) {
                i++;
                if (i >= args.size()) {
                    throw new IllegalArgumentException("wrong # args: no script following \"else\" argument");
                }
            }
            if (i != args.size() - 1) {
                throw new IllegalArgumentException("wrong # args: extra words after \"else\" clause in \"if\" command");
            }
            return ctx.eval(args.get(i), i);
        }
    }

    private static ExecResult forLoop(CommandContext ctx, List<String> args) {
        requireArgs(args, 4, 4, "for start test next command");
        ExecResult start = ctx.eval(args.get(0), 0);
        if (!start.isNormal()) {
            return start;
        }
        int cap = ctx.interpreter().config().maxLoopIterations();
        int iterations = 0;
        while (TclValues.isTrue(ctx.expr(args.get(1), 1))) {
            if (iterations++ == cap) {
                throw loopCapExceeded("for", cap);
            }
            ExecResult body = ctx.eval(args.get(3), 3);
            if (body instanceof ExecResult.Break) {
                break;
            }
            if (!body.isNormal() && !(body instanceof ExecResult.Continue)) {
                return body;
            }
            ExecResult next = ctx.eval(args.get(2), 2);
            if (!next.isNormal()) {
                return next;
            }
        }
        return ExecResult.EMPTY;
    }

    private static ExecResult whileLoop(CommandContext ctx, List<String> args) {
        requireArgs(args, 2, 2, "while test command");
        int cap = ctx.interpreter().config().maxLoopIterations();
        int iterations = 0;
        while (TclValues.isTrue(ctx.expr(args.get(0), 0))) {
            if (iterations++ == cap) {
                throw loopCapExceeded("while", cap);
            }
            ExecResult body = ctx.eval(args.get(1), 1);
            if (body instanceof ExecResult.Break) {
                break;
            }
            if (!body.isNormal() && !(body instanceof ExecResult.Continue)) {
                return body;
            }
        }
        return ExecResult.EMPTY;
    }

    private static ExecResult foreach(CommandContext ctx, List<String> args) {
        requireArgs(args, 3, 3, "foreach varList list command");
        List<String> names = TclLists.split(args.get(0));
        if (names.isEmpty()) {
            throw new IllegalArgumentException("foreach varlist is empty");
        }
        List<String> items = TclLists.split(args.get(1));
        for (int i = 0; i < items.size(); i += names.size()) {
            for (int k = 0; k < names.size(); k++) {
                ctx.scope().setVariable(names.get(k), i + k < items.size() ? items.get(i + k) : "");
            }
            ExecResult body = ctx.eval(args.get(2), 2);
            if (body instanceof ExecResult.Break) {
                break;
            }
            if (!body.isNormal() && !(body instanceof ExecResult.Continue)) {
                return body;
            }
        }
        return ExecResult.EMPTY;
    }

    private static ExecResult proc(CommandContext ctx, List<String> args) {
        requireArgs(args, 3, 3, "proc name args body");
        ctx.interpreter().defineProcedure(ctx.scope(), Procedure.parse(args.get(0), args.get(1), args.get(2),
                ctx.command().source(), ctx.argumentLine(2)));
        return ExecResult.EMPTY;
    }

    private static ExecResult source(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, 1, "source fileName");
        return ctx.interpreter().sourceFile(ctx.scope(), args.get(0));
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    private static ExecResult puts(CommandContext ctx, List<String> args) {
        List<String> rest = args;
        boolean newline = true;
        if (rest.size() > 1 && rest.get(0).equals("-nonewline")) {
            newline = false;
            rest = rest.subList(1, rest.size());
        }
        if (rest.size() == 2) {
            String channel = rest.get(0);
            if (!channel.equals("stdout") && !channel.equals("stderr")) {
                throw new IllegalArgumentException("can not find channel named \"" + channel + "\"");
            }
        } else if (rest.size() != 1) {
            throw new IllegalArgumentException("wrong # args: should be \"puts ?-nonewline? ?channelId? string\"");
        }
        PrintStream out = ctx.interpreter().config().output();
        out.print(rest.get(rest.size() - 1));
        if (newline) {
            out.print('\n');
        }
        out.flush();
        return ExecResult.EMPTY;
    }

    private static ExecResult global(CommandContext ctx, List<String> args) {
        log.debug("Ignoring global {}: procedures work on copies of their caller's variables", args);
        return ExecResult.EMPTY;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static String read(Scope scope, String name) {
        return scope.variable(name).orElseThrow(() ->
                new IllegalArgumentException("Variable '" + name + "' is not known in Tcl scope!"));
    }

    private static long integer(String text) {
        Number n = TclValues.parseNumber(text);
        if (!(n instanceof Long)) {
            throw new IllegalArgumentException("expected integer but got \"" + text + "\"");
        }
        return n.longValue();
    }

    private static void requireArgs(List<String> args, int min, int max, String usage) {
        if (args.size() < min || args.size() > max) {
            throw new IllegalArgumentException("wrong # args: should be \"" + usage + "\"");
        }
    }

    private static IllegalStateException loopCapExceeded(String loop, int cap) {
        return new IllegalStateException("Loop \"" + loop + "\" exceeded " + cap + " iterations");
    }
}
