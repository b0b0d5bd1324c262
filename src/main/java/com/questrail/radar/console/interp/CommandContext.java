package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.ConsoleCommand;

import java.util.Objects;

/**
 * What a {@link CommandHandler} gets to work with besides its arguments.
 */
public record CommandContext(ConsoleInterpreter interpreter, Scope scope, ConsoleCommand command)
{
    public CommandContext {
        Objects.requireNonNull(interpreter, "interpreter");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(command, "command");
    }

    /**
     * Evaluates {@code script}, the text of argument {@code argIndex}, in this
     * context's scope. Errors are located from that argument's line on.
     */
    public ExecResult eval(String script, int argIndex) {
        return interpreter.evalScript(scope, script, command.source(), argumentLine(argIndex));
    }

    /**
     * Line on which argument {@code argIndex} starts; the command's line for
     * arguments that did not come from one of its words.
     */
    public int argumentLine(int argIndex) {
        int word = argIndex + 1;
        return word > 0 && word < command.size() ? command.word(word).line() : command.line();
    }

    /**
     * Evaluates {@code expression}, reporting errors at argument
     * {@code argIndex}.
     */
    public String expr(String expression, int argIndex) {
        return interpreter.evaluateExpression(scope, expression, command, argIndex + 1);
    }
}
