package com.questrail.radar.console.parser;

/**
 * How a console word was delimited in the source, which decides the
 * substitutions applied to it before the command runs.
 */
public enum WordKind
{
    /** Undelimited text; command, variable and backslash substitution apply. */
    BARE,

    /** Text between double quotes; same substitutions as {@link #BARE}. */
    QUOTED,

    /** Text between braces; taken literally. */
    BRACED,

    /** A whole word in brackets; replaced by the result of the nested script. */
    BRACKETED;

    public boolean isLiteral() {
        return this == BRACED;
    }
}
