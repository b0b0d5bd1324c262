package com.questrail.radar.console.interp;

import java.util.Objects;

/**
 * ExecResult
 * -----------------------------------------------------------------------------
 * Outcome of executing a console command or script.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Normal}: the command completed with a string result</li>
 *   <li>{@link Return}: {@code return} was executed; consumed where the
 *       enclosing procedure call completes</li>
 *   <li>{@link JumpBlock}: {@code gotoblock} ended the running block;
 *       consumed at the enclosing procedure or script boundary</li>
 *   <li>{@link Break} and {@link Continue}: consumed by the innermost loop</li>
 * </ul>
 * Anything other than {@link Normal} stops the script it occurs in.
 */
public sealed interface ExecResult
        permits ExecResult.Normal, ExecResult.Return, ExecResult.JumpBlock, ExecResult.Break, ExecResult.Continue
{
    ExecResult EMPTY = new Normal("");

    /**
     * String result carried by this outcome; empty for the loop signals.
     */
    String value();

    static ExecResult normal(String value) {
        return new Normal(value);
    }

    default boolean isNormal() {
        return this instanceof Normal;
    }

    record Normal(String value) implements ExecResult {
        public Normal {
            Objects.requireNonNull(value, "value");
        }
    }

    record Return(String value) implements ExecResult {
        public Return {
            Objects.requireNonNull(value, "value");
        }
    }

    /** {@code target} holds the words that named the next block. */
    record JumpBlock(String target) implements ExecResult {
        public JumpBlock {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public String value() {
            return "";
        }
    }

    record Break() implements ExecResult {
        @Override
        public String value() {
            return "";
        }
    }

    record Continue() implements ExecResult {
        @Override
        public String value() {
            return "";
        }
    }
}
