package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.TclLists;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Procedure
 * -----------------------------------------------------------------------------
 * A user-defined command created by {@code proc} (or {@code block}).
 *
 * <h2>Call contract</h2>
 * <ul>
 *   <li>Arguments bind to parameters by position.</li>
 *   <li>A parameter without a default and without an argument is an arity
 *       error.</li>
 *   <li>A trailing parameter named {@code args} receives the remaining
 *       arguments joined with spaces, or the empty string.</li>
 *   <li>Without {@code args}, excess arguments are an arity error.</li>
 * </ul>
 */
public record Procedure(String name,
                        List<Parameter> parameters,
                        boolean variadic,
                        String body,
                        String source,
                        int line)
{
    public static final String VARIADIC = "args";

    /**
     * One formal parameter; {@code defaultValue} is null when the parameter
     * is required.
     */
    public record Parameter(String name, String defaultValue) {
        public Parameter {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Parameter name must not be empty");
            }
        }

        public boolean hasDefault() {
            return defaultValue != null;
        }
    }

    public Procedure {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(source, "source");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
    }

    /**
     * Builds a procedure from the parameter list as written after its name,
     * e.g. {@code first {second 0} args}.
     */
    public static Procedure parse(String name, String parameterList, String body, String source, int line) {
        List<String> specs = TclLists.split(parameterList);
        List<Parameter> parameters = new ArrayList<>();
        boolean variadic = false;
        for (int i = 0; i < specs.size(); i++) {
            List<String> spec = TclLists.split(specs.get(i));
            if (spec.size() == 1 && spec.get(0).equals(VARIADIC) && i == specs.size() - 1) {
                variadic = true;
            } else if (spec.size() == 1) {
                parameters.add(new Parameter(spec.get(0), null));
            } else if (spec.size() == 2) {
                parameters.add(new Parameter(spec.get(0), spec.get(1)));
            } else {
                throw new IllegalArgumentException("Argument \"" + specs.get(i)
                        + "\" of procedure " + name + " must be a name and an optional default value");
            }
        }
        return new Procedure(name, parameters, variadic, body, source, line);
    }

    /**
     * Maps {@code arguments} onto the parameters, {@code args} included.
     *
     * @throws IllegalArgumentException when the arguments do not fit
     */
    public Map<String, String> bind(List<String> arguments) {
        Map<String, String> bound = new LinkedHashMap<>();
        int next = 0;
        for (Parameter p : parameters) {
            if (next < arguments.size()) {
                bound.put(p.name(), arguments.get(next++));
            } else if (p.hasDefault()) {
                bound.put(p.name(), p.defaultValue());
            } else {
                throw arityError();
            }
        }
        if (variadic) {
            bound.put(VARIADIC, String.join(" ", arguments.subList(next, arguments.size())));
        } else if (next < arguments.size()) {
            throw arityError();
        }
        return bound;
    }

    public String usage() {
        StringBuilder sb = new StringBuilder(name);
        for (Parameter p : parameters) {
            sb.append(' ');
            sb.append(p.hasDefault() ? "?" + p.name() + "?" : p.name());
        }
        if (variadic) {
            sb.append(" ?arg ...?");
        }
        return sb.toString();
    }

    private IllegalArgumentException arityError() {
        return new IllegalArgumentException("wrong # args: should be \"" + usage() + "\"");
    }
}
