package org.kidoni.symbolic.shell;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shell settings. The differentiation variable and the render buffer size come from the environment,
 * variable bindings come from {@code name=value} command line arguments.
 *
 * @param variable       variable to differentiate by
 * @param outputCapacity size of the render buffer, terminator included
 * @param bindings       variable values used for evaluation
 */
public record ShellConfig(String variable, int outputCapacity, Map<String, Double> bindings) {
    public static final String DIFF_VAR_ENV = "SYMBOLIC_DIFF_VAR";
    public static final String OUTPUT_CAPACITY_ENV = "SYMBOLIC_OUTPUT_CAPACITY";

    private static final String DEFAULT_VARIABLE = "x";
    private static final int DEFAULT_OUTPUT_CAPACITY = 256;

    public ShellConfig {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("differentiation variable must not be blank");
        }
        if (outputCapacity < 1) {
            throw new IllegalArgumentException("output capacity must be positive: " + outputCapacity);
        }
        bindings = Map.copyOf(bindings);
    }

    public static ShellConfig from(final String[] args, final Map<String, String> env) {
        String variable = env.get(DIFF_VAR_ENV);
        String capacity = env.get(OUTPUT_CAPACITY_ENV);

        return new ShellConfig(
                variable != null ? variable.trim() : DEFAULT_VARIABLE,
                capacity != null ? parseCapacity(capacity) : DEFAULT_OUTPUT_CAPACITY,
                parseBindings(args));
    }

    private static int parseCapacity(final String value) {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(OUTPUT_CAPACITY_ENV + " is not an integer: " + value, e);
        }
    }

    private static Map<String, Double> parseBindings(final String[] args) {
        Map<String, Double> bindings = new LinkedHashMap<>();
        for (String arg : args) {
            int split = arg.indexOf('=');
            if (split < 1) {
                throw new IllegalArgumentException("expected name=value but got: " + arg);
            }

            String name = arg.substring(0, split).trim();
            String value = arg.substring(split + 1).trim();
            try {
                bindings.put(name, Double.parseDouble(value));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number for " + name + ": " + value, e);
            }
        }
        return bindings;
    }
}
