package org.kidoni.symbolic;

import java.util.Optional;

/**
 * Static entry points for the expression engine.
 * <p>
 * Every tree-returning method hands back a fresh tree that shares no nodes with its argument.
 * Malformed input never throws: parsing and differentiation report failure as an empty
 * {@link Optional}, undefined arithmetic as {@link Double#NaN}.
 */
public final class Symbolic {
    private Symbolic() {
    }

    public static Optional<Expr> parse(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        return new Parser(text).parse();
    }

    /**
     * @param lookup variable values; {@code null} makes every variable NaN
     * @return the value, NaN for a {@code null} tree
     */
    public static double evaluate(final Expr expr, final VariableLookup lookup) {
        return new Evaluator(lookup).evaluate(expr);
    }

    public static Optional<Expr> differentiate(final Expr expr, final String variable) {
        return new Differentiator(variable).differentiate(expr);
    }

    public static Expr simplify(final Expr expr) {
        return new Simplifier().simplify(expr);
    }

    public static Expr substitute(final Expr expr, final String variable, final double value) {
        return new Substitution(variable, value).apply(expr);
    }

    public static String toString(final Expr expr) {
        return Serializer.toString(expr);
    }

    /**
     * @see Serializer#write(Expr, char[])
     */
    public static int toString(final Expr expr, final char[] buffer) {
        return Serializer.write(expr, buffer);
    }
}
