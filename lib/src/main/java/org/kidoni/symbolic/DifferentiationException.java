package org.kidoni.symbolic;

public class DifferentiationException extends RuntimeException {
    public DifferentiationException(final Op op) {
        super("no differentiation rule for operator '" + op.symbol() + "'");
    }
}
