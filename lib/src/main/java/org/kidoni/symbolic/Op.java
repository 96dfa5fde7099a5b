package org.kidoni.symbolic;

import java.util.Objects;

/**
 * Binary operator applied to two owned operands. {@link PowOp} is never parsed and has no
 * differentiation rule; build it with {@link Expr#pow}.
 */
public sealed interface Op {
    Expr left();

    Expr right();

    char symbol();

    double apply(double a, double b);

    Op with(Expr left, Expr right);

    static Op of(final char symbol, final Expr left, final Expr right) {
        return switch (symbol) {
            case '+' -> new AddOp(left, right);
            case '-' -> new SubOp(left, right);
            case '*' -> new MulOp(left, right);
            case '/' -> new DivOp(left, right);
            default -> throw new IllegalArgumentException("unknown operator: " + symbol);
        };
    }

    record AddOp(Expr left, Expr right) implements Op {
        public AddOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public char symbol() {
            return '+';
        }

        @Override
        public double apply(final double a, final double b) {
            return a + b;
        }

        @Override
        public AddOp with(final Expr left, final Expr right) {
            return new AddOp(left, right);
        }

        @Override
        public String toString() {
            return left + " + " + right;
        }
    }

    record SubOp(Expr left, Expr right) implements Op {
        public SubOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public char symbol() {
            return '-';
        }

        @Override
        public double apply(final double a, final double b) {
            return a - b;
        }

        @Override
        public SubOp with(final Expr left, final Expr right) {
            return new SubOp(left, right);
        }

        @Override
        public String toString() {
            return left + " - " + right;
        }
    }

    record MulOp(Expr left, Expr right) implements Op {
        public MulOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public char symbol() {
            return '*';
        }

        @Override
        public double apply(final double a, final double b) {
            return a * b;
        }

        @Override
        public MulOp with(final Expr left, final Expr right) {
            return new MulOp(left, right);
        }

        @Override
        public String toString() {
            return left + " * " + right;
        }
    }

    /**
     * Division by exactly zero (either sign) yields NaN instead of an infinity.
     */
    record DivOp(Expr left, Expr right) implements Op {
        public DivOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public char symbol() {
            return '/';
        }

        @Override
        public double apply(final double a, final double b) {
            return b != 0.0 ? a / b : Double.NaN;
        }

        @Override
        public DivOp with(final Expr left, final Expr right) {
            return new DivOp(left, right);
        }

        @Override
        public String toString() {
            return left + " / " + right;
        }
    }

    record PowOp(Expr left, Expr right) implements Op {
        public PowOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public char symbol() {
            return '^';
        }

        @Override
        public double apply(final double a, final double b) {
            return Math.pow(a, b);
        }

        @Override
        public PowOp with(final Expr left, final Expr right) {
            return new PowOp(left, right);
        }

        @Override
        public String toString() {
            return left + " ^ " + right;
        }
    }
}
