package org.kidoni.symbolic;

import java.util.Objects;

/**
 * A node of a symbolic expression tree.
 * <p>
 * Nodes are immutable records and compare structurally. A tree never shares a node instance with
 * another tree, and no instance appears twice within one tree: every operation that builds a tree
 * from an existing one copies the nodes it reuses.
 */
public sealed interface Expr {

    // structurally equal, built entirely from fresh nodes
    Expr copy();

    static ConstExpr constant(final double value) {
        return new ConstExpr(value);
    }

    static VarExpr variable(final String name) {
        return new VarExpr(name);
    }

    static OpExpr add(final Expr left, final Expr right) {
        return new OpExpr(new Op.AddOp(left, right));
    }

    static OpExpr sub(final Expr left, final Expr right) {
        return new OpExpr(new Op.SubOp(left, right));
    }

    static OpExpr mul(final Expr left, final Expr right) {
        return new OpExpr(new Op.MulOp(left, right));
    }

    static OpExpr div(final Expr left, final Expr right) {
        return new OpExpr(new Op.DivOp(left, right));
    }

    static OpExpr pow(final Expr left, final Expr right) {
        return new OpExpr(new Op.PowOp(left, right));
    }

    record ConstExpr(double value) implements Expr {
        @Override
        public ConstExpr copy() {
            return new ConstExpr(value);
        }

        @Override
        public String toString() {
            return Serializer.formatConstant(value);
        }
    }

    /**
     * A named variable. Names longer than {@link #MAX_NAME_LENGTH} characters are truncated.
     */
    record VarExpr(String name) implements Expr {
        public static final int MAX_NAME_LENGTH = 31;

        public VarExpr {
            name = truncate(Objects.requireNonNull(name, "name"));
        }

        static String truncate(final String name) {
            return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
        }

        public boolean isNamed(final String other) {
            return other != null && name.equals(truncate(other));
        }

        @Override
        public VarExpr copy() {
            return new VarExpr(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record OpExpr(Op op) implements Expr {
        public OpExpr {
            Objects.requireNonNull(op, "op");
        }

        public Expr left() {
            return op.left();
        }

        public Expr right() {
            return op.right();
        }

        @Override
        public OpExpr copy() {
            return new OpExpr(op.with(op.left().copy(), op.right().copy()));
        }

        @Override
        public String toString() {
            return op.toString();
        }
    }
}
