package org.kidoni.symbolic;

import java.util.Objects;

public class Substitution {
    private final String variable;
    private final double value;

    public Substitution(final String variable, final double value) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.value = value;
    }

    public Expr apply(final Expr expr) {
        if (expr instanceof Expr.VarExpr named && named.isNamed(variable)) {
            return new Expr.ConstExpr(value);
        }
        if (expr instanceof Expr.OpExpr operation) {
            Op op = operation.op();
            return new Expr.OpExpr(op.with(apply(op.left()), apply(op.right())));
        }

        return expr == null ? null : expr.copy();
    }
}
