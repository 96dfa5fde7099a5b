package org.kidoni.symbolic;

/**
 * Bottom-up constant folding. An operator whose operands are both constants after folding is
 * replaced by a constant holding the result. No other rewrites are made, so {@code x * 1} and
 * {@code x + 0} are left as written.
 */
public class Simplifier {

    public Expr simplify(final Expr expr) {
        if (expr instanceof Expr.OpExpr operation) {
            Op op = operation.op();
            Expr left = simplify(op.left());
            Expr right = simplify(op.right());

            if (left instanceof Expr.ConstExpr a && right instanceof Expr.ConstExpr b) {
                return new Expr.ConstExpr(op.apply(a.value(), b.value()));
            }

            return new Expr.OpExpr(op.with(left, right));
        }

        return expr == null ? null : expr.copy();
    }
}
