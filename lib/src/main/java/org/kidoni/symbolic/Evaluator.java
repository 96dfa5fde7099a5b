package org.kidoni.symbolic;

/**
 * Post-order numeric interpreter. Both operands are always evaluated. Undefined results
 * (division by zero, unresolved variables) are NaN and propagate through the remaining arithmetic.
 */
public class Evaluator {
    private final VariableLookup lookup;

    public Evaluator(final VariableLookup lookup) {
        this.lookup = lookup != null ? lookup : VariableLookup.undefined();
    }

    public double evaluate(final Expr expr) {
        if (expr instanceof Expr.ConstExpr constant) {
            return constant.value();
        }
        if (expr instanceof Expr.VarExpr variable) {
            return lookup.valueOf(variable.name());
        }
        if (expr instanceof Expr.OpExpr operation) {
            Op op = operation.op();
            double a = evaluate(op.left());
            double b = evaluate(op.right());
            return op.apply(a, b);
        }

        return Double.NaN;
    }
}
