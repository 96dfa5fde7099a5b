package org.kidoni.symbolic;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.symbolic.Expr.add;
import static org.kidoni.symbolic.Expr.constant;
import static org.kidoni.symbolic.Expr.div;
import static org.kidoni.symbolic.Expr.mul;
import static org.kidoni.symbolic.Expr.sub;

/**
 * Structural differentiation with respect to one variable.
 * <pre>
 *  d[c]     = 0
 *  d[x]     = 1, d[y] = 0
 *  d[u + v] = du + dv
 *  d[u - v] = du - dv
 *  d[u * v] = du * v + u * dv
 *  d[u / v] = (du * v - u * dv) / (v * v)
 * </pre>
 * The result is not simplified. Each occurrence of {@code u} or {@code v} in the result is its own
 * copy, so the derivative shares no node with the input or with itself.
 */
public class Differentiator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Differentiator.class);

    private final String variable;

    public Differentiator(final String variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    /**
     * @return the derivative, or empty if the tree contains an operator without a rule
     */
    public Optional<Expr> differentiate(final Expr expr) {
        if (expr == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(derive(expr));
        }
        catch (DifferentiationException e) {
            LOGGER.debug("cannot differentiate {} by {}: {}", expr, variable, e.getMessage());
            return Optional.empty();
        }
    }

    private Expr derive(final Expr expr) {
        if (expr instanceof Expr.ConstExpr) {
            return constant(0.0);
        }
        if (expr instanceof Expr.VarExpr named) {
            return constant(named.isNamed(variable) ? 1.0 : 0.0);
        }

        Op op = ((Expr.OpExpr) expr).op();
        Expr u = op.left();
        Expr v = op.right();

        if (op instanceof Op.AddOp) {
            return add(derive(u), derive(v));
        }
        if (op instanceof Op.SubOp) {
            return sub(derive(u), derive(v));
        }
        if (op instanceof Op.MulOp) {
            return add(mul(derive(u), v.copy()), mul(u.copy(), derive(v)));
        }
        if (op instanceof Op.DivOp) {
            Expr numerator = sub(mul(derive(u), v.copy()), mul(u.copy(), derive(v)));
            return div(numerator, mul(v.copy(), v.copy()));
        }

        throw new DifferentiationException(op);
    }
}
