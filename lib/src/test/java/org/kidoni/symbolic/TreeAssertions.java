package org.kidoni.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertTrue;

final class TreeAssertions {
    private TreeAssertions() {
    }

    /**
     * @return every node instance reachable from {@code root}, pre-order
     */
    static List<Expr> nodes(final Expr root) {
        List<Expr> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    /**
     * Asserts that no node instance occurs twice in {@code tree} and that none is reachable from
     * any of {@code others}.
     */
    static void assertNoSharedNodes(final Expr tree, final Expr... others) {
        Set<Expr> foreign = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Expr other : others) {
            foreign.addAll(nodes(other));
        }

        Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Expr node : nodes(tree)) {
            assertTrue(seen.add(node), () -> "node appears twice: " + node);
            assertTrue(!foreign.contains(node), () -> "node shared with another tree: " + node);
        }
    }

    private static void collect(final Expr expr, final List<Expr> nodes) {
        nodes.add(expr);
        if (expr instanceof Expr.OpExpr operation) {
            collect(operation.left(), nodes);
            collect(operation.right(), nodes);
        }
    }
}
