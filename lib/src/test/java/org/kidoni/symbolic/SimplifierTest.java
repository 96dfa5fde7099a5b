package org.kidoni.symbolic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.symbolic.TreeAssertions.assertNoSharedNodes;

class SimplifierTest {
    private final Simplifier simplifier = new Simplifier();

    private static Expr parse(final String text) {
        return new Parser(text).parse().orElseThrow();
    }

    @Test
    void foldsConstants() {
        Expr simplified = simplifier.simplify(parse("2 + 2"));
        assertEquals(Expr.constant(4), simplified);
        assertEquals("4", simplified.toString());

        assertEquals(Expr.constant(21), simplifier.simplify(parse("(1 + 2) * (3 + 4)")));
    }

    @ParameterizedTest
    @CsvSource({
            "'x + 2 * 3', 'x + 6'",
            "'2 + 3 * x', '2 + 3 * x'",
            "'x * 1', 'x * 1'",
            "'x + 0', 'x + 0'",
            "'x + 1 + 2', 'x + 1 + 2'",
            "'(4 - 1) * x / (10 / 5)', '3 * x / 2'",
            "'y', 'y'",
    })
    void foldsOnlyConstantOperands(final String text, final String expected) {
        assertEquals(expected, simplifier.simplify(parse(text)).toString());
    }

    @Test
    void divisionByZeroFoldsToNaN() {
        Expr.ConstExpr folded = assertInstanceOf(Expr.ConstExpr.class, simplifier.simplify(parse("1 / 0")));
        assertTrue(Double.isNaN(folded.value()));

        folded = assertInstanceOf(Expr.ConstExpr.class, simplifier.simplify(parse("1 / (2 - 2) + 3")));
        assertTrue(Double.isNaN(folded.value()));
    }

    @Test
    void foldsPower() {
        assertEquals(Expr.constant(8), simplifier.simplify(Expr.pow(Expr.constant(2), Expr.constant(3))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2 + 2", "x * (3 - 1)", "x + 1 + 2", "1 / 0 * x", "(1 + 2) * (x - 4 / 2)", "pi * e"})
    void idempotent(final String text) {
        Expr once = simplifier.simplify(parse(text));
        assertEquals(once, simplifier.simplify(once));
    }

    @Test
    void resultIsIndependentOfInput() {
        Expr input = parse("x * (1 + 2) - y / x");
        Expr before = input.copy();

        Expr simplified = simplifier.simplify(input);

        assertEquals(before, input);
        assertNoSharedNodes(simplified, input);
    }
}
