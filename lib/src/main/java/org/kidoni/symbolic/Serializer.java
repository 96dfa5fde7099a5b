package org.kidoni.symbolic;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders a tree as {@code <left> <op> <right>} without parentheses.
 * <p>
 * Precedence is not written back, so the text of a mixed-precedence tree does not necessarily
 * re-parse to the same shape: {@code (x + y) * 2} renders as {@code x + y * 2}.
 */
public final class Serializer {
    // integral values below this magnitude print without a fraction or exponent
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    private Serializer() {
    }

    public static String toString(final Expr expr) {
        StringBuilder builder = new StringBuilder();
        render(expr, builder);
        return builder.toString();
    }

    /**
     * Renders into at most {@code capacity} characters, dropping whatever does not fit.
     */
    public static String toString(final Expr expr, final int capacity) {
        BoundedAppender appender = new BoundedAppender(capacity);
        render(expr, appender);
        return appender.toString();
    }

    /**
     * Renders into a caller-owned buffer. At most {@code buffer.length - 1} characters are written,
     * followed by a {@code '\0'} terminator.
     *
     * @return number of characters written, not counting the terminator
     */
    public static int write(final Expr expr, final char[] buffer) {
        if (expr == null || buffer == null || buffer.length == 0) {
            return 0;
        }

        BoundedAppender appender = new BoundedAppender(buffer.length - 1);
        render(expr, appender);
        appender.copyTo(buffer);
        buffer[appender.length()] = '\0';
        return appender.length();
    }

    /**
     * Formats a constant so that {@link Double#parseDouble} gives back the same value. Integral
     * values print without a trailing {@code .0}.
     */
    public static String formatConstant(final double value) {
        if (value == Math.rint(value) && Math.abs(value) < PLAIN_INTEGER_LIMIT
                && Double.doubleToRawLongBits(value) != Double.doubleToRawLongBits(-0.0)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static void render(final Expr expr, final Appendable out) {
        try {
            renderNode(expr, out);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void renderNode(final Expr expr, final Appendable out) throws IOException {
        if (expr == null) {
            return;
        }

        if (expr instanceof Expr.OpExpr operation) {
            Op op = operation.op();
            renderNode(op.left(), out);
            out.append(' ').append(op.symbol()).append(' ');
            renderNode(op.right(), out);
        }
        else {
            out.append(expr.toString());
        }
    }
}
