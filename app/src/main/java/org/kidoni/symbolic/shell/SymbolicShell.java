package org.kidoni.symbolic.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.kidoni.symbolic.Expr;
import org.kidoni.symbolic.Serializer;
import org.kidoni.symbolic.Symbolic;
import org.kidoni.symbolic.VariableLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one expression per line and prints its folded form, its derivative and its value.
 * <pre>
 *  $ echo "x * x + 2 * 3" | SYMBOLIC_DIFF_VAR=x symbolic x=3
 *  expr:       x * x + 2 * 3
 *  simplified: x * x + 6
 *  d/dx:       1 * x + x * 1 + 0
 *  value:      15
 * </pre>
 */
public class SymbolicShell {
    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolicShell.class);

    private final ShellConfig config;
    private final VariableLookup lookup;
    private final PrintStream out;

    public SymbolicShell(final ShellConfig config, final PrintStream out) {
        this.config = config;
        this.lookup = VariableLookup.of(config.bindings());
        this.out = out;
    }

    public static void main(String[] args) {
        final ShellConfig config;
        try {
            config = ShellConfig.from(args, System.getenv());
        }
        catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        LOGGER.debug("starting with {}", config);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.US_ASCII))) {
            new SymbolicShell(config, System.out).run(reader);
        }
        catch (IOException e) {
            LOGGER.error("failed reading input", e);
            System.exit(1);
        }
    }

    public void run(final BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            process(line);
        }
    }

    void process(final String line) {
        if (line.isBlank()) {
            return;
        }

        Optional<Expr> parsed = Symbolic.parse(line);
        if (parsed.isEmpty()) {
            out.println("invalid expression: " + line.trim());
            return;
        }

        Expr expr = parsed.get();
        String derivative = Symbolic.differentiate(expr, config.variable())
                .map(Symbolic::simplify)
                .map(this::render)
                .orElse("undefined");

        out.println("expr:       " + render(expr));
        out.println("simplified: " + render(Symbolic.simplify(expr)));
        out.println("d/d" + config.variable() + ":" + " ".repeat(Math.max(1, 8 - config.variable().length())) + derivative);
        out.println("value:      " + Serializer.formatConstant(Symbolic.evaluate(expr, lookup)));
    }

    private String render(final Expr expr) {
        char[] buffer = new char[config.outputCapacity()];
        int length = Symbolic.toString(expr, buffer);
        return new String(buffer, 0, length);
    }
}
