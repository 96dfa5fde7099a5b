package org.kidoni.symbolic;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Character.isWhitespace;

/**
 * Recursive descent parser for arithmetic expressions over numbers, named constants and variables.
 * <p>
 * Grammar, lowest precedence first, all operators left associative:
 * <pre>
 *  expr   = term { ('+' | '-') term }
 *  term   = factor { ('*' | '/') factor }
 *  factor = number | constant | identifier | '(' expr ')'
 * </pre>
 * There is no unary minus and no exponent operator. A word matching a {@link NamedConstant} becomes a
 * constant, any other word made of letters and digits becomes a variable. The whole input must be
 * consumed; anything left over after the outermost {@code expr} makes the parse fail.
 * <p>
 * Parentheses may nest at most {@value #MAX_DEPTH} levels deep; deeper input is rejected like any other
 * malformed input. The tree walks that consume the result are recursive as well, so a flat chain of
 * many thousands of operators ({@code x + x + ...}) parses, but can exhaust the stack in those walks.
 */
public class Parser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    // longest pushback is "e+" after a mantissa, plus the character that disproves the exponent
    private static final int PUSHBACK = 3;

    public static final int MAX_DEPTH = 1000;

    private final PushbackInputStream inputStream;
    private int position;
    private int depth;

    public Parser(final InputStream inputStream) {
        assert inputStream != null;
        this.inputStream = new PushbackInputStream(inputStream, PUSHBACK);
    }

    public Parser(final String text) {
        this(new ByteArrayInputStream(text.getBytes(StandardCharsets.US_ASCII)));
    }

    /**
     * @return the expression tree, or empty if the input is malformed
     */
    public Optional<Expr> parse() {
        try {
            Expr expr = parseExpr();

            skipWhitespace();
            int token = read();
            if (token != -1) {
                throw new ParseException("unexpected trailing input '" + (char) token + "'", position - 1);
            }

            return Optional.of(expr);
        }
        catch (IOException | ParseException e) {
            LOGGER.debug("rejecting expression: {}", e.getMessage());
        }

        return Optional.empty();
    }

    private Expr parseExpr() throws IOException {
        Expr left = parseTerm();

        int token;
        while ((token = peekOperator()) == '+' || token == '-') {
            read();
            left = new Expr.OpExpr(Op.of((char) token, left, parseTerm()));
        }

        return left;
    }

    private Expr parseTerm() throws IOException {
        Expr left = parseFactor();

        int token;
        while ((token = peekOperator()) == '*' || token == '/') {
            read();
            left = new Expr.OpExpr(Op.of((char) token, left, parseFactor()));
        }

        return left;
    }

    private Expr parseFactor() throws IOException {
        skipWhitespace();

        int token = read();
        if (token == -1) {
            throw new ParseException("operand missing", position);
        }

        if (isDigit(token) || token == '.') {
            unread(token);
            return readNumber();
        }

        if (isLetter(token)) {
            unread(token);
            return readWord();
        }

        if (token == '(') {
            if (++depth > MAX_DEPTH) {
                throw new ParseException("nesting too deep", position - 1);
            }
            Expr inner = parseExpr();
            --depth;
            skipWhitespace();
            if (read() != ')') {
                throw new ParseException("unmatched '('", position);
            }
            return inner;
        }

        throw new ParseException("unexpected token '" + (char) token + "'", position - 1);
    }

    private Expr.ConstExpr readNumber() throws IOException {
        final int start = position;
        StringBuilder buffer = new StringBuilder();

        int digits = readDigits(buffer);
        int token = read();
        if (token == '.') {
            buffer.append('.');
            digits += readDigits(buffer);
        }
        else {
            unread(token);
        }

        if (digits == 0) {
            throw new ParseException("malformed number", start);
        }

        readExponent(buffer);

        return new Expr.ConstExpr(Double.parseDouble(buffer.toString()));
    }

    // an exponent marker only counts when at least one digit follows it
    private void readExponent(final StringBuilder buffer) throws IOException {
        int marker = read();
        if (marker != 'e' && marker != 'E') {
            unread(marker);
            return;
        }

        int sign = read();
        if (sign != '+' && sign != '-') {
            unread(sign);
            sign = -1;
        }

        int token = read();
        unread(token);
        if (!isDigit(token)) {
            unread(sign);
            unread(marker);
            return;
        }

        buffer.append((char) marker);
        if (sign != -1) {
            buffer.append((char) sign);
        }
        readDigits(buffer);
    }

    private int readDigits(final StringBuilder buffer) throws IOException {
        int count = 0;
        int token;
        while (isDigit(token = read())) {
            buffer.append((char) token);
            ++count;
        }
        unread(token);
        return count;
    }

    private Expr readWord() throws IOException {
        final int start = position;
        StringBuilder buffer = new StringBuilder();

        int token;
        while (isLetter(token = read()) || isDigit(token) || token == '_') {
            buffer.append((char) token);
        }
        unread(token);

        String word = buffer.toString();
        Optional<NamedConstant> constant = NamedConstant.lookup(word);
        if (constant.isPresent()) {
            return new Expr.ConstExpr(constant.get().value());
        }

        // identifiers stop at '_', and nothing in the grammar may follow one directly
        int underscore = word.indexOf('_');
        if (underscore >= 0) {
            throw new ParseException("unexpected token '_'", start + underscore);
        }

        return new Expr.VarExpr(word);
    }

    private int peekOperator() throws IOException {
        skipWhitespace();
        int token = read();
        unread(token);
        return token;
    }

    private void skipWhitespace() throws IOException {
        int token;
        while (isWhitespace(token = read())) {
            // skip
        }
        unread(token);
    }

    private int read() throws IOException {
        int token = inputStream.read();
        if (token != -1) {
            ++position;
        }
        return token;
    }

    private void unread(final int token) throws IOException {
        if (token != -1) {
            inputStream.unread(token);
            --position;
        }
    }

    private static boolean isDigit(final int token) {
        return token >= '0' && token <= '9';
    }

    private static boolean isLetter(final int token) {
        return (token >= 'a' && token <= 'z') || (token >= 'A' && token <= 'Z');
    }
}
