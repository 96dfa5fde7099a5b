package org.kidoni.symbolic;

/**
 * Raised inside {@link Parser} when the input does not match the grammar. It never escapes
 * {@link Parser#parse()}, which reports failure as an empty result.
 */
public class ParseException extends RuntimeException {
    public ParseException(final String message, final int position) {
        super(message + " at offset " + position);
    }
}
