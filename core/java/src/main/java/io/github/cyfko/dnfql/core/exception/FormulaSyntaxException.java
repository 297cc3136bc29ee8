package io.github.cyfko.dnfql.core.exception;

import io.github.cyfko.dnfql.core.api.FormulaParser;
import io.github.cyfko.dnfql.core.parsing.FormulaTokenizer;
import io.github.cyfko.dnfql.core.parsing.LiteralNormalizer;
import io.github.cyfko.dnfql.core.parsing.RecursiveDescentParser;

/**
 * Exception thrown when a formula cannot be tokenized, parsed or normalized.
 * <p>
 * Every failure of the formula engine that is caused by the formula text itself surfaces
 * as a {@code FormulaSyntaxException}. The message is meant to be shown as-is to the person
 * who maintains the formula, so it always carries the offending position and a short
 * window of the surrounding text.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unknown characters:</strong> a character that starts neither an operator nor a literal</li>
 *   <li><strong>Incomplete comparisons:</strong> {@code A=} or {@code A<>2}</li>
 *   <li><strong>Grammar errors:</strong> missing operands, unmatched parentheses, trailing tokens</li>
 *   <li><strong>Invalid literals:</strong> {@code A<>0}, {@code A>=1}, {@code XOR} or {@code IF} keywords</li>
 *   <li><strong>Unsupported negation:</strong> {@code NOT A=0}</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("A&B");   // with only "AND" configured
 * // → "Unrecognized character '&' at position 1 near 'A&B'. Configured operators: {AND=[AND], ...}"
 *
 * parser.parse("(A | B");
 * // → "Expected RPAREN but reached end of formula at position 6 near '(A | B'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaParser
 * @see FormulaTokenizer
 * @see RecursiveDescentParser
 * @see LiteralNormalizer
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;
    private final String near;

    /**
     * Constructor with an explanatory error message and no positional information.
     *
     * @param message the message describing the cause of the exception
     */
    public FormulaSyntaxException(String message) {
        this(message, -1, null, null);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public FormulaSyntaxException(String message, Throwable cause) {
        this(message, -1, null, cause);
    }

    /**
     * Constructor with positional information.
     * <p>
     * The message is expected to already mention the position and context, the
     * extra arguments only make them available to callers that render their own report.
     * </p>
     *
     * @param message  the full diagnostic message
     * @param position zero-based offset of the failure in the formula, {@code -1} if unknown
     * @param near     the text window around {@code position}
     * @param cause    the original cause, may be {@code null}
     */
    public FormulaSyntaxException(String message, int position, String near, Throwable cause) {
        super(message, cause);
        this.position = position;
        this.near = near;
    }

    /**
     * @return zero-based offset of the failure in the formula, or {@code -1} when the error is not positional
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the text surrounding the failure, or {@code null} when the error is not positional
     */
    public String getNear() {
        return near;
    }
}
