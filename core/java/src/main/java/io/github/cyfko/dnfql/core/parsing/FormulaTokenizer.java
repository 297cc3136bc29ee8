package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.config.OperatorConfig;
import io.github.cyfko.dnfql.core.config.OperatorToken;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single-pass tokenizer driven by an {@link OperatorConfig}.
 * <p>
 * At each non-blank position the configured expression operators are tried longest first.
 * Keyword operators ({@code AND}, {@code OR}, {@code NOT}) only match on word boundaries,
 * so {@code ANDREW=1} is one literal and not {@code AND} followed by {@code REW=1}.
 * When no operator matches, exactly one literal is consumed:
 * </p>
 * <pre>
 * literal := [ '!' ] identifier [ comparator ( '0' | '1' ) ]
 * identifier := [A-Za-z0-9_]+
 * comparator := any NEQ token | any EQ token     (NEQ tried first, so '!=' is never read as '=')
 * </pre>
 *
 * <p><strong>Performance characteristics:</strong></p>
 * <ul>
 *   <li>Time: O(n &times; k) where n = formula length and k = number of configured operators</li>
 *   <li>No regex matching, no backtracking</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = FormulaTokenizer.tokenize("A=1 AND (B<>1 | !C)", OperatorConfig.defaults());
 * // [LITERAL:A=1@0, AND:AND@4, LPAREN:(@8, LITERAL:B<>1@9, OR:|@14, NOT:!@16, LITERAL:C@17, RPAREN:)@18]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaTokenizer {

    private static final Logger log = Logger.getLogger(FormulaTokenizer.class.getName());

    private FormulaTokenizer() {}

    /**
     * Splits a formula into tokens.
     *
     * @param formula the formula text
     * @param config  the operator table
     * @return the tokens in source order, empty for a blank formula
     * @throws FormulaSyntaxException on an unrecognized character or a comparator not followed by 0 or 1
     */
    public static List<Token> tokenize(String formula, OperatorConfig config) {
        Objects.requireNonNull(formula, "formula is required");
        Objects.requireNonNull(config, "operator configuration is required");

        log.fine(() -> "Tokenizing formula of length " + formula.length());

        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < formula.length()) {
            if (Character.isWhitespace(formula.charAt(i))) {
                i++;
                continue;
            }

            OperatorToken operator = matchOperator(formula, i, config);
            if (operator != null) {
                tokens.add(new Token(TokenType.of(operator.role()), formula.substring(i, i + operator.length()), i));
                i += operator.length();
                continue;
            }

            int start = i;
            i = scanLiteral(formula, i, config);
            tokens.add(new Token(TokenType.LITERAL, formula.substring(start, i), start));
        }

        log.fine(() -> "Tokenized formula into " + tokens.size() + " tokens");
        return tokens;
    }

    private static OperatorToken matchOperator(String formula, int pos, OperatorConfig config) {
        for (OperatorToken operator : config.expressionOperators()) {
            if (matchesAt(formula, pos, operator)) {
                return operator;
            }
        }
        return null;
    }

    static boolean matchesAt(String formula, int pos, OperatorToken operator) {
        String token = operator.token();
        if (!operator.word()) {
            return formula.startsWith(token, pos);
        }

        int end = pos + token.length();
        if (end > formula.length() || !formula.regionMatches(true, pos, token, 0, token.length())) {
            return false;
        }
        boolean boundaryBefore = pos == 0 || !TextUtils.isIdentifierChar(formula.charAt(pos - 1));
        boolean boundaryAfter = end == formula.length() || !TextUtils.isIdentifierChar(formula.charAt(end));
        return boundaryBefore && boundaryAfter;
    }

    /**
     * @return the offset right after the literal starting at {@code start}
     */
    private static int scanLiteral(String formula, int start, OperatorConfig config) {
        int i = start;
        if (formula.charAt(i) == '!') {
            i++;
        }

        int identifierStart = i;
        while (i < formula.length() && TextUtils.isAsciiIdentifierChar(formula.charAt(i))) {
            i++;
        }
        if (i == identifierStart) {
            throw error(String.format("Unrecognized character '%c' at position %d", formula.charAt(start), start),
                    formula, start, config);
        }

        String comparator = matchComparator(formula, i, config);
        if (comparator == null) {
            return i;
        }

        i += comparator.length();
        if (i >= formula.length() || (formula.charAt(i) != '0' && formula.charAt(i) != '1')) {
            String got = i >= formula.length() ? "<end of formula>" : String.valueOf(formula.charAt(i));
            throw error(String.format("Expected 0 or 1 after comparator '%s' at position %d but got '%s'", comparator, i, got),
                    formula, i, config);
        }
        return i + 1;
    }

    private static String matchComparator(String formula, int pos, OperatorConfig config) {
        for (String neq : config.neqTokens()) {
            if (formula.startsWith(neq, pos)) return neq;
        }
        for (String eq : config.eqTokens()) {
            if (formula.startsWith(eq, pos)) return eq;
        }
        return null;
    }

    private static FormulaSyntaxException error(String message, String formula, int position, OperatorConfig config) {
        String near = TextUtils.near(formula, position);
        String full = String.format("%s near '%s'. Configured operators: %s", message, near, config.summary());
        log.warning(() -> "Tokenization failed: " + full);
        return new FormulaSyntaxException(full, position, near, null);
    }
}
