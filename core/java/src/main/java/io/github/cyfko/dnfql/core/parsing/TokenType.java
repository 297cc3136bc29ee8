package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.config.OperatorRole;

/**
 * Kinds of tokens produced by {@link FormulaTokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    LITERAL;

    /**
     * Maps an expression operator role to the token it produces.
     *
     * @param role an expression role
     * @return the token type
     * @throws IllegalArgumentException for comparator roles, which never produce a token of their own
     */
    public static TokenType of(OperatorRole role) {
        return switch (role) {
            case AND -> AND;
            case OR -> OR;
            case NOT -> NOT;
            case LPAREN -> LPAREN;
            case RPAREN -> RPAREN;
            case EQ, NEQ -> throw new IllegalArgumentException("Comparator role " + role + " does not produce a token");
        };
    }
}
