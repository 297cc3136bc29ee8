package io.github.cyfko.dnfql.core.config;

import java.util.Optional;

/**
 * Logical roles an operator token can play in a formula.
 * <p>
 * The declaration order is significant: it is the order used by
 * {@link OperatorConfig#summary()} and the tie-breaker between expression operators
 * of the same length.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorRole {
    AND(true, true),
    OR(true, true),
    NOT(false, true),
    EQ(true, false),
    NEQ(true, false),
    LPAREN(true, true),
    RPAREN(true, true);

    private final boolean required;
    private final boolean expression;

    OperatorRole(boolean required, boolean expression) {
        this.required = required;
        this.expression = expression;
    }

    /**
     * @return {@code true} if a configuration must declare at least one token for this role
     */
    public boolean isRequired() {
        return required;
    }

    /**
     * Expression roles produce their own token; comparator roles (EQ, NEQ) only
     * appear as suffixes inside literals.
     *
     * @return {@code true} for AND, OR, NOT, LPAREN and RPAREN
     */
    public boolean isExpression() {
        return expression;
    }

    /**
     * Resolves a configuration document key. Keys are matched exactly.
     *
     * @param key the document key
     * @return the matching role, or empty if the key is unknown
     */
    public static Optional<OperatorRole> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (OperatorRole role : values()) {
            if (role.name().equals(key)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
