package io.github.cyfko.dnfql.core.model;

import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;

/**
 * The three comparisons a literal can express against a boolean variable.
 * <p>
 * Declaration order is the canonical sort priority inside a clause: {@code EQ0 < EQ1 < NEQ1}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LiteralOperation {
    /** {@code X=0}: the variable is false. */
    EQ0("NO"),
    /** {@code X}, {@code X=1}: the variable is true. */
    EQ1("Yes"),
    /** {@code !X}, {@code X<>1}, {@code X!=1}: the variable is anything but true. */
    NEQ1("Not Yes");

    private final String displayLabel;

    LiteralOperation(String displayLabel) {
        this.displayLabel = displayLabel;
    }

    /**
     * @return the label used in truth-table style reports
     */
    public String displayLabel() {
        return displayLabel;
    }

    /**
     * Negates the operation: {@code EQ1 <-> NEQ1}.
     * <p>
     * {@code EQ0} has no negation in this algebra ("equals neither" does not exist),
     * so negating it fails instead of approximating.
     * </p>
     *
     * @return the negated operation
     * @throws FormulaSyntaxException when called on {@link #EQ0}
     */
    public LiteralOperation negate() {
        return switch (this) {
            case EQ1 -> NEQ1;
            case NEQ1 -> EQ1;
            case EQ0 -> throw new FormulaSyntaxException("Negation of an '=0' comparison is not supported");
        };
    }
}
