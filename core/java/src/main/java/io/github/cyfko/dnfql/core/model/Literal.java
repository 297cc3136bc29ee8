package io.github.cyfko.dnfql.core.model;

import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;

import java.util.Objects;

/**
 * An atomic proposition: a named boolean variable compared against true or false.
 * <p>
 * Equality is structural over all three components, so two literals with the same
 * identifier and operation but different display names are distinct values. Clause
 * normalization only looks at identifier and operation.
 * </p>
 *
 * @param id          the variable identifier ({@code [A-Za-z0-9_]+})
 * @param displayName free text shown in reports, defaults to {@code id}
 * @param operation   the comparison
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Literal(String id, String displayName, LiteralOperation operation) {

    public Literal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        if (displayName == null) {
            displayName = id;
        }
    }

    /**
     * Shorthand for a literal whose display name is its identifier.
     */
    public static Literal of(String id, LiteralOperation operation) {
        return new Literal(id, id, operation);
    }

    /**
     * @return the literal with the negated operation
     * @throws FormulaSyntaxException if the operation is {@link LiteralOperation#EQ0}
     */
    public Literal negate() {
        if (operation == LiteralOperation.EQ0) {
            throw new FormulaSyntaxException("Negation of literal '" + id + "=0' is not supported");
        }
        return new Literal(id, displayName, operation.negate());
    }

    /**
     * @param displayName the new display name
     * @return a copy carrying another display name
     */
    public Literal withDisplayName(String displayName) {
        return new Literal(id, displayName, operation);
    }

    /**
     * @return {@code id:OPERATION}, the form used in postfix dumps and clause signatures
     */
    public String signature() {
        return id + ":" + operation.name();
    }
}
