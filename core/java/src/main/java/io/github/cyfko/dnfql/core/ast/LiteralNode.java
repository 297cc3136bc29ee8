package io.github.cyfko.dnfql.core.ast;

import io.github.cyfko.dnfql.core.model.Literal;

import java.util.Objects;

/**
 * Leaf node wrapping a {@link Literal}.
 *
 * @param literal the literal
 */
public record LiteralNode(Literal literal) implements FormulaNode {

    public LiteralNode {
        Objects.requireNonNull(literal, "literal");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
