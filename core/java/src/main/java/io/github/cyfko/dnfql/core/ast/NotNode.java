package io.github.cyfko.dnfql.core.ast;

import java.util.Objects;

/**
 * Logical negation of a sub-formula.
 *
 * @param child the negated node
 */
public record NotNode(FormulaNode child) implements FormulaNode {

    public NotNode {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
