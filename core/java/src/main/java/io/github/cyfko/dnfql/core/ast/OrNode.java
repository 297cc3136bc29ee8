package io.github.cyfko.dnfql.core.ast;

import java.util.Objects;

/**
 * Logical disjunction of two sub-formulas.
 *
 * @param left  left operand
 * @param right right operand
 */
public record OrNode(FormulaNode left, FormulaNode right) implements FormulaNode {

    public OrNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
