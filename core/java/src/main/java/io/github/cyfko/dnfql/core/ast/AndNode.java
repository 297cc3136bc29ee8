package io.github.cyfko.dnfql.core.ast;

import java.util.Objects;

/**
 * Logical conjunction of two sub-formulas.
 *
 * @param left  left operand
 * @param right right operand
 */
public record AndNode(FormulaNode left, FormulaNode right) implements FormulaNode {

    public AndNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
