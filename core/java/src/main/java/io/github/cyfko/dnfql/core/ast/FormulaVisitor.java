package io.github.cyfko.dnfql.core.ast;

/**
 * Exhaustive visitor over {@link FormulaNode} variants.
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaVisitor<R> {

    R visitLiteral(LiteralNode node);

    R visitNot(NotNode node);

    R visitAnd(AndNode node);

    R visitOr(OrNode node);
}
