package io.github.cyfko.dnfql.core.ast;

/**
 * Immutable abstract syntax tree of a parsed formula.
 * <p>
 * The hierarchy is closed: a node is a {@link LiteralNode}, a {@link NotNode}, an
 * {@link AndNode} or an {@link OrNode}. Consumers traverse it through
 * {@link FormulaVisitor}, so adding a variant breaks every consumer at compile time
 * instead of falling through at runtime.
 * </p>
 *
 * <pre>{@code
 * // "A | !(B & C)"
 * FormulaNode node = new OrNode(
 *     new LiteralNode(Literal.of("A", EQ1)),
 *     new NotNode(new AndNode(
 *         new LiteralNode(Literal.of("B", EQ1)),
 *         new LiteralNode(Literal.of("C", EQ1)))));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FormulaNode permits LiteralNode, NotNode, AndNode, OrNode {

    /**
     * Dispatches to the visitor method matching this node's variant.
     *
     * @param visitor the visitor
     * @param <R>     the result type
     * @return the visitor's result
     */
    <R> R accept(FormulaVisitor<R> visitor);
}
