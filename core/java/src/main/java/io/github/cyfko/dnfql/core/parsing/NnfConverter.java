package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.ast.AndNode;
import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.ast.FormulaVisitor;
import io.github.cyfko.dnfql.core.ast.LiteralNode;
import io.github.cyfko.dnfql.core.ast.NotNode;
import io.github.cyfko.dnfql.core.ast.OrNode;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;

import java.util.Objects;

/**
 * Converts a formula to negation normal form: negations are pushed down to the literals
 * with De Morgan's laws and absorbed into the literal operation.
 * <ul>
 *   <li>{@code !(A=1)} → {@code A<>1}, {@code !(A<>1)} → {@code A=1}</li>
 *   <li>{@code !!X} → {@code X}</li>
 *   <li>{@code !(X & Y)} → {@code !X | !Y}</li>
 *   <li>{@code !(X | Y)} → {@code !X & !Y}</li>
 * </ul>
 * <p>The result contains no {@link NotNode}. Negating an {@code =0} literal is rejected.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NnfConverter implements FormulaVisitor<FormulaNode> {

    private static final NnfConverter INSTANCE = new NnfConverter();

    private NnfConverter() {}

    /**
     * @param node the formula
     * @return an equivalent formula without {@link NotNode}
     * @throws FormulaSyntaxException if an {@code =0} literal is negated
     */
    public static FormulaNode toNnf(FormulaNode node) {
        return Objects.requireNonNull(node, "node is required").accept(INSTANCE);
    }

    @Override
    public FormulaNode visitLiteral(LiteralNode node) {
        return node;
    }

    @Override
    public FormulaNode visitAnd(AndNode node) {
        return new AndNode(toNnf(node.left()), toNnf(node.right()));
    }

    @Override
    public FormulaNode visitOr(OrNode node) {
        return new OrNode(toNnf(node.left()), toNnf(node.right()));
    }

    @Override
    public FormulaNode visitNot(NotNode node) {
        return node.child().accept(Negation.INSTANCE);
    }

    /**
     * Computes the NNF of {@code NOT child}, dispatching on the child.
     */
    private static final class Negation implements FormulaVisitor<FormulaNode> {
        private static final Negation INSTANCE = new Negation();

        @Override
        public FormulaNode visitLiteral(LiteralNode node) {
            return new LiteralNode(node.literal().negate());
        }

        @Override
        public FormulaNode visitNot(NotNode node) {
            return toNnf(node.child());
        }

        @Override
        public FormulaNode visitAnd(AndNode node) {
            return new OrNode(toNnf(new NotNode(node.left())), toNnf(new NotNode(node.right())));
        }

        @Override
        public FormulaNode visitOr(OrNode node) {
            return new AndNode(toNnf(new NotNode(node.left())), toNnf(new NotNode(node.right())));
        }
    }
}
