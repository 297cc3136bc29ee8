package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.ast.AndNode;
import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.ast.FormulaVisitor;
import io.github.cyfko.dnfql.core.ast.LiteralNode;
import io.github.cyfko.dnfql.core.ast.NotNode;
import io.github.cyfko.dnfql.core.ast.OrNode;
import io.github.cyfko.dnfql.core.model.Clause;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a formula into disjunctive normal form.
 * <p>
 * The formula is first converted with {@link NnfConverter}; then
 * </p>
 * <ul>
 *   <li>a literal becomes one single-literal clause</li>
 *   <li>{@code X | Y} concatenates the clauses of X and Y</li>
 *   <li>{@code X & Y} is the cartesian product: every clause of X concatenated with every clause of Y</li>
 * </ul>
 * <p>
 * The AND distribution grows exponentially with ORs nested under ANDs. Callers bound it by
 * checking {@link #clauseCount(FormulaNode)}, which computes the size without expanding.
 * The output is not normalized, see {@link ClauseNormalizer}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaNode ast = parser.parse("X & (Y | Z)");
 * List<Clause> dnf = DnfConverter.toDnf(ast);  // [[X:EQ1 & Y:EQ1], [X:EQ1 & Z:EQ1]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DnfConverter {

    private DnfConverter() {}

    /**
     * @param node the formula
     * @return the clauses, in expansion order, as a new mutable list owned by the caller
     */
    public static List<Clause> toDnf(FormulaNode node) {
        return NnfConverter.toNnf(Objects.requireNonNull(node, "node is required")).accept(Expansion.INSTANCE);
    }

    /**
     * Number of clauses {@link #toDnf(FormulaNode)} would return, computed without expansion.
     *
     * @param node the formula
     * @return the clause count, saturated at {@link Long#MAX_VALUE}
     */
    public static long clauseCount(FormulaNode node) {
        return NnfConverter.toNnf(Objects.requireNonNull(node, "node is required")).accept(Counter.INSTANCE);
    }

    private static final class Expansion implements FormulaVisitor<List<Clause>> {
        private static final Expansion INSTANCE = new Expansion();

        @Override
        public List<Clause> visitLiteral(LiteralNode node) {
            List<Clause> clauses = new ArrayList<>(1);
            clauses.add(Clause.of(node.literal()));
            return clauses;
        }

        @Override
        public List<Clause> visitOr(OrNode node) {
            List<Clause> clauses = node.left().accept(this);
            clauses.addAll(node.right().accept(this));
            return clauses;
        }

        @Override
        public List<Clause> visitAnd(AndNode node) {
            List<Clause> left = node.left().accept(this);
            List<Clause> right = node.right().accept(this);
            List<Clause> product = new ArrayList<>(left.size() * right.size());
            for (Clause l : left) {
                for (Clause r : right) {
                    product.add(l.concat(r));
                }
            }
            return product;
        }

        @Override
        public List<Clause> visitNot(NotNode node) {
            throw new IllegalStateException("NOT node left after NNF conversion");
        }
    }

    private static final class Counter implements FormulaVisitor<Long> {
        private static final Counter INSTANCE = new Counter();

        @Override
        public Long visitLiteral(LiteralNode node) {
            return 1L;
        }

        @Override
        public Long visitOr(OrNode node) {
            long left = node.left().accept(this);
            long right = node.right().accept(this);
            return left > Long.MAX_VALUE - right ? Long.MAX_VALUE : left + right;
        }

        @Override
        public Long visitAnd(AndNode node) {
            long left = node.left().accept(this);
            long right = node.right().accept(this);
            return left > Long.MAX_VALUE / right ? Long.MAX_VALUE : left * right;
        }

        @Override
        public Long visitNot(NotNode node) {
            throw new IllegalStateException("NOT node left after NNF conversion");
        }
    }
}
