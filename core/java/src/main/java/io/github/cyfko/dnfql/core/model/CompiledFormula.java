package io.github.cyfko.dnfql.core.model;

import io.github.cyfko.dnfql.core.ast.FormulaNode;

import java.util.List;
import java.util.Objects;

/**
 * Result of compiling a formula: its tree, its normalized DNF and the variables it references.
 *
 * @param formula   the source text
 * @param ast       the parsed formula tree, negations not yet pushed down
 * @param clauses   the normalized DNF clauses
 * @param variables distinct variables in first-seen order, display name equal to the identifier
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompiledFormula(String formula, FormulaNode ast, List<Clause> clauses, List<Literal> variables) {

    public CompiledFormula {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(ast, "ast");
        clauses = List.copyOf(Objects.requireNonNull(clauses, "clauses"));
        variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    public int clauseCount() {
        return clauses.size();
    }
}
