package io.github.cyfko.dnfql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One conjunctive term of a disjunctive normal form: its literals are implicitly AND-ed.
 *
 * @param literals the literals, in order; never {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Clause(List<Literal> literals) {

    public Clause {
        literals = List.copyOf(Objects.requireNonNull(literals, "literals"));
    }

    public static Clause of(Literal... literals) {
        return new Clause(List.of(literals));
    }

    /**
     * Concatenation used by AND distribution: this clause's literals followed by the other's.
     *
     * @param other the right-hand clause
     * @return a new clause
     */
    public Clause concat(Clause other) {
        List<Literal> merged = new ArrayList<>(literals.size() + other.literals.size());
        merged.addAll(literals);
        merged.addAll(other.literals);
        return new Clause(merged);
    }

    public int size() {
        return literals.size();
    }

    /**
     * Ordered list of {@code id:OPERATION} pairs; two clauses with equal signatures
     * express the same conjunction.
     *
     * @return the clause signature
     */
    public List<String> signature() {
        return literals.stream().map(Literal::signature).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return literals.stream().map(Literal::signature).collect(Collectors.joining(" & ", "[", "]"));
    }
}
