package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.model.Clause;
import io.github.cyfko.dnfql.core.model.Literal;
import io.github.cyfko.dnfql.core.utils.NaturalOrderComparator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Canonicalizes a DNF clause list.
 * <ol>
 *   <li>Within a clause, repeated identifiers keep their first occurrence. A clause holding
 *       the same identifier with two different operations is a contradiction and is dropped.</li>
 *   <li>Literals are sorted by identifier in natural order ({@code A2 < A10}), then by
 *       operation ({@code EQ0 < EQ1 < NEQ1}).</li>
 *   <li>Clauses with an identical signature are removed.</li>
 *   <li>Clauses are sorted lexicographically on their literals, a clause sorting before any
 *       longer clause it is a prefix of.</li>
 * </ol>
 * <p>The output is deterministic for a given input multiset of clauses.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ClauseNormalizer {

    private static final Logger log = Logger.getLogger(ClauseNormalizer.class.getName());

    /** Literal order inside a normalized clause. */
    public static final Comparator<Literal> LITERAL_ORDER = Comparator
            .comparing(Literal::id, NaturalOrderComparator.INSTANCE)
            .thenComparing(Literal::operation)
            .thenComparing(Literal::id);

    /** Clause order of a normalized clause list. */
    public static final Comparator<Clause> CLAUSE_ORDER = ClauseNormalizer::compareClauses;

    private ClauseNormalizer() {}

    /**
     * @param clauses the raw DNF clauses
     * @return a new list of normalized clauses
     */
    public static List<Clause> normalize(List<Clause> clauses) {
        Objects.requireNonNull(clauses, "clauses are required");

        List<Clause> result = new ArrayList<>(clauses.size());
        Set<List<String>> seen = new HashSet<>();
        int contradictions = 0;

        for (Clause clause : clauses) {
            Clause normalized = normalizeClause(clause);
            if (normalized == null) {
                contradictions++;
                continue;
            }
            if (seen.add(normalized.signature())) {
                result.add(normalized);
            }
        }
        result.sort(CLAUSE_ORDER);

        int dropped = contradictions;
        log.fine(() -> String.format("Normalized %d clauses into %d (%d contradictory)",
                clauses.size(), result.size(), dropped));
        return result;
    }

    /**
     * @return the normalized clause, or {@code null} if it is contradictory
     */
    static Clause normalizeClause(Clause clause) {
        Map<String, Literal> byId = new LinkedHashMap<>();
        for (Literal literal : clause.literals()) {
            Literal previous = byId.putIfAbsent(literal.id(), literal);
            if (previous != null && previous.operation() != literal.operation()) {
                return null;
            }
        }
        List<Literal> literals = new ArrayList<>(byId.values());
        literals.sort(LITERAL_ORDER);
        return new Clause(literals);
    }

    private static int compareClauses(Clause a, Clause b) {
        List<Literal> left = a.literals();
        List<Literal> right = b.literals();
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = LITERAL_ORDER.compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
