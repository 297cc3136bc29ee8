package io.github.cyfko.dnfql.core.exception;

/**
 * Exception thrown when the disjunctive normal form of a formula would contain more
 * clauses than the active {@link io.github.cyfko.dnfql.core.config.FormulaPolicy} allows.
 * <p>
 * The count is computed before distribution, so the expensive expansion is never started
 * for a rejected formula.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RuleLimitExceededException extends RuntimeException {

    private final long clauseCount;
    private final int maxRules;

    /**
     * @param clauseCount the number of clauses the expansion would produce (saturated at {@link Long#MAX_VALUE})
     * @param maxRules    the configured cap
     */
    public RuleLimitExceededException(long clauseCount, int maxRules) {
        super(String.format("DNF rule limit exceeded (%s clauses, max: %d)",
                clauseCount == Long.MAX_VALUE ? "overflowing" : String.valueOf(clauseCount), maxRules));
        this.clauseCount = clauseCount;
        this.maxRules = maxRules;
    }

    public long getClauseCount() {
        return clauseCount;
    }

    public int getMaxRules() {
        return maxRules;
    }
}
