package io.github.cyfko.dnfql.core.config;

/**
 * Limits applied by {@link io.github.cyfko.dnfql.core.impl.BasicFormulaParser} to keep
 * tokenization and DNF expansion bounded.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: maximum character length of a formula (default: 5000)</li>
 *   <li><strong>maxDepth</strong>: maximum nesting of parentheses and NOT operators (default: 256)</li>
 *   <li><strong>maxRules</strong>: maximum number of DNF clauses a formula may expand to (default: 2000)</li>
 * </ul>
 *
 * <p>{@code maxRules} is checked against the clause count of the raw expansion, before
 * duplicates and contradictions are removed, so that the exponential distribution step is
 * never started for an oversized formula. A formula such as {@code A | A | A | A} therefore
 * counts as four clauses even though it normalizes to one.</p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * FormulaPolicy policy = FormulaPolicy.defaults();
 * FormulaPolicy policy = FormulaPolicy.strict();
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxRules(500)
 *     .build();
 * }</pre>
 *
 * @param policyName       name shown in limit violation messages
 * @param maxFormulaLength maximum character length of a formula
 * @param maxDepth         maximum nesting depth of parentheses and negations
 * @param maxRules         maximum number of clauses before normalization
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxDepth,
    int maxRules
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxRules <= 0) {
            throw new IllegalArgumentException("maxRules must be positive, got: " + maxRules);
        }
    }

    /**
     * Balanced limits, matching the rule cap historically used for eligibility sheets.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Max Depth: 256 levels</li>
     *   <li>Max Rules: 2000 clauses</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256, 2000);
    }

    /**
     * Tight limits for formulas coming from untrusted sources.
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Max Depth: 64 levels</li>
     *   <li>Max Rules: 500 clauses</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64, 500);
    }

    /**
     * Generous limits for trusted batch runs.
     * <ul>
     *   <li>Max Formula Length: 20000 characters</li>
     *   <li>Max Depth: 1000 levels</li>
     *   <li>Max Rules: 20000 clauses</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 1000, 20000);
    }

    /**
     * Builder parameters start from the values of {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private int _maxDepth = 256;
        private int _maxRules = 2000;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxDepth, _maxRules);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder maxRules(int maxRules) { this._maxRules = maxRules; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
