package io.github.cyfko.dnfql.core.config;

import io.github.cyfko.dnfql.core.exception.OperatorConfigException;

import java.util.*;

/**
 * Validated, immutable table of operator tokens.
 * <p>
 * Each {@link OperatorRole} maps to an ordered set of unique tokens. Alphabetic tokens
 * ({@code AND}, {@code or}, {@code Not}) are upper-cased and matched case-insensitively as
 * whole words; symbolic tokens ({@code &}, {@code <>}, {@code !=}) are matched verbatim.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>AND, OR, EQ, NEQ, LPAREN and RPAREN each have at least one token, NOT is optional</li>
 *   <li>No token is claimed by two roles</li>
 *   <li>No token is empty or blank</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Built-in table: & AND | OR ! NOT = <> != ( )
 * OperatorConfig config = OperatorConfig.defaults();
 *
 * // Custom table
 * OperatorConfig custom = OperatorConfig.builder()
 *     .role(OperatorRole.AND, "&&")
 *     .role(OperatorRole.OR, "||")
 *     .role(OperatorRole.EQ, "=")
 *     .role(OperatorRole.NEQ, "<>")
 *     .role(OperatorRole.LPAREN, "(")
 *     .role(OperatorRole.RPAREN, ")")
 *     .build();
 *
 * // From a JSON document, cached per path
 * OperatorConfig fromFile = OperatorConfigLoader.load(Path.of("config/operators.json"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see OperatorConfigLoader
 */
public final class OperatorConfig {

    /**
     * Source label used for configurations that were not read from a document.
     */
    public static final String PROGRAMMATIC_SOURCE = "<programmatic>";

    // must be initialized before DEFAULTS, the constructor sorts with it
    private static final Comparator<OperatorToken> LONGEST_FIRST = Comparator
            .comparingInt(OperatorToken::length).reversed()
            .thenComparing(OperatorToken::role)
            .thenComparing(OperatorToken::token);

    private static final OperatorConfig DEFAULTS = builder()
            .source("<defaults>")
            .role(OperatorRole.AND, "&", "AND")
            .role(OperatorRole.OR, "|", "OR")
            .role(OperatorRole.NOT, "!", "NOT")
            .role(OperatorRole.NEQ, "<>", "!=")
            .role(OperatorRole.EQ, "=")
            .role(OperatorRole.LPAREN, "(")
            .role(OperatorRole.RPAREN, ")")
            .build();

    private final String source;
    private final Map<OperatorRole, List<String>> mapping;
    private final List<OperatorToken> expressionOperators;
    private final List<String> eqTokens;
    private final List<String> neqTokens;

    private OperatorConfig(String source, Map<OperatorRole, List<String>> mapping) {
        this.source = source;
        this.mapping = Collections.unmodifiableMap(mapping);

        List<OperatorToken> ops = new ArrayList<>();
        for (Map.Entry<OperatorRole, List<String>> entry : mapping.entrySet()) {
            if (!entry.getKey().isExpression()) continue;
            for (String token : entry.getValue()) {
                ops.add(new OperatorToken(token, entry.getKey(), isWordToken(token)));
            }
        }
        ops.sort(LONGEST_FIRST);
        this.expressionOperators = List.copyOf(ops);
        this.eqTokens = longestFirst(mapping.get(OperatorRole.EQ));
        this.neqTokens = longestFirst(mapping.get(OperatorRole.NEQ));
    }

    /**
     * Returns the built-in configuration.
     *
     * @return the shared default configuration
     */
    public static OperatorConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a builder for programmatic configurations.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates a raw role table and builds the configuration.
     *
     * @param raw    role to tokens; iteration order of each collection is preserved
     * @param source label identifying where the table comes from (used in error messages)
     * @return the validated configuration
     * @throws OperatorConfigException if the table violates any invariant
     */
    public static OperatorConfig of(Map<OperatorRole, ? extends Collection<String>> raw, String source) {
        if (raw == null) {
            throw new OperatorConfigException("Operator configuration is required (source: " + source + ")");
        }

        Set<OperatorRole> missing = EnumSet.noneOf(OperatorRole.class);
        for (OperatorRole role : OperatorRole.values()) {
            if (role.isRequired() && !raw.containsKey(role)) {
                missing.add(role);
            }
        }
        if (!missing.isEmpty()) {
            throw new OperatorConfigException("Missing required roles: " + missing + " (source: " + source + ")");
        }

        Map<OperatorRole, List<String>> mapping = new EnumMap<>(OperatorRole.class);
        Map<String, OperatorRole> seen = new HashMap<>();

        for (OperatorRole role : OperatorRole.values()) {
            Collection<String> values = raw.get(role);
            if (values == null) continue;

            Set<String> tokens = new LinkedHashSet<>();
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    throw new OperatorConfigException(
                            "Operator token must not be empty (role " + role + ", source: " + source + ")");
                }
                tokens.add(normalizeToken(value));
            }

            // NOT may be declared empty; the required roles may not
            if (tokens.isEmpty()) {
                if (role.isRequired()) {
                    throw new OperatorConfigException(
                            "'" + role + "' must have at least one token (source: " + source + ")");
                }
                continue;
            }

            for (String token : tokens) {
                OperatorRole previous = seen.putIfAbsent(token, role);
                if (previous != null) {
                    throw new OperatorConfigException(String.format(
                            "Duplicate token '%s' in roles %s and %s (source: %s)", token, previous, role, source));
                }
            }
            mapping.put(role, List.copyOf(tokens));
        }

        return new OperatorConfig(source, mapping);
    }

    /**
     * Alphabetic tokens are keywords: matched case-insensitively and only on word boundaries.
     *
     * @param token a normalized token
     * @return {@code true} if every character of the token is a letter
     */
    public static boolean isWordToken(String token) {
        if (token == null || token.isEmpty()) return false;
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isLetter(token.charAt(i))) return false;
        }
        return true;
    }

    private static String normalizeToken(String raw) {
        String token = raw.strip();
        return isWordToken(token) ? token.toUpperCase(Locale.ROOT) : token;
    }

    private static List<String> longestFirst(List<String> tokens) {
        if (tokens == null) return List.of();
        List<String> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(sorted);
    }

    /**
     * @return where this configuration was loaded from
     */
    public String source() {
        return source;
    }

    /**
     * @param role the role to look up
     * @return the normalized tokens of the role in declaration order, empty if none
     */
    public List<String> tokens(OperatorRole role) {
        return mapping.getOrDefault(role, List.of());
    }

    /**
     * Operators that produce their own token (parentheses, NOT, AND, OR), longest first.
     * Operators of the same length are ordered by role then text, so the order never depends
     * on how the source document lists them.
     *
     * @return immutable operator list
     */
    public List<OperatorToken> expressionOperators() {
        return expressionOperators;
    }

    /**
     * @return the EQ tokens, longest first
     */
    public List<String> eqTokens() {
        return eqTokens;
    }

    /**
     * @return the NEQ tokens, longest first
     */
    public List<String> neqTokens() {
        return neqTokens;
    }

    /**
     * Compact role to tokens view, used in diagnostics.
     *
     * @return ordered summary map
     */
    public Map<OperatorRole, List<String>> summary() {
        return mapping;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperatorConfig)) return false;
        return mapping.equals(((OperatorConfig) o).mapping);
    }

    @Override
    public int hashCode() {
        return mapping.hashCode();
    }

    @Override
    public String toString() {
        return "OperatorConfig[source=" + source + ", operators=" + mapping + "]";
    }

    /**
     * Builder for {@link OperatorConfig}. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final Map<OperatorRole, List<String>> roles = new EnumMap<>(OperatorRole.class);
        private String source = PROGRAMMATIC_SOURCE;

        private Builder() {}

        public Builder role(OperatorRole role, String... tokens) {
            Objects.requireNonNull(role, "role");
            Objects.requireNonNull(tokens, "tokens");
            this.roles.put(role, Arrays.asList(tokens));
            return this;
        }

        public Builder source(String source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public OperatorConfig build() {
            return OperatorConfig.of(roles, source);
        }
    }
}
