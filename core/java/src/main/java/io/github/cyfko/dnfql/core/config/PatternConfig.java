package io.github.cyfko.dnfql.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns shared by the tokenizer and the literal normalizer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /**
     * Literal identifiers: one or more ASCII letters, digits or underscores.
     * Unlike filter keys, identifiers may start with a digit ({@code 3_5_Goal}).
     */
    public static final Pattern LITERAL_IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

    /**
     * Ordering comparators a literal may never contain.
     */
    public static final Pattern ORDERING_COMPARATOR_PATTERN = Pattern.compile("[<>]");

    /**
     * Operators of other formula dialects that sometimes leak into a literal.
     */
    public static final Pattern UNSUPPORTED_KEYWORD_PATTERN = Pattern.compile("\\b(XOR|IF)\\b", Pattern.CASE_INSENSITIVE);
}
