package io.github.cyfko.dnfql.core.config;

import java.util.Objects;

/**
 * A single configured operator token as seen by the tokenizer.
 *
 * @param token the normalized token text (keywords upper-cased, symbols verbatim)
 * @param role  the logical role of the token
 * @param word  {@code true} when the token is alphabetic and must be matched as a whole word
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OperatorToken(String token, OperatorRole role, boolean word) {

    public OperatorToken {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(role, "role");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("token must not be empty");
        }
    }

    /**
     * @return the number of characters this token consumes
     */
    public int length() {
        return token.length();
    }
}
