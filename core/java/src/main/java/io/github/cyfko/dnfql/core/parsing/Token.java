package io.github.cyfko.dnfql.core.parsing;

import java.util.Objects;

/**
 * A lexical unit of a formula.
 *
 * @param type     the token kind
 * @param value    the raw text as written in the formula
 * @param position zero-based offset of the first character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String value, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return type + ":" + value + "@" + position;
    }
}
