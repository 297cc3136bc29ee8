package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.api.LiteralInterpreter;
import io.github.cyfko.dnfql.core.config.OperatorConfig;
import io.github.cyfko.dnfql.core.config.PatternConfig;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.model.Literal;
import io.github.cyfko.dnfql.core.model.LiteralOperation;

import java.util.Objects;

/**
 * Interprets the comparison suffix of a raw literal.
 * <p>
 * Only three comparisons are meaningful for a boolean variable:
 * </p>
 * <table>
 *   <caption>Literal forms (default operators)</caption>
 *   <tr><th>Text</th><th>Operation</th></tr>
 *   <tr><td>{@code X}, {@code X=1}</td><td>{@link LiteralOperation#EQ1}</td></tr>
 *   <tr><td>{@code X=0}</td><td>{@link LiteralOperation#EQ0}</td></tr>
 *   <tr><td>{@code !X}, {@code X<>1}, {@code X!=1}</td><td>{@link LiteralOperation#NEQ1}</td></tr>
 * </table>
 *
 * <p>Rejected forms: ordering comparators ({@code <}, {@code >}, {@code <=}, {@code >=}),
 * "not equal to 0" ({@code X<>0}, use {@code X=1}), the keywords {@code XOR} and {@code IF},
 * and identifiers outside {@code [A-Za-z0-9_]+}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LiteralNormalizer {

    private LiteralNormalizer() {}

    /**
     * Interprets a raw literal.
     *
     * @param rawLiteral  the literal text, e.g. {@code "ePBN993847_1<>1"}
     * @param displayName the display name to attach, {@code null} means the identifier
     * @param config      the operator table providing the EQ and NEQ tokens
     * @return the literal
     * @throws FormulaSyntaxException if the literal is not one of the supported forms
     */
    public static Literal parseLiteral(String rawLiteral, String displayName, OperatorConfig config) {
        Objects.requireNonNull(rawLiteral, "rawLiteral is required");
        Objects.requireNonNull(config, "operator configuration is required");

        String text = rawLiteral.strip();
        rejectUnsupported(text, config);

        String identifier;
        LiteralOperation operation;

        if (text.startsWith("!")) {
            identifier = text.substring(1).strip();
            operation = LiteralOperation.NEQ1;
        } else {
            identifier = null;
            operation = null;

            for (String neq : config.neqTokens()) {
                if (text.endsWith(neq + "1")) {
                    identifier = stripSuffix(text, neq);
                    operation = LiteralOperation.NEQ1;
                    break;
                }
            }

            if (operation == null) {
                for (String eq : config.eqTokens()) {
                    if (text.endsWith(eq + "0")) {
                        identifier = stripSuffix(text, eq);
                        operation = LiteralOperation.EQ0;
                        break;
                    }
                    if (text.endsWith(eq + "1")) {
                        identifier = stripSuffix(text, eq);
                        operation = LiteralOperation.EQ1;
                        break;
                    }
                }
            }

            if (operation == null) {
                identifier = text;
                operation = LiteralOperation.EQ1;
            }
        }

        if (identifier.isEmpty()) {
            throw new FormulaSyntaxException("Literal missing identifier: '" + text + "'");
        }
        if (!PatternConfig.LITERAL_IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new FormulaSyntaxException(String.format(
                    "Invalid literal identifier '%s' in literal '%s' (expected [A-Za-z0-9_]+)", identifier, text));
        }

        return new Literal(identifier, displayName == null ? identifier : displayName, operation);
    }

    /**
     * Interpreter using {@link #parseLiteral} with the raw text as display name.
     *
     * @param config the operator table
     * @return the interpreter
     */
    public static LiteralInterpreter interpreter(OperatorConfig config) {
        Objects.requireNonNull(config, "operator configuration is required");
        return raw -> parseLiteral(raw, raw, config);
    }

    private static void rejectUnsupported(String text, OperatorConfig config) {
        for (String neq : config.neqTokens()) {
            if (text.endsWith(neq + "0")) {
                throw new FormulaSyntaxException(String.format(
                        "Invalid comparison in literal '%s': '%s0' is not allowed (use '%s1' or '=0')", text, neq, neq));
            }
        }

        // '<' and '>' are only legal as part of a configured NEQ token such as '<>'
        String withoutNeq = text;
        for (String neq : config.neqTokens()) {
            withoutNeq = withoutNeq.replace(neq, " ");
        }
        if (PatternConfig.ORDERING_COMPARATOR_PATTERN.matcher(withoutNeq).find()) {
            throw new FormulaSyntaxException("Unsupported comparison in literal: '" + text + "'");
        }

        if (PatternConfig.UNSUPPORTED_KEYWORD_PATTERN.matcher(text).find()) {
            throw new FormulaSyntaxException("Unsupported operator in literal: '" + text + "'");
        }
    }

    private static String stripSuffix(String text, String comparator) {
        return text.substring(0, text.length() - comparator.length() - 1).strip();
    }
}
