package io.github.cyfko.dnfql.core.api;

import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.model.Literal;

/**
 * Turns the raw text of a literal token into a {@link Literal}.
 * <p>
 * The parser calls the interpreter once per literal token, left to right. Supplying a
 * custom interpreter lets callers observe every literal instance (to collect distinct
 * variables, or to cross-check two parallel formulas) while reusing one parsing algorithm.
 * </p>
 *
 * <pre>{@code
 * List<Literal> seen = new ArrayList<>();
 * FormulaNode ast = parser.parse("A & (B | C=0)", raw -> {
 *     Literal literal = LiteralNormalizer.parseLiteral(raw, raw, config);
 *     seen.add(literal);
 *     return literal;
 * });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface LiteralInterpreter {

    /**
     * @param rawLiteral the literal text exactly as tokenized (e.g. {@code "A<>1"})
     * @return the interpreted literal, never {@code null}
     * @throws FormulaSyntaxException if the literal is semantically invalid; the parser
     *                                re-throws it with the literal's position and context
     *                                and keeps it as the cause. Any other runtime exception
     *                                propagates out of the parser unwrapped.
     */
    Literal interpret(String rawLiteral) throws FormulaSyntaxException;
}
