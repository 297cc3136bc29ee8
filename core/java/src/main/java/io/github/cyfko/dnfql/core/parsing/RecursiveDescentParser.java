package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.api.LiteralInterpreter;
import io.github.cyfko.dnfql.core.ast.AndNode;
import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.ast.LiteralNode;
import io.github.cyfko.dnfql.core.ast.NotNode;
import io.github.cyfko.dnfql.core.ast.OrNode;
import io.github.cyfko.dnfql.core.config.FormulaPolicy;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.model.Literal;
import io.github.cyfko.dnfql.core.utils.TextUtils;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser over the tokens produced by {@link FormulaTokenizer}.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr   := term (OR term)*        -- left-associative, lowest precedence
 * term   := factor (AND factor)*   -- left-associative
 * factor := NOT factor | LPAREN expr RPAREN | LITERAL
 * </pre>
 *
 * <p>Each parenthesized group and each NOT adds one level of nesting; parsing fails once
 * the nesting exceeds the configured maximum depth.</p>
 *
 * <p>A parser instance holds a cursor and is meant for a single {@link #parse()} call;
 * use {@link #parse(List, String, LiteralInterpreter, int)} for one-shot parsing.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecursiveDescentParser {

    private static final Logger log = Logger.getLogger(RecursiveDescentParser.class.getName());

    /** Maximum number of tokens rendered in the failure log. */
    private static final int TOKEN_DUMP_LIMIT = 200;

    private final List<Token> tokens;
    private final String formula;
    private final LiteralInterpreter interpreter;
    private final int maxDepth;
    private int position;
    private int depth;

    /**
     * @param tokens      the tokens of {@code formula}
     * @param formula     the source text, used for error context
     * @param interpreter turns literal tokens into {@link Literal}s
     * @param maxDepth    maximum nesting of parentheses and NOT operators
     */
    public RecursiveDescentParser(List<Token> tokens, String formula, LiteralInterpreter interpreter, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens are required"));
        this.formula = Objects.requireNonNull(formula, "formula is required");
        this.interpreter = Objects.requireNonNull(interpreter, "literal interpreter is required");
        this.maxDepth = maxDepth;
    }

    /**
     * One-shot parse.
     *
     * @param tokens      the tokens of {@code formula}
     * @param formula     the source text
     * @param interpreter literal interpreter
     * @param maxDepth    maximum nesting of parentheses and NOT operators
     * @return the root node
     * @throws FormulaSyntaxException on any grammar or literal error, or when nesting is too deep
     */
    public static FormulaNode parse(List<Token> tokens, String formula, LiteralInterpreter interpreter, int maxDepth) {
        return new RecursiveDescentParser(tokens, formula, interpreter, maxDepth).parse();
    }

    /**
     * One-shot parse with the nesting limit of {@link FormulaPolicy#defaults()}.
     */
    public static FormulaNode parse(List<Token> tokens, String formula, LiteralInterpreter interpreter) {
        return parse(tokens, formula, interpreter, FormulaPolicy.defaults().maxDepth());
    }

    /**
     * Parses the whole token stream.
     *
     * @return the root node
     * @throws FormulaSyntaxException if the stream is empty, malformed, or has trailing tokens
     */
    public FormulaNode parse() {
        if (tokens.isEmpty()) {
            throw new FormulaSyntaxException("Formula is empty");
        }
        try {
            FormulaNode node = parseExpr();
            Token trailing = current();
            if (trailing != null) {
                throw error("Unexpected token '" + trailing.value() + "'", trailing.position(), null);
            }
            log.fine(() -> "Parsed " + tokens.size() + " tokens");
            return node;
        } catch (FormulaSyntaxException e) {
            log.warning(() -> "Parsing failed: " + e.getMessage() + " token_dump=" + tokenDump());
            throw e;
        }
    }

    private FormulaNode parseExpr() {
        FormulaNode node = parseTerm();
        while (at(TokenType.OR)) {
            consume(TokenType.OR);
            node = new OrNode(node, parseTerm());
        }
        return node;
    }

    private FormulaNode parseTerm() {
        FormulaNode node = parseFactor();
        while (at(TokenType.AND)) {
            consume(TokenType.AND);
            node = new AndNode(node, parseFactor());
        }
        return node;
    }

    private FormulaNode parseFactor() {
        Token token = current();
        if (token == null) {
            throw error("Unexpected end of formula", formula.length(), null);
        }

        switch (token.type()) {
            case NOT -> {
                consume(TokenType.NOT);
                descend(token);
                FormulaNode child = parseFactor();
                depth--;
                return new NotNode(child);
            }
            case LPAREN -> {
                consume(TokenType.LPAREN);
                descend(token);
                FormulaNode inner = parseExpr();
                consume(TokenType.RPAREN);
                depth--;
                return inner;
            }
            case LITERAL -> {
                consume(TokenType.LITERAL);
                return new LiteralNode(interpret(token));
            }
            default -> throw error("Unexpected token '" + token.value() + "'", token.position(), null);
        }
    }

    private void descend(Token token) {
        if (++depth > maxDepth) {
            throw error(String.format("Nesting depth exceeds maximum of %d", maxDepth), token.position(), null);
        }
    }

    private Literal interpret(Token token) {
        Literal literal;
        try {
            literal = interpreter.interpret(token.value());
        } catch (FormulaSyntaxException e) {
            throw error("Invalid literal: " + e.getMessage(), token.position(), e);
        }
        if (literal == null) {
            throw new IllegalStateException("Literal interpreter returned null for '" + token.value() + "'");
        }
        return literal;
    }

    private Token current() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private boolean at(TokenType type) {
        Token token = current();
        return token != null && token.type() == type;
    }

    private Token consume(TokenType expected) {
        Token token = current();
        if (token == null) {
            throw error("Expected " + expected + " but reached end of formula", formula.length(), null);
        }
        if (token.type() != expected) {
            throw error(String.format("Expected %s but got %s ('%s')", expected, token.type(), token.value()),
                    token.position(), null);
        }
        position++;
        return token;
    }

    private FormulaSyntaxException error(String message, int at, Throwable cause) {
        String near = TextUtils.near(formula, at);
        return new FormulaSyntaxException(
                String.format("%s at position %d near '%s'", message, at, near), at, near, cause);
    }

    private String tokenDump() {
        String dump = tokens.stream().limit(TOKEN_DUMP_LIMIT).map(Token::toString).collect(Collectors.joining(" "));
        return tokens.size() > TOKEN_DUMP_LIMIT ? dump + " ... (truncated)" : dump;
    }
}
