package io.github.cyfko.dnfql.core.impl;

import io.github.cyfko.dnfql.core.api.FormulaParser;
import io.github.cyfko.dnfql.core.api.LiteralInterpreter;
import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.config.FormulaPolicy;
import io.github.cyfko.dnfql.core.config.OperatorConfig;
import io.github.cyfko.dnfql.core.config.OperatorConfigLoader;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.exception.RuleLimitExceededException;
import io.github.cyfko.dnfql.core.model.Clause;
import io.github.cyfko.dnfql.core.model.CompiledFormula;
import io.github.cyfko.dnfql.core.model.Literal;
import io.github.cyfko.dnfql.core.parsing.ClauseNormalizer;
import io.github.cyfko.dnfql.core.parsing.DnfConverter;
import io.github.cyfko.dnfql.core.parsing.FormulaTokenizer;
import io.github.cyfko.dnfql.core.parsing.LiteralNormalizer;
import io.github.cyfko.dnfql.core.parsing.RecursiveDescentParser;
import io.github.cyfko.dnfql.core.parsing.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Length check against {@link FormulaPolicy#maxFormulaLength()}</li>
 *   <li>{@link FormulaTokenizer} with the configured operator table</li>
 *   <li>{@link RecursiveDescentParser} with a {@link LiteralInterpreter}, nesting bounded by
 *       {@link FormulaPolicy#maxDepth()}</li>
 *   <li>For {@link #compile(String)}: rule cap check with {@link DnfConverter#clauseCount},
 *       then {@link DnfConverter#toDnf} and {@link ClauseNormalizer#normalize}. The cap is
 *       compared with the raw expansion size, see {@link FormulaPolicy}.</li>
 * </ol>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(BasicFormulaParser.class.getName());

    private final OperatorConfig operatorConfig;
    private final FormulaPolicy formulaPolicy;
    private final LiteralInterpreter defaultInterpreter;

    /**
     * Uses the {@code operators.json} classpath resource and {@link FormulaPolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(OperatorConfigLoader.loadDefault(), FormulaPolicy.defaults());
    }

    public BasicFormulaParser(OperatorConfig operatorConfig) {
        this(operatorConfig, FormulaPolicy.defaults());
    }

    /**
     * @param operatorConfig the operator table
     * @param formulaPolicy  the formula length and rule limits
     * @throws IllegalArgumentException if an argument is {@code null}
     */
    public BasicFormulaParser(OperatorConfig operatorConfig, FormulaPolicy formulaPolicy) {
        if (operatorConfig == null) {
            throw new IllegalArgumentException("Operator configuration is required");
        }
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.operatorConfig = operatorConfig;
        this.formulaPolicy = formulaPolicy;
        this.defaultInterpreter = LiteralNormalizer.interpreter(operatorConfig);
    }

    public OperatorConfig getOperatorConfig() {
        return operatorConfig;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    @Override
    public FormulaNode parse(String formula) throws FormulaSyntaxException {
        return parse(formula, defaultInterpreter);
    }

    @Override
    public FormulaNode parse(String formula, LiteralInterpreter interpreter) throws FormulaSyntaxException {
        if (interpreter == null) {
            throw new IllegalArgumentException("Literal interpreter is required");
        }
        checkFormula(formula);

        log.fine(() -> String.format("Parsing formula (%d chars)", formula.length()));
        List<Token> tokens = FormulaTokenizer.tokenize(formula, operatorConfig);
        FormulaNode ast = RecursiveDescentParser.parse(tokens, formula, interpreter, formulaPolicy.maxDepth());
        log.fine(() -> String.format("Parsed formula into %d tokens", tokens.size()));
        return ast;
    }

    @Override
    public CompiledFormula compile(String formula) throws FormulaSyntaxException, RuleLimitExceededException {
        List<Literal> seen = new ArrayList<>();
        FormulaNode ast = parse(formula, raw -> {
            Literal literal = LiteralNormalizer.parseLiteral(raw, null, operatorConfig);
            seen.add(literal);
            return literal;
        });

        long expected = DnfConverter.clauseCount(ast);
        if (expected > formulaPolicy.maxRules()) {
            RuleLimitExceededException e = new RuleLimitExceededException(expected, formulaPolicy.maxRules());
            log.warning(e::getMessage);
            throw e;
        }

        List<Clause> clauses = ClauseNormalizer.normalize(DnfConverter.toDnf(ast));

        Map<String, Literal> variables = new LinkedHashMap<>();
        for (Literal literal : seen) {
            variables.putIfAbsent(literal.id(), literal);
        }

        log.fine(() -> String.format("Compiled formula: %d raw clauses, %d normalized, %d variables",
                expected, clauses.size(), variables.size()));
        return new CompiledFormula(formula, ast, clauses, new ArrayList<>(variables.values()));
    }

    private void checkFormula(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaSyntaxException("Formula cannot be null or empty");
        }
        if (formula.length() > formulaPolicy.maxFormulaLength()) {
            throw new FormulaSyntaxException(String.format(
                    "Formula too long (%d chars, max: %d)", formula.length(), formulaPolicy.maxFormulaLength()));
        }
    }
}
