package io.github.cyfko.dnfql.core.api;

import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.exception.RuleLimitExceededException;
import io.github.cyfko.dnfql.core.model.CompiledFormula;

/**
 * Parses boolean formulas over binary variables and compiles them to disjunctive normal form.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr    := term (OR term)*
 * term    := factor (AND factor)*
 * factor  := NOT factor | '(' expr ')' | literal
 * literal := '!'? identifier (comparator ('0' | '1'))?
 * </pre>
 * <p>
 * The operator spellings come from the parser's operator configuration. With the default
 * table {@code &}/{@code AND}, {@code |}/{@code OR} and {@code !}/{@code NOT} are accepted,
 * word operators case-insensitively.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * FormulaNode ast = parser.parse("A & (B | C=0)");
 *
 * CompiledFormula compiled = parser.compile("(A | B) & !C");
 * compiled.clauses();    // [[A:EQ1 & C:NEQ1], [B:EQ1 & C:NEQ1]]
 * compiled.variables();  // A, B, C
 * }</pre>
 *
 * <h3>Invalid Formula Examples</h3>
 * <pre>{@code
 * parser.parse("");          // FormulaSyntaxException: empty
 * parser.parse("A &");       // FormulaSyntaxException: unexpected end of formula
 * parser.parse("(A | B");    // FormulaSyntaxException: expected RPAREN
 * parser.parse("A>=1");      // FormulaSyntaxException: unsupported comparison
 * parser.parse("A<>0");      // FormulaSyntaxException: use A=1 instead
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses a formula, giving each literal its raw text as display name.
     *
     * @param formula the formula text
     * @return the formula tree
     * @throws FormulaSyntaxException if the formula is blank, too long or malformed
     */
    FormulaNode parse(String formula) throws FormulaSyntaxException;

    /**
     * Parses a formula with a caller-supplied literal interpreter.
     *
     * @param formula     the formula text
     * @param interpreter called once per literal, left to right
     * @return the formula tree
     * @throws FormulaSyntaxException if the formula is blank, too long or malformed,
     *                                or if the interpreter rejects a literal
     */
    FormulaNode parse(String formula, LiteralInterpreter interpreter) throws FormulaSyntaxException;

    /**
     * Parses a formula and expands it into normalized DNF clauses.
     *
     * @param formula the formula text
     * @return the compilation result
     * @throws FormulaSyntaxException     if the formula is invalid
     * @throws RuleLimitExceededException if the expansion would exceed the policy's rule cap
     */
    CompiledFormula compile(String formula) throws FormulaSyntaxException, RuleLimitExceededException;
}
