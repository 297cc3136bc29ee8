package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.ast.AndNode;
import io.github.cyfko.dnfql.core.ast.FormulaNode;
import io.github.cyfko.dnfql.core.ast.FormulaVisitor;
import io.github.cyfko.dnfql.core.ast.LiteralNode;
import io.github.cyfko.dnfql.core.ast.NotNode;
import io.github.cyfko.dnfql.core.ast.OrNode;

import java.util.Objects;

/**
 * Renders a formula tree in postfix notation, e.g. {@code A & !B} becomes
 * {@code "A:EQ1 B:EQ1 NOT AND"}. Literals are written as {@code id:OPERATION}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RpnPrinter implements FormulaVisitor<StringBuilder> {

    private final StringBuilder out = new StringBuilder();

    private RpnPrinter() {}

    public static String toRpn(FormulaNode node) {
        return Objects.requireNonNull(node, "node is required").accept(new RpnPrinter()).toString();
    }

    @Override
    public StringBuilder visitLiteral(LiteralNode node) {
        return append(node.literal().signature());
    }

    @Override
    public StringBuilder visitNot(NotNode node) {
        node.child().accept(this);
        return append("NOT");
    }

    @Override
    public StringBuilder visitAnd(AndNode node) {
        node.left().accept(this);
        node.right().accept(this);
        return append("AND");
    }

    @Override
    public StringBuilder visitOr(OrNode node) {
        node.left().accept(this);
        node.right().accept(this);
        return append("OR");
    }

    private StringBuilder append(String item) {
        if (out.length() > 0) {
            out.append(' ');
        }
        return out.append(item);
    }
}
