package com.synthgraph.expr;

import java.util.List;

import com.synthgraph.expr.FormulaExpression.Binary;
import com.synthgraph.expr.FormulaExpression.Call;
import com.synthgraph.expr.FormulaExpression.Identifier;
import com.synthgraph.expr.FormulaExpression.Negate;
import com.synthgraph.expr.FormulaToken.Type;

/**
 * Recursive-descent parser for merge formulas.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := ('+' | '-') factor | NUMBER | IDENT | IDENT '(' expr ')' | '(' expr ')'
 * </pre>
 *
 * Binary operators are left-associative. Identifiers are not resolved here;
 * see {@link FormulaRenderer}.
 */
public final class FormulaParser {
    private final List<FormulaToken> tokens;
    private int pos;

    private FormulaParser(List<FormulaToken> tokens) {
        this.tokens = tokens;
    }

    public static FormulaExpression parse(String source) {
        if (source == null || source.isBlank())
            throw new FormulaException("Formula is empty.");
        FormulaParser parser = new FormulaParser(FormulaTokenizer.tokenize(source));
        FormulaExpression expr = parser.expression();
        if (parser.pos < parser.tokens.size()) {
            FormulaToken extra = parser.tokens.get(parser.pos);
            throw unexpected(extra);
        }
        return expr;
    }

    private FormulaExpression expression() {
        FormulaExpression left = term();
        while (peek(Type.PLUS) || peek(Type.MINUS)) {
            char op = next().text().charAt(0);
            left = new Binary(op, left, term());
        }
        return left;
    }

    private FormulaExpression term() {
        FormulaExpression left = factor();
        while (peek(Type.STAR) || peek(Type.SLASH)) {
            char op = next().text().charAt(0);
            left = new Binary(op, left, factor());
        }
        return left;
    }

    private FormulaExpression factor() {
        if (pos >= tokens.size())
            throw new FormulaException("Unexpected end of formula.");
        FormulaToken t = next();
        switch (t.type()) {
            case PLUS:
                return factor();
            case MINUS:
                return new Negate(factor());
            case NUMBER:
                return new FormulaExpression.Number(normalizeNumber(t.text()));
            case IDENTIFIER:
                if (peek(Type.LPAREN)) {
                    if (!FormulaExpression.FUNCTIONS.contains(t.text()))
                        throw new FormulaException("Unknown function '" + t.text() + "'.");
                    next();
                    FormulaExpression arg = expression();
                    expect(Type.RPAREN);
                    return new Call(t.text(), arg);
                }
                return new Identifier(t.text(), t.position());
            case LPAREN:
                FormulaExpression inner = expression();
                expect(Type.RPAREN);
                return inner;
            default:
                throw unexpected(t);
        }
    }

    private void expect(Type type) {
        if (pos >= tokens.size())
            throw new FormulaException("Missing closing ')'.");
        FormulaToken t = next();
        if (t.type() != type)
            throw unexpected(t);
    }

    private boolean peek(Type type) {
        return pos < tokens.size() && tokens.get(pos).is(type);
    }

    private FormulaToken next() {
        return tokens.get(pos++);
    }

    private static FormulaException unexpected(FormulaToken t) {
        return new FormulaException("Unexpected token '" + t.text() + "' at position " + t.position() + ".");
    }

    // ".5" and "5." are accepted on input but written out as "0.5" and "5.0".
    private static String normalizeNumber(String text) {
        if (text.startsWith("."))
            text = "0" + text;
        if (text.endsWith("."))
            text = text + "0";
        return text;
    }
}
