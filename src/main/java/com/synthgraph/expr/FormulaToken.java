package com.synthgraph.expr;

/**
 * Lexical token of a merge formula.
 *
 * @param position 1-based column of the first character
 */
public record FormulaToken(Type type, String text, int position) {

    public enum Type {
        NUMBER, IDENTIFIER, PLUS, MINUS, STAR, SLASH, LPAREN, RPAREN
    }

    public boolean is(Type t) {
        return type == t;
    }
}
