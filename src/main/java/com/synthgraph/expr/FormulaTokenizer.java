package com.synthgraph.expr;

import java.util.ArrayList;
import java.util.List;

import com.synthgraph.expr.FormulaToken.Type;

/**
 * Splits a formula into identifiers, decimal numbers, parentheses and the four
 * arithmetic operators. Whitespace separates tokens and is otherwise ignored.
 */
public final class FormulaTokenizer {

    private FormulaTokenizer() {
        // Utility class
    }

    public static List<FormulaToken> tokenize(String source) {
        List<FormulaToken> tokens = new ArrayList<>();
        int i = 0, n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (isIdentifierStart(c)) {
                int start = i;
                while (i < n && isIdentifierPart(source.charAt(i)))
                    i++;
                tokens.add(new FormulaToken(Type.IDENTIFIER, source.substring(start, i), start + 1));
                continue;
            }
            if (isDigit(c) || c == '.') {
                int start = i, dots = 0, digits = 0;
                while (i < n && (isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    if (source.charAt(i) == '.')
                        dots++;
                    else
                        digits++;
                    i++;
                }
                String text = source.substring(start, i);
                if (dots > 1 || digits == 0)
                    throw new FormulaException("Invalid number near '" + text + "'.");
                tokens.add(new FormulaToken(Type.NUMBER, text, start + 1));
                continue;
            }
            Type type = switch (c) {
                case '+' -> Type.PLUS;
                case '-' -> Type.MINUS;
                case '*' -> Type.STAR;
                case '/' -> Type.SLASH;
                case '(' -> Type.LPAREN;
                case ')' -> Type.RPAREN;
                default -> throw new FormulaException(
                        "Unsupported character '" + c + "' at position " + (i + 1) + ".");
            };
            tokens.add(new FormulaToken(type, String.valueOf(c), i + 1));
            i++;
        }
        return tokens;
    }

    public static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty() || !isIdentifierStart(s.charAt(0)))
            return false;
        for (int i = 1; i < s.length(); i++)
            if (!isIdentifierPart(s.charAt(i)))
                return false;
        return true;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
