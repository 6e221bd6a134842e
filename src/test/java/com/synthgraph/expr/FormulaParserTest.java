package com.synthgraph.expr;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class FormulaParserTest {

    private static String render(String formula, Map<String, String> vars) {
        return FormulaRenderer.render(FormulaParser.parse(formula), vars);
    }

    private static String errorOf(String formula) {
        try {
            FormulaParser.parse(formula);
            fail("parsed " + formula);
            return null;
        } catch (FormulaException e) {
            return e.getMessage();
        }
    }

    @Test
    public void testTokenizer() {
        List<FormulaToken> tokens = FormulaTokenizer.tokenize("in1*(0.5 - x_2)");
        assertEquals(7, tokens.size());
        assertEquals(FormulaToken.Type.IDENTIFIER, tokens.get(0).type());
        assertEquals(FormulaToken.Type.STAR, tokens.get(1).type());
        assertEquals("0.5", tokens.get(3).text());
        assertEquals(6, tokens.get(3).position());
        assertEquals(FormulaToken.Type.RPAREN, tokens.get(6).type());
    }

    @Test
    public void testPrecedenceAndGrouping() {
        Map<String, String> vars = Map.of("in1", "X", "in2", "Y");
        assertEquals("(X + (Y * 0.5))", render("in1 + (in2 * 0.5)", vars));
        assertEquals("(X + (Y * 0.5))", render("in1 + in2 * 0.5", vars));
        assertEquals("((X + Y) * 0.5)", render("(in1 + in2) * 0.5", vars));
    }

    @Test
    public void testLeftAssociative() {
        Map<String, String> vars = Map.of("a", "A", "b", "B", "c", "C");
        assertEquals("((A - B) - C)", render("a - b - c", vars));
        assertEquals("((A / B) / C)", render("a / b / c", vars));
    }

    @Test
    public void testUnaryOperators() {
        Map<String, String> vars = Map.of("x", "X");
        assertEquals("(-X)", render("-x", vars));
        assertEquals("X", render("+x", vars));
        assertEquals("(-(-X))", render("--x", vars));
        assertEquals("(2 * (-X))", render("2 * -x", vars));
    }

    @Test
    public void testFunctionsAndSampleRate() {
        Map<String, String> vars = Map.of("in1", "kamp");
        assertEquals("(ampdb(kamp) / sr)", render("ampdb(in1) / sr", vars));
        assertEquals("floor((kamp * 10))", render("floor(in1 * 10)", vars));
    }

    @Test
    public void testNumberForms() {
        assertEquals("(0.5 + 5.0)", render(".5 + 5.", Map.of()));
    }

    @Test
    public void testUnboundTokensInOrder() {
        FormulaExpression expr = FormulaParser.parse("b + in1 * a + b + sr");
        assertEquals(Set.of("b", "a"), FormulaRenderer.unboundTokens(expr, Map.of("in1", "X")));
        assertEquals(List.of("b", "a"), List.copyOf(FormulaRenderer.unboundTokens(expr, Map.of("in1", "X"))));
    }

    @Test
    public void testErrors() {
        assertEquals("Formula is empty.", errorOf(""));
        assertEquals("Unsupported character '%' at position 3.", errorOf("a %b"));
        assertEquals("Invalid number near '1.2.3'.", errorOf("1.2.3"));
        assertEquals("Invalid number near '.'.", errorOf("a + ."));
        assertEquals("Missing closing ')'.", errorOf("(a + b"));
        assertEquals("Unexpected token ')' at position 6.", errorOf("a + b)"));
        assertEquals("Unexpected token 'b' at position 3.", errorOf("a b"));
        assertEquals("Unexpected end of formula.", errorOf("a *"));
        assertEquals("Unknown function 'sin'.", errorOf("sin(a)"));
        assertEquals("Unexpected token '*' at position 1.", errorOf("* a"));
    }
}
