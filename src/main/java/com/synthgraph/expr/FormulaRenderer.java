package com.synthgraph.expr;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.synthgraph.expr.FormulaExpression.Binary;
import com.synthgraph.expr.FormulaExpression.Call;
import com.synthgraph.expr.FormulaExpression.Identifier;
import com.synthgraph.expr.FormulaExpression.Negate;

/**
 * Writes a parsed formula as program text, substituting each input token with
 * its source variable. Every binary operation is parenthesized.
 */
public final class FormulaRenderer {

    private FormulaRenderer() {
        // Utility class
    }

    /** Tokens referenced by the expression that have no binding, in order of appearance. */
    public static Set<String> unboundTokens(FormulaExpression expr, Map<String, String> bindings) {
        Set<String> out = new LinkedHashSet<>();
        collectUnbound(expr, bindings, out);
        return out;
    }

    private static void collectUnbound(FormulaExpression expr, Map<String, String> bindings, Set<String> out) {
        if (expr instanceof Identifier id) {
            if (!id.name().equals(FormulaExpression.SAMPLE_RATE) && !bindings.containsKey(id.name()))
                out.add(id.name());
        } else if (expr instanceof Negate neg) {
            collectUnbound(neg.operand(), bindings, out);
        } else if (expr instanceof Binary bin) {
            collectUnbound(bin.left(), bindings, out);
            collectUnbound(bin.right(), bindings, out);
        } else if (expr instanceof Call call) {
            collectUnbound(call.argument(), bindings, out);
        }
    }

    /**
     * @throws IllegalStateException if an identifier has no binding; call
     *                               {@link #unboundTokens} first
     */
    public static String render(FormulaExpression expr, Map<String, String> bindings) {
        StringBuilder sb = new StringBuilder();
        write(expr, bindings, sb);
        return sb.toString();
    }

    private static void write(FormulaExpression expr, Map<String, String> bindings, StringBuilder sb) {
        if (expr instanceof FormulaExpression.Number num) {
            sb.append(num.text());
        } else if (expr instanceof Identifier id) {
            if (id.name().equals(FormulaExpression.SAMPLE_RATE) && !bindings.containsKey(id.name())) {
                sb.append(FormulaExpression.SAMPLE_RATE);
                return;
            }
            String var = bindings.get(id.name());
            if (var == null)
                throw new IllegalStateException("Unbound formula token: " + id.name());
            sb.append(var);
        } else if (expr instanceof Negate neg) {
            sb.append("(-");
            write(neg.operand(), bindings, sb);
            sb.append(')');
        } else if (expr instanceof Binary bin) {
            sb.append('(');
            write(bin.left(), bindings, sb);
            sb.append(' ').append(bin.operator()).append(' ');
            write(bin.right(), bindings, sb);
            sb.append(')');
        } else if (expr instanceof Call call) {
            sb.append(call.function()).append('(');
            write(call.argument(), bindings, sb);
            sb.append(')');
        } else {
            throw new IllegalStateException("Unknown formula node: " + expr);
        }
    }
}
