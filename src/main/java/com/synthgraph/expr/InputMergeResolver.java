package com.synthgraph.expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.synthgraph.io.InputFormula;
import com.synthgraph.io.InputKey;

/**
 * Decides the expression feeding one input port from its inbound connections
 * and the optional user formula for that port.
 *
 * <ol>
 * <li>One inbound source and no formula: the source variable itself.</li>
 * <li>Otherwise each source gets a token. Formula bindings are honoured when
 * the token is a valid identifier and names an inbound source, each token and
 * each source used once. Remaining sources take the lowest free
 * {@code in<N>} token, in connection order.</li>
 * <li>With a formula expression, the parsed formula is rendered against the
 * token table; without one, the sources are summed left to right.</li>
 * </ol>
 */
public final class InputMergeResolver {
    public static final String AUTO_TOKEN_PREFIX = "in";

    private InputMergeResolver() {
        // Utility class
    }

    /** An upstream output feeding the input, with its allocated variable. */
    public record Source(String fromNodeId, String fromPortId, String variable) {
    }

    /** Either a rendered expression or the errors that prevented one. */
    public record Resolution(String expression, List<String> errors) {

        public boolean ok() {
            return errors.isEmpty();
        }

        static Resolution of(String expression) {
            return new Resolution(expression, List.of());
        }

        static Resolution failed(List<String> errors) {
            return new Resolution(null, List.copyOf(errors));
        }
    }

    /**
     * @param sources distinct inbound sources in connection order, never empty
     * @param formula the user formula for this input, or null
     */
    public static Resolution resolve(InputKey key, List<Source> sources, InputFormula formula) {
        if (sources.isEmpty())
            throw new IllegalArgumentException("No inbound sources for " + key);
        if (sources.size() == 1 && formula == null)
            return Resolution.of(sources.get(0).variable());

        Map<String, String> tokens = bindTokens(sources, formula);

        if (formula == null || formula.expression() == null) {
            if (sources.size() == 1)
                return Resolution.of(sources.get(0).variable());
            List<String> terms = new ArrayList<>();
            for (String var : tokens.values())
                terms.add("(" + var + ")");
            return Resolution.of(String.join(" + ", terms));
        }

        FormulaExpression expr;
        try {
            expr = FormulaParser.parse(formula.expression());
        } catch (FormulaException e) {
            return Resolution.failed(List.of(describe(key, e.getMessage())));
        }
        List<String> errors = new ArrayList<>();
        for (String token : FormulaRenderer.unboundTokens(expr, tokens))
            errors.add(describe(key, "Unknown input token '" + token + "'."));
        if (!errors.isEmpty())
            return Resolution.failed(errors);
        return Resolution.of(FormulaRenderer.render(expr, tokens));
    }

    // Explicit bindings first, then auto tokens; iteration order follows sources.
    private static Map<String, String> bindTokens(List<Source> sources, InputFormula formula) {
        Map<Source, String> bySource = new HashMap<>();
        Set<String> used = new HashSet<>();
        if (formula != null) {
            for (InputFormula.Binding b : formula.bindings()) {
                String token = b.token();
                if (!FormulaTokenizer.isIdentifier(token) || token.equals(FormulaExpression.SAMPLE_RATE)
                        || used.contains(token))
                    continue;
                Source match = find(sources, b.fromNodeId(), b.fromPortId());
                if (match == null || bySource.containsKey(match))
                    continue;
                bySource.put(match, token);
                used.add(token);
            }
        }
        int next = 1;
        Map<String, String> table = new LinkedHashMap<>();
        for (Source s : sources) {
            String token = bySource.get(s);
            if (token == null) {
                while (used.contains(AUTO_TOKEN_PREFIX + next))
                    next++;
                token = AUTO_TOKEN_PREFIX + next;
                used.add(token);
            }
            table.put(token, s.variable());
        }
        return table;
    }

    private static Source find(List<Source> sources, String nodeId, String portId) {
        for (Source s : sources)
            if (s.fromNodeId().equals(nodeId) && s.fromPortId().equals(portId))
                return s;
        return null;
    }

    private static String describe(InputKey key, String message) {
        return "Invalid formula for input '" + key + "': " + message;
    }
}
