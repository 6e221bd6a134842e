package com.synthgraph.io;

import java.util.List;

/**
 * User-authored merge formula for one input, with the tokens the user bound to
 * specific upstream outputs.
 */
public record InputFormula(String expression, List<Binding> bindings) {

    public InputFormula {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    /** Names an upstream output with a formula token. */
    public record Binding(String token, String fromNodeId, String fromPortId) {
    }
}
