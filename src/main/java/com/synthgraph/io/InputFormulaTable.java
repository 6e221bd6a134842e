package com.synthgraph.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code input_formulas} entry of a patch layout.
 *
 * <p>
 * The layout stores formulas under string keys of the form
 * {@code "<nodeId>::<portId>"}. This table splits those keys once into
 * {@link InputKey}s. Entries with a malformed key, a missing expression or a
 * missing inputs list are ignored, as the editor does.
 */
public final class InputFormulaTable {
    public static final String LAYOUT_KEY = "input_formulas";
    public static final String KEY_SEPARATOR = "::";

    private static final InputFormulaTable EMPTY = new InputFormulaTable(Map.of());

    private final Map<InputKey, InputFormula> formulas;

    private InputFormulaTable(Map<InputKey, InputFormula> formulas) {
        this.formulas = formulas;
    }

    public static InputFormulaTable fromLayout(Map<String, Object> layout) {
        if (layout == null || !(layout.get(LAYOUT_KEY) instanceof Map<?, ?> raw))
            return EMPTY;

        Map<InputKey, InputFormula> parsed = new HashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            InputKey key = parseKey(String.valueOf(e.getKey()));
            if (key == null || !(e.getValue() instanceof Map<?, ?> entry))
                continue;
            if (!(entry.get("expression") instanceof String expression))
                continue;
            if (!(entry.get("inputs") instanceof List<?> inputs))
                continue;

            List<InputFormula.Binding> bindings = new ArrayList<>();
            for (Object item : inputs) {
                if (!(item instanceof Map<?, ?> m))
                    continue;
                String token = trimmed(m.get("token"));
                String fromNode = trimmed(m.get("from_node_id"));
                String fromPort = trimmed(m.get("from_port_id"));
                if (token.isEmpty() || fromNode.isEmpty() || fromPort.isEmpty())
                    continue;
                bindings.add(new InputFormula.Binding(token, fromNode, fromPort));
            }
            parsed.put(key, new InputFormula(expression, bindings));
        }
        return parsed.isEmpty() ? EMPTY : new InputFormulaTable(Collections.unmodifiableMap(parsed));
    }

    static InputKey parseKey(String key) {
        int sep = key.indexOf(KEY_SEPARATOR);
        if (sep < 1)
            return null;
        String node = key.substring(0, sep).trim();
        String port = key.substring(sep + KEY_SEPARATOR.length()).trim();
        if (node.isEmpty() || port.isEmpty())
            return null;
        return new InputKey(node, port);
    }

    private static String trimmed(Object o) {
        return o instanceof String s ? s.trim() : "";
    }

    /** Returns the formula for the input, or null. */
    public InputFormula get(InputKey key) {
        return formulas.get(key);
    }

    public int size() {
        return formulas.size();
    }
}
