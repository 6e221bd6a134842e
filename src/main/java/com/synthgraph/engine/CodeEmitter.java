package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.synthgraph.api.OpcodeSpec;
import com.synthgraph.api.PortSpec;
import com.synthgraph.api.SignalRate;
import com.synthgraph.expr.InputMergeResolver;
import com.synthgraph.io.InputFormulaTable;
import com.synthgraph.io.InputKey;
import com.synthgraph.io.PatchDefinition.ConnectionDef;
import com.synthgraph.io.PatchDefinition.NodeDef;

/**
 * Emits the body lines of one instrument from its nodes in dependency order.
 *
 * <p>
 * Each output gets a variable {@code <rate>_<node>_<port>_<n>}, where n counts
 * per rate across the instrument. Each input resolves to, in order: its
 * inbound source(s), the node's parameter, the port default. A required input
 * left unresolved is reported; an optional one is omitted from the end of its
 * template line.
 *
 * One emitter per instrument; problems are added to the given diagnostics and
 * emission continues so that all of them are reported together.
 */
final class CodeEmitter {
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern TRAILING_OMIT = Pattern.compile(
            "(?:,\\s*" + PortBindings.OMIT_MARKER + "|\\s+" + PortBindings.OMIT_MARKER + ")\\s*$");

    private final InputFormulaTable formulas;
    private final Diagnostics diagnostics;
    private final Map<SignalRate, Integer> counters = new EnumMap<>(SignalRate.class);
    private final Map<String, String> outputVars = new HashMap<>();

    CodeEmitter(InputFormulaTable formulas, Diagnostics diagnostics) {
        this.formulas = formulas;
        this.diagnostics = diagnostics;
    }

    /** A node paired with the opcode it references. */
    record ResolvedNode(NodeDef node, OpcodeSpec spec) {
    }

    List<String> emit(List<ResolvedNode> ordered, Map<InputKey, List<ConnectionDef>> inbound) {
        List<String> lines = new ArrayList<>();
        for (ResolvedNode rn : ordered)
            emitNode(rn, inbound, lines);
        return lines;
    }

    private void emitNode(ResolvedNode rn, Map<InputKey, List<ConnectionDef>> inbound, List<String> lines) {
        NodeDef node = rn.node();
        OpcodeSpec spec = rn.spec();
        List<String> undeclared = PortBindings.undeclaredPlaceholders(spec);
        if (!undeclared.isEmpty()) {
            for (String key : undeclared)
                diagnostics.add("Template value missing for node '" + node.getId() + "': " + key);
            return;
        }
        PortBindings.Builder bindings = PortBindings.builder(spec);
        int before = diagnostics.size();

        for (PortSpec out : spec.outputs()) {
            String var = allocate(node.getId(), out);
            outputVars.put(node.getId() + "." + out.id(), var);
            bindings.bind(out.id(), PortBindings.Value.output(var));
        }

        for (PortSpec in : spec.inputs()) {
            PortBindings.Value value = resolveInput(node, spec, in, inbound.get(new InputKey(node.getId(), in.id())));
            if (value != null)
                bindings.bind(in.id(), value);
        }

        for (Map.Entry<String, Object> param : spec.params().entrySet()) {
            Object raw = node.getParams().getOrDefault(param.getKey(), param.getValue());
            String literal = literal(node, param.getKey(), raw, SignalRate.CONTROL);
            if (literal != null)
                bindings.bind(param.getKey(), PortBindings.Value.literal(literal));
        }

        if (diagnostics.size() > before)
            return;

        String rendered = bindings.build().fill();
        lines.add("; node:" + node.getId() + " opcode:" + spec.name());
        for (String raw : rendered.split("\n", -1)) {
            String line = stripTrailingOmissions(raw);
            if (line.contains(PortBindings.OMIT_MARKER)) {
                diagnostics.add("Unsupported optional argument placement in opcode template line: '"
                        + raw.replace(PortBindings.OMIT_MARKER, "<omitted>") + "'");
                continue;
            }
            lines.add(line);
        }
    }

    private PortBindings.Value resolveInput(NodeDef node, OpcodeSpec spec, PortSpec in, List<ConnectionDef> edges) {
        InputKey key = new InputKey(node.getId(), in.id());
        if (edges != null && !edges.isEmpty()) {
            Set<String> seen = new LinkedHashSet<>();
            List<InputMergeResolver.Source> sources = new ArrayList<>();
            for (ConnectionDef c : edges) {
                String ref = c.getFromNodeId() + "." + c.getFromPortId();
                if (!seen.add(ref))
                    continue;
                String var = outputVars.get(ref);
                if (var == null) {
                    diagnostics.add("Internal compiler error: unresolved source variable for " + ref);
                    return null;
                }
                sources.add(new InputMergeResolver.Source(c.getFromNodeId(), c.getFromPortId(), var));
            }
            InputMergeResolver.Resolution r = InputMergeResolver.resolve(key, sources, formulas.get(key));
            if (!r.ok()) {
                diagnostics.addAll(r.errors());
                return null;
            }
            return PortBindings.Value.source(r.expression());
        }

        if (node.getParams().containsKey(in.id())) {
            String literal = literal(node, in.id(), node.getParams().get(in.id()), in.rate());
            return literal == null ? null : PortBindings.Value.literal(literal);
        }
        if (in.hasDefault()) {
            String literal = literal(node, in.id(), in.defaultValue(), in.rate());
            return literal == null ? null : PortBindings.Value.literal(literal);
        }
        if (in.required()) {
            diagnostics.add("Missing required input '" + in.id() + "' on node '" + node.getId()
                    + "' (" + spec.name() + ").");
            return null;
        }
        return PortBindings.Value.omitted();
    }

    private String literal(NodeDef node, String id, Object value, SignalRate rate) {
        try {
            return LiteralFormatter.format(value, rate);
        } catch (IllegalArgumentException e) {
            diagnostics.add("Node '" + node.getId() + "' value for '" + id + "': " + e.getMessage());
            return null;
        }
    }

    private String allocate(String nodeId, PortSpec port) {
        int n = counters.merge(port.rate(), 1, Integer::sum);
        return port.rate().code() + "_" + sanitize(nodeId) + "_" + sanitize(port.id()) + "_" + n;
    }

    static String sanitize(String id) {
        return UNSAFE_NAME_CHARS.matcher(id).replaceAll("_");
    }

    static String stripTrailingOmissions(String line) {
        while (true) {
            String trimmed = TRAILING_OMIT.matcher(line).replaceFirst("");
            if (trimmed.equals(line))
                return line;
            line = trimmed;
        }
    }
}
