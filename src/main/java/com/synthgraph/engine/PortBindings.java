package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.synthgraph.api.OpcodeSpec;

/**
 * Values bound to one node's template placeholders.
 *
 * <p>
 * Keys are checked against the opcode when they are bound: outputs take only
 * allocated variables, template parameters take only literals, and inputs take
 * anything else. {@link Builder#build()} refuses to produce a binding set with
 * a placeholder left unbound, so filling the template cannot hit a missing
 * key.
 */
final class PortBindings {
    /** Stands in for an unresolved optional input until the template line is cleaned. */
    static final String OMIT_MARKER = "__SG_OPTIONAL_OMIT__";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    enum Kind {
        OUTPUT_VARIABLE, SOURCE_EXPRESSION, LITERAL, OMITTED
    }

    record Value(Kind kind, String text) {

        static Value output(String variable) {
            return new Value(Kind.OUTPUT_VARIABLE, variable);
        }

        static Value source(String expression) {
            return new Value(Kind.SOURCE_EXPRESSION, expression);
        }

        static Value literal(String text) {
            return new Value(Kind.LITERAL, text);
        }

        static Value omitted() {
            return new Value(Kind.OMITTED, OMIT_MARKER);
        }
    }

    private final OpcodeSpec spec;
    private final Map<String, Value> values;

    private PortBindings(OpcodeSpec spec, Map<String, Value> values) {
        this.spec = spec;
        this.values = Collections.unmodifiableMap(values);
    }

    static Builder builder(OpcodeSpec spec) {
        return new Builder(spec);
    }

    /** Template placeholders that name neither a port nor a declared parameter, in order. */
    static List<String> undeclaredPlaceholders(OpcodeSpec spec) {
        List<String> out = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(spec.template());
        while (m.find()) {
            String id = m.group(1);
            if (spec.input(id) == null && spec.output(id) == null && !spec.declaresParam(id) && !out.contains(id))
                out.add(id);
        }
        return out;
    }

    /** Substitutes every placeholder of the opcode template. */
    String fill() {
        Matcher m = PLACEHOLDER.matcher(spec.template());
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Value v = values.get(m.group(1));
            if (v == null)
                throw new IllegalStateException("Template of '" + spec.name()
                        + "' references undeclared placeholder '" + m.group(1) + "'");
            m.appendReplacement(sb, Matcher.quoteReplacement(v.text()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static final class Builder {
        private final OpcodeSpec spec;
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder(OpcodeSpec spec) {
            this.spec = spec;
        }

        Builder bind(String id, Value value) {
            boolean ok;
            if (spec.output(id) != null)
                ok = value.kind() == Kind.OUTPUT_VARIABLE;
            else if (spec.input(id) != null)
                ok = value.kind() != Kind.OUTPUT_VARIABLE;
            else if (spec.declaresParam(id))
                ok = value.kind() == Kind.LITERAL;
            else
                throw new IllegalArgumentException("'" + id + "' is not a port or parameter of " + spec.name());
            if (!ok)
                throw new IllegalArgumentException(value.kind() + " cannot bind '" + id + "' of " + spec.name());
            if (values.putIfAbsent(id, value) != null)
                throw new IllegalArgumentException("'" + id + "' of " + spec.name() + " is already bound");
            return this;
        }

        PortBindings build() {
            List<String> missing = new ArrayList<>();
            spec.outputs().forEach(p -> {
                if (!values.containsKey(p.id()))
                    missing.add(p.id());
            });
            spec.inputs().forEach(p -> {
                if (!values.containsKey(p.id()))
                    missing.add(p.id());
            });
            for (String key : spec.params().keySet())
                if (!values.containsKey(key))
                    missing.add(key);
            if (!missing.isEmpty())
                throw new IllegalStateException("Unbound placeholders on " + spec.name() + ": " + missing);
            return new PortBindings(spec, new LinkedHashMap<>(values));
        }
    }
}
