package com.synthgraph.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only description of an opcode: its ports, the non-port template
 * parameters it accepts, and the code template the compiler fills in.
 *
 * <p>
 * Templates reference ports and parameters as {@code {id}} placeholders. A
 * template may span several lines.
 */
public record OpcodeSpec(String name, String category, String description,
        List<PortSpec> inputs, List<PortSpec> outputs,
        Map<String, Object> params, String template) {

    public OpcodeSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(template, "template");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /** An opcode with no outputs terminates a signal chain. */
    public boolean isSink() {
        return outputs.isEmpty();
    }

    /** Returns the input port with the given id, or null. */
    public PortSpec input(String portId) {
        for (PortSpec p : inputs)
            if (p.id().equals(portId))
                return p;
        return null;
    }

    /** Returns the output port with the given id, or null. */
    public PortSpec output(String portId) {
        for (PortSpec p : outputs)
            if (p.id().equals(portId))
                return p;
        return null;
    }

    public boolean declaresParam(String key) {
        return params.containsKey(key);
    }
}
