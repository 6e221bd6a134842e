package com.synthgraph.api;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Declared input or output of an opcode.
 *
 * @param id            identifier, unique among the opcode's inputs and outputs
 *                      and used as the template placeholder name
 * @param rate          the port's own signal rate
 * @param required      whether an unresolved input is an error (inputs only)
 * @param defaultValue  literal used when nothing is connected or set, may be
 *                      null
 * @param acceptedRates extra source rates this input accepts in addition to
 *                      its own rate
 */
public record PortSpec(String id, SignalRate rate, boolean required, Object defaultValue,
        Set<SignalRate> acceptedRates) {

    public PortSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rate, "rate");
        acceptedRates = acceptedRates == null || acceptedRates.isEmpty()
                ? Set.of()
                : Set.copyOf(acceptedRates);
    }

    /** A required port with no default. */
    public static PortSpec of(String id, SignalRate rate) {
        return new PortSpec(id, rate, true, null, Set.of());
    }

    public PortSpec withDefault(Object value) {
        return new PortSpec(id, rate, required, value, acceptedRates);
    }

    public PortSpec optional() {
        return new PortSpec(id, rate, false, defaultValue, acceptedRates);
    }

    public PortSpec accepting(SignalRate first, SignalRate... rest) {
        return new PortSpec(id, rate, required, defaultValue, EnumSet.of(first, rest));
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
