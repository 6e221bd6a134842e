package com.synthgraph.api;

import java.util.Optional;

/**
 * Source of opcode definitions consumed by the compiler.
 *
 * Implementations must be safe for concurrent reads; the compiler never
 * mutates what it gets back.
 */
@FunctionalInterface
public interface OpcodeRegistry {

    Optional<OpcodeSpec> lookup(String name);
}
