package com.synthgraph.engine;

import java.util.List;

/**
 * Thrown when a patch or bundle cannot be compiled. Carries every diagnostic
 * found before compilation stopped, in discovery order.
 */
public class CompilationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> diagnostics;

    public CompilationException(List<String> diagnostics) {
        super("Patch compilation failed: " + String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public CompilationException(String diagnostic) {
        this(List.of(diagnostic));
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
