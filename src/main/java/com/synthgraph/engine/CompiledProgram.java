package com.synthgraph.engine;

import java.util.List;

/**
 * Result of a compile request.
 *
 * @param orchestra   header and instrument blocks
 * @param document    the orchestra wrapped with engine options and score
 * @param diagnostics empty on success; on failure both texts are null
 */
public record CompiledProgram(String orchestra, String document, List<String> diagnostics) {

    public CompiledProgram {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static CompiledProgram failed(List<String> diagnostics) {
        return new CompiledProgram(null, null, diagnostics);
    }

    public boolean succeeded() {
        return diagnostics.isEmpty();
    }
}
