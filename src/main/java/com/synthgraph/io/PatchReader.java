package com.synthgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Set;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads patch and sequencer documents from JSON.
 *
 * Duplicate node ids are rejected here, and absent collections are replaced
 * with empty ones.
 */
public final class PatchReader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PatchReader() {
        // Utility class
    }

    public static PatchDefinition readFile(Path path) throws IOException {
        return read(Files.readString(path));
    }

    public static PatchDefinition read(InputStream in) throws IOException {
        return validate(MAPPER.readValue(in, PatchDefinition.class));
    }

    public static PatchDefinition read(String json) throws IOException {
        return validate(MAPPER.readValue(json, PatchDefinition.class));
    }

    public static SequencerDefinition readSequencer(String json) throws IOException {
        return MAPPER.readValue(json, SequencerDefinition.class);
    }

    public static SequencerDefinition readSequencer(InputStream in) throws IOException {
        return MAPPER.readValue(in, SequencerDefinition.class);
    }

    static PatchDefinition validate(PatchDefinition def) {
        if (def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        PatchDefinition.GraphInfo graph = def.getGraph();
        if (graph.getNodes() == null)
            graph.setNodes(new ArrayList<>());
        if (graph.getConnections() == null)
            graph.setConnections(new ArrayList<>());
        if (graph.getUiLayout() == null)
            graph.setUiLayout(new LinkedHashMap<>());
        if (graph.getEngineConfig() == null)
            graph.setEngineConfig(new PatchDefinition.EngineConfig());
        Set<String> ids = new HashSet<>();
        for (PatchDefinition.NodeDef nd : graph.getNodes()) {
            if (nd.getParams() == null)
                nd.setParams(new LinkedHashMap<>());
            if (nd.getId() == null || nd.getId().isEmpty())
                throw new IllegalArgumentException("Node without id in patch " + def.getName());
            if (!ids.add(nd.getId()))
                throw new IllegalArgumentException("Duplicate node id: " + nd.getId());
        }
        return def;
    }
}
