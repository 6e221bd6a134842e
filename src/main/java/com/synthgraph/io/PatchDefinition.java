package com.synthgraph.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a patch: opcode nodes, the connections between their
 * ports, the free-form editor layout and the engine configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PatchDefinition {
    private String name, description;
    private GraphInfo graph = new GraphInfo();

    /** Starts an empty patch, mostly for programmatic construction. */
    public static PatchDefinition named(String name) {
        PatchDefinition def = new PatchDefinition();
        def.setName(name);
        return def;
    }

    public PatchDefinition node(String id, String opcode) {
        return node(id, opcode, Map.of());
    }

    public PatchDefinition node(String id, String opcode, Map<String, Object> params) {
        NodeDef nd = new NodeDef();
        nd.setId(id);
        nd.setOpcode(opcode);
        nd.setParams(new LinkedHashMap<>(params));
        graph.getNodes().add(nd);
        return this;
    }

    public PatchDefinition connect(String fromNode, String fromPort, String toNode, String toPort) {
        ConnectionDef c = new ConnectionDef();
        c.setFromNodeId(fromNode);
        c.setFromPortId(fromPort);
        c.setToNodeId(toNode);
        c.setToPortId(toPort);
        graph.getConnections().add(c);
        return this;
    }

    /** Stores a merge formula in the layout under the editor's "node::port" key. */
    public PatchDefinition formula(String toNode, String toPort, String expression,
            List<Map<String, Object>> inputs) {
        @SuppressWarnings("unchecked")
        var formulas = (Map<String, Object>) graph.getUiLayout()
                .computeIfAbsent(InputFormulaTable.LAYOUT_KEY, k -> new LinkedHashMap<String, Object>());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("expression", expression);
        entry.put("inputs", inputs);
        formulas.put(toNode + InputFormulaTable.KEY_SEPARATOR + toPort, entry);
        return this;
    }

    /** Node graph, layout and engine settings. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private List<NodeDef> nodes = new ArrayList<>();
        private List<ConnectionDef> connections = new ArrayList<>();
        @JsonProperty("ui_layout")
        private Map<String, Object> uiLayout = new LinkedHashMap<>();
        @JsonProperty("engine_config")
        private EngineConfig engineConfig = new EngineConfig();
    }

    /** One opcode instance. Params are literals keyed by input port or parameter id. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDef {
        private String id, opcode;
        private Map<String, Object> params = new LinkedHashMap<>();
    }

    /** Directed edge from an output port to an input port. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDef {
        @JsonProperty("from_node_id")
        private String fromNodeId;
        @JsonProperty("from_port_id")
        private String fromPortId;
        @JsonProperty("to_node_id")
        private String toNodeId;
        @JsonProperty("to_port_id")
        private String toPortId;
    }

    /** Engine header values written at the top of a compiled program. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EngineConfig {
        private int sr = 44_100;
        @JsonProperty("control_rate")
        private Integer controlRate;
        private int ksmps = 10;
        private int nchnls = 2;
        @JsonProperty("0dbfs")
        private double zeroDbfs = 1.0;

        /** Block size, derived from the control rate when one is given. */
        public int resolvedKsmps() {
            if (controlRate != null && controlRate > 0)
                return Math.max(1, (int) Math.round((double) sr / controlRate));
            return ksmps;
        }

        public boolean sameHeaderAs(EngineConfig other) {
            return sr == other.sr && resolvedKsmps() == other.resolvedKsmps()
                    && nchnls == other.nchnls && Double.compare(zeroDbfs, other.zeroDbfs) == 0;
        }
    }
}
