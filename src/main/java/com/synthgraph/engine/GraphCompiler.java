package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.synthgraph.api.OpcodeRegistry;
import com.synthgraph.api.OpcodeSpec;
import com.synthgraph.api.PortSpec;
import com.synthgraph.io.InputFormulaTable;
import com.synthgraph.io.InputKey;
import com.synthgraph.io.PatchDefinition;
import com.synthgraph.io.PatchDefinition.ConnectionDef;
import com.synthgraph.io.PatchDefinition.EngineConfig;
import com.synthgraph.io.PatchDefinition.GraphInfo;
import com.synthgraph.io.PatchDefinition.NodeDef;
import com.synthgraph.io.SynthGraphSettings;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles patches into a program for the synthesis engine.
 *
 * <p>
 * Per instrument the passes are:
 * <ol>
 * <li>opcode resolution (stops on any unknown opcode)</li>
 * <li>sink check (stops when there is none)</li>
 * <li>limits, connections, parameters and engine configuration</li>
 * <li>dependency order, with a single diagnostic for any cycle</li>
 * <li>emission</li>
 * </ol>
 * Passes 3 and 4 report everything they find before compilation stops.
 *
 * <p>
 * Stateless apart from the read-only registry and settings; one instance can
 * serve concurrent callers.
 */
@Log4j2
public final class GraphCompiler {
    public static final int MAX_NODES = 500;
    public static final int MAX_CONNECTIONS = 2000;
    public static final int MIN_SAMPLE_RATE = 22_000;
    public static final int MAX_SAMPLE_RATE = 48_000;
    public static final int MAX_MIDI_CHANNEL = 16;

    static final String CYCLE = "Graph contains a cycle. Add explicit delay/feedback opcodes to break direct recursion.";

    private final OpcodeRegistry registry;
    private final SynthGraphSettings.Compiler settings;

    public GraphCompiler(OpcodeRegistry registry, SynthGraphSettings.Compiler settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Compiles one patch as an omni instrument with the configured MIDI input. */
    public CompiledProgram compile(PatchDefinition patch) {
        return compile(List.of(InstrumentTarget.omni(patch)));
    }

    public CompiledProgram compile(List<InstrumentTarget> targets) {
        return compile(targets, settings.getMidiInput(), settings.getRtmidiModule());
    }

    /**
     * Compiles the targets as instruments 1..n, in list order.
     *
     * @throws CompilationException with every diagnostic found
     */
    public CompiledProgram compile(List<InstrumentTarget> targets, String midiInput, String rtmidiModule) {
        if (targets == null || targets.isEmpty())
            throw new CompilationException("No instruments to compile.");

        Diagnostics diagnostics = new Diagnostics();
        checkChannels(targets, diagnostics);

        boolean bundle = targets.size() > 1;
        List<ProgramDocumentWriter.InstrumentBlock> blocks = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            InstrumentTarget target = targets.get(i);
            int number = i + 1;
            try {
                List<String> lines = compileInstrument(target.patch());
                blocks.add(new ProgramDocumentWriter.InstrumentBlock(number, target.midiChannel(), lines));
            } catch (CompilationException e) {
                for (String d : e.diagnostics())
                    diagnostics.add(bundle ? "Instrument " + number + ": " + d : d);
            }
        }
        if (!diagnostics.isEmpty()) {
            log.debug("Compile of {} instrument(s) failed with {} diagnostic(s)", targets.size(), diagnostics.size());
            diagnostics.failIfAny();
        }

        EngineConfig header = engineConfig(targets.get(0).patch());
        for (int i = 1; i < targets.size(); i++) {
            if (!header.sameHeaderAs(engineConfig(targets.get(i).patch())))
                log.warn("Instrument {} engine configuration differs from instrument 1 and is ignored", i + 1);
        }

        String orchestra = ProgramDocumentWriter.orchestra(header, blocks);
        String document = ProgramDocumentWriter.document(orchestra,
                ProgramDocumentWriter.options(settings, midiInput, rtmidiModule));
        log.debug("Compiled {} instrument(s) into {} characters", blocks.size(), orchestra.length());
        return new CompiledProgram(orchestra, document, List.of());
    }

    /** Like {@link #compile(List)} but reports failure through the result. */
    public CompiledProgram tryCompile(List<InstrumentTarget> targets) {
        try {
            return compile(targets);
        } catch (CompilationException e) {
            return CompiledProgram.failed(e.diagnostics());
        }
    }

    private static void checkChannels(List<InstrumentTarget> targets, Diagnostics diagnostics) {
        Map<Integer, List<Integer>> byChannel = new TreeMap<>();
        for (int i = 0; i < targets.size(); i++) {
            InstrumentTarget target = targets.get(i);
            int ch = target.midiChannel();
            if (ch < 0 || ch > MAX_MIDI_CHANNEL) {
                diagnostics.add("Instrument " + (i + 1) + ": MIDI channel " + ch + " is outside 0.." + MAX_MIDI_CHANNEL + ".");
                continue;
            }
            if (target.channelBound())
                byChannel.computeIfAbsent(ch, k -> new ArrayList<>()).add(i + 1);
        }
        byChannel.forEach((ch, instruments) -> {
            if (instruments.size() > 1)
                diagnostics.add("MIDI channel " + ch + " is assigned to more than one instrument: " + instruments + ".");
        });
    }

    // ── Per-instrument passes ─────────────────────────────────────

    List<String> compileInstrument(PatchDefinition patch) {
        GraphInfo graph = patch.getGraph();
        Diagnostics diagnostics = new Diagnostics();
        if (graph == null || graph.getNodes() == null || graph.getNodes().isEmpty())
            throw new CompilationException("Patch graph is empty. Add opcode nodes before compiling.");
        List<NodeDef> nodes = graph.getNodes();
        List<ConnectionDef> connections = graph.getConnections() == null ? List.of() : graph.getConnections();

        // 1. Opcodes
        Map<String, CodeEmitter.ResolvedNode> resolved = new LinkedHashMap<>();
        for (NodeDef node : nodes) {
            if (node.getId() == null || node.getId().isBlank()) {
                diagnostics.add("Node without id (opcode '" + node.getOpcode() + "').");
                continue;
            }
            if (resolved.containsKey(node.getId())) {
                diagnostics.add("Duplicate node id '" + node.getId() + "'.");
                continue;
            }
            OpcodeSpec spec = registry.lookup(node.getOpcode()).orElse(null);
            if (spec == null) {
                diagnostics.add("Node '" + node.getId() + "' references unknown opcode '" + node.getOpcode() + "'.");
                continue;
            }
            resolved.put(node.getId(), new CodeEmitter.ResolvedNode(node, spec));
        }
        diagnostics.failIfAny();

        // 2. Sink
        List<String> sinks = new ArrayList<>();
        resolved.forEach((id, rn) -> {
            if (rn.spec().isSink())
                sinks.add(id);
        });
        if (sinks.isEmpty())
            throw new CompilationException("Patch must include an output node (an opcode without outputs, such as 'outs').");
        if (sinks.size() > 1)
            diagnostics.add("Patch must include exactly one output node; found " + sinks.size() + ": " + sinks + ".");

        // 3. Limits, connections, params, engine config
        if (nodes.size() > MAX_NODES)
            diagnostics.add("Patch has " + nodes.size() + " nodes; the limit is " + MAX_NODES + ".");
        if (connections.size() > MAX_CONNECTIONS)
            diagnostics.add("Patch has " + connections.size() + " connections; the limit is " + MAX_CONNECTIONS + ".");
        Map<InputKey, List<ConnectionDef>> inbound = validateConnections(connections, resolved, diagnostics);
        validateParams(resolved, diagnostics);
        validateEngineConfig(engineConfig(patch), diagnostics);

        // 4. Order
        TopologicalOrder.Builder topo = TopologicalOrder.builder();
        for (NodeDef node : nodes)
            topo.addNode(node.getId());
        for (ConnectionDef c : connections)
            if (topo.contains(c.getFromNodeId()) && topo.contains(c.getToNodeId()))
                topo.addEdge(c.getFromNodeId(), c.getToNodeId());
        TopologicalOrder order = topo.build();
        if (order.hasCycle())
            diagnostics.add(CYCLE);
        diagnostics.failIfAny();

        // 5. Emission
        List<CodeEmitter.ResolvedNode> ordered = new ArrayList<>(order.nodeCount());
        for (String id : order.order())
            ordered.add(resolved.get(id));
        InputFormulaTable formulas = InputFormulaTable.fromLayout(graph.getUiLayout());
        List<String> lines = new CodeEmitter(formulas, diagnostics).emit(ordered, inbound);
        diagnostics.failIfAny();
        return lines;
    }

    private static Map<InputKey, List<ConnectionDef>> validateConnections(List<ConnectionDef> connections,
            Map<String, CodeEmitter.ResolvedNode> resolved, Diagnostics diagnostics) {
        Map<InputKey, List<ConnectionDef>> inbound = new HashMap<>();
        for (ConnectionDef c : connections) {
            CodeEmitter.ResolvedNode source = resolved.get(c.getFromNodeId());
            CodeEmitter.ResolvedNode target = resolved.get(c.getToNodeId());
            if (source == null) {
                diagnostics.add("Connection source node not found: '" + c.getFromNodeId() + "'");
                continue;
            }
            if (target == null) {
                diagnostics.add("Connection target node not found: '" + c.getToNodeId() + "'");
                continue;
            }
            PortSpec from = source.spec().output(c.getFromPortId());
            PortSpec to = target.spec().input(c.getToPortId());
            if (from == null) {
                diagnostics.add("Unknown source port '" + c.getFromPortId() + "' on node '" + c.getFromNodeId()
                        + "' (" + source.spec().name() + ")");
                continue;
            }
            if (to == null) {
                diagnostics.add("Unknown target port '" + c.getToPortId() + "' on node '" + c.getToNodeId()
                        + "' (" + target.spec().name() + ")");
                continue;
            }
            if (!SignalTypeChecker.isCompatible(from.rate(), to)) {
                diagnostics.add(SignalTypeChecker.mismatch(c.getFromNodeId(), from, c.getToNodeId(), to));
                continue;
            }
            inbound.computeIfAbsent(new InputKey(c.getToNodeId(), c.getToPortId()), k -> new ArrayList<>()).add(c);
        }
        return inbound;
    }

    private static void validateParams(Map<String, CodeEmitter.ResolvedNode> resolved, Diagnostics diagnostics) {
        for (CodeEmitter.ResolvedNode rn : resolved.values()) {
            for (String key : rn.node().getParams().keySet()) {
                if (rn.spec().input(key) == null && !rn.spec().declaresParam(key))
                    diagnostics.add("Unknown parameter '" + key + "' on node '" + rn.node().getId()
                            + "' (" + rn.spec().name() + ").");
            }
        }
    }

    private static void validateEngineConfig(EngineConfig config, Diagnostics diagnostics) {
        if (config.getSr() < MIN_SAMPLE_RATE || config.getSr() > MAX_SAMPLE_RATE)
            diagnostics.add("Sample rate " + config.getSr() + " is outside " + MIN_SAMPLE_RATE + ".." + MAX_SAMPLE_RATE + ".");
        if (config.resolvedKsmps() <= 0)
            diagnostics.add("ksmps must be positive, got " + config.resolvedKsmps() + ".");
        if (config.getNchnls() <= 0)
            diagnostics.add("nchnls must be positive, got " + config.getNchnls() + ".");
    }

    private static EngineConfig engineConfig(PatchDefinition patch) {
        EngineConfig config = patch.getGraph() == null ? null : patch.getGraph().getEngineConfig();
        return config == null ? new EngineConfig() : config;
    }
}
