package com.synthgraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.synthgraph.api.EventPublisher;
import com.synthgraph.api.MidiSink;
import com.synthgraph.engine.CompilationException;
import com.synthgraph.engine.CompiledProgram;
import com.synthgraph.engine.GraphCompiler;
import com.synthgraph.engine.InstrumentTarget;
import com.synthgraph.io.BuiltinOpcodes;
import com.synthgraph.io.PatchReader;
import com.synthgraph.io.SynthGraphSettings;
import com.synthgraph.seq.SequencerEngine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point wiring settings, the built-in opcode catalog, the compiler and
 * sequencer sessions.
 *
 * <p>
 * Run from the command line with one or more patch JSON files to print the
 * compiled document. With several files, instrument n listens on MIDI
 * channel n; a single file compiles as an omni instrument.
 */
public final class SynthGraph {
    private static final Logger log = LogManager.getLogger(SynthGraph.class);

    private final SynthGraphSettings settings;
    private final BuiltinOpcodes opcodes;
    private final GraphCompiler compiler;

    public SynthGraph() {
        this(SynthGraphSettings.load());
    }

    public SynthGraph(SynthGraphSettings settings) {
        this.settings = settings;
        this.opcodes = new BuiltinOpcodes();
        this.compiler = new GraphCompiler(opcodes, settings.getCompiler());
    }

    public SynthGraphSettings settings() {
        return settings;
    }

    /** The catalog the compiler resolves opcodes from; custom opcodes may be registered on it. */
    public BuiltinOpcodes opcodes() {
        return opcodes;
    }

    public GraphCompiler compiler() {
        return compiler;
    }

    /** @throws CompilationException with the collected diagnostics */
    public CompiledProgram compile(List<InstrumentTarget> targets) {
        return compiler.compile(targets);
    }

    /** Reads and compiles one patch file as an omni instrument. */
    public CompiledProgram compileFile(Path path) {
        try {
            return compiler.compile(PatchReader.readFile(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read patch from " + path, e);
        }
    }

    /** Creates a stopped sequencer for a session, sending to the configured MIDI input. */
    public SequencerEngine newSequencer(String sessionId, MidiSink sink, EventPublisher listener) {
        return SequencerEngine.create(sessionId, sink, settings.getCompiler().getMidiInput(), listener,
                settings.getSequencer());
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("usage: SynthGraph <patch.json> [<patch.json> ...]");
            System.exit(2);
        }
        SynthGraph synthGraph = new SynthGraph();
        List<InstrumentTarget> targets = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                int channel = args.length > 1 ? i + 1 : InstrumentTarget.OMNI;
                targets.add(new InstrumentTarget(PatchReader.readFile(Path.of(args[i])), channel));
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read patch: {}", e.getMessage());
            System.exit(1);
        }

        CompiledProgram program = synthGraph.compiler.tryCompile(targets);
        if (!program.succeeded()) {
            program.diagnostics().forEach(d -> System.err.println("error: " + d));
            System.exit(1);
        }
        System.out.println(program.document());
    }
}
