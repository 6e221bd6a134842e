package com.synthgraph.io;

import static com.synthgraph.api.SignalRate.AUDIO;
import static com.synthgraph.api.SignalRate.CONTROL;
import static com.synthgraph.api.SignalRate.INIT;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import com.synthgraph.api.OpcodeRegistry;
import com.synthgraph.api.OpcodeSpec;
import com.synthgraph.api.PortSpec;

/**
 * Registry of the opcodes the editor offers out of the box. Further opcodes
 * can be registered at startup; lookups are safe from any thread.
 */
public final class BuiltinOpcodes implements OpcodeRegistry {

    private final Map<String, OpcodeSpec> registry = new ConcurrentHashMap<>();

    public BuiltinOpcodes() {
        registerBuiltIns();
    }

    public BuiltinOpcodes register(OpcodeSpec spec) {
        registry.put(spec.name(), spec);
        return this;
    }

    @Override
    public Optional<OpcodeSpec> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(registry.get(name));
    }

    /** All opcodes, or those of one category, sorted by category then name. */
    public List<OpcodeSpec> list(String category) {
        List<OpcodeSpec> out = new ArrayList<>();
        for (OpcodeSpec spec : registry.values())
            if (category == null || category.equals(spec.category()))
                out.add(spec);
        out.sort(Comparator.comparing(OpcodeSpec::category).thenComparing(OpcodeSpec::name));
        return out;
    }

    /** Number of opcodes per category, keyed in alphabetical order. */
    public Map<String, Integer> categories() {
        Map<String, Integer> counts = new TreeMap<>();
        for (OpcodeSpec spec : registry.values())
            counts.merge(spec.category(), 1, Integer::sum);
        return counts;
    }

    // ── Built-in Opcodes ──────────────────────────────────────────

    private void registerBuiltIns() {
        // --- MIDI readers ---
        register(new OpcodeSpec("midi_note", "midi", "Extract MIDI note frequency and velocity amplitude.",
                List.of(PortSpec.of("gain", INIT).optional().withDefault(1)),
                List.of(PortSpec.of("kfreq", CONTROL), PortSpec.of("kamp", CONTROL)),
                null, "{kfreq} cpsmidi\n{kamp} ampmidi {gain}"));
        register(new OpcodeSpec("cpsmidi", "midi", "Read active MIDI note pitch as cycles-per-second.",
                List.of(),
                List.of(PortSpec.of("kfreq", INIT)),
                null, "{kfreq} cpsmidi"));
        register(new OpcodeSpec("midictrl", "midi", "Read a MIDI controller value with optional scaling.",
                List.of(PortSpec.of("inum", INIT).withDefault(1),
                        PortSpec.of("imin", INIT).optional().withDefault(0),
                        PortSpec.of("imax", INIT).optional().withDefault(127)),
                List.of(PortSpec.of("kval", CONTROL)),
                null, "{kval} midictrl {inum}, {imin}, {imax}"));

        // --- Envelopes ---
        register(new OpcodeSpec("adsr", "envelope", "Control-rate ADSR envelope.",
                List.of(PortSpec.of("iatt", INIT).withDefault(0.01),
                        PortSpec.of("idec", INIT).withDefault(0.15),
                        PortSpec.of("islev", INIT).withDefault(0.7),
                        PortSpec.of("irel", INIT).withDefault(0.2)),
                List.of(PortSpec.of("kenv", CONTROL)),
                null, "{kenv} madsr {iatt}, {idec}, {islev}, {irel}"));

        // --- Oscillators ---
        register(new OpcodeSpec("oscili", "oscillator", "Classic interpolating oscillator.",
                List.of(PortSpec.of("amp", CONTROL).withDefault(0.4),
                        PortSpec.of("freq", CONTROL).accepting(AUDIO, CONTROL, INIT).withDefault(440),
                        PortSpec.of("ifn", INIT).withDefault(1)),
                List.of(PortSpec.of("asig", AUDIO)),
                null, "{asig} oscili {amp}, {freq}, {ifn}"));
        register(new OpcodeSpec("vco", "oscillator", "Band-limited voltage-controlled oscillator.",
                List.of(PortSpec.of("amp", CONTROL).withDefault(0.4),
                        PortSpec.of("freq", CONTROL).accepting(AUDIO, CONTROL, INIT).withDefault(440),
                        PortSpec.of("iwave", INIT).optional().withDefault(1),
                        PortSpec.of("kpw", CONTROL).optional().withDefault(0.5),
                        PortSpec.of("ifn", INIT).optional()),
                List.of(PortSpec.of("asig", AUDIO)),
                null, "{asig} vco {amp}, {freq}, {iwave}, {kpw}, {ifn}"));

        // --- Tables ---
        List<PortSpec> ftgenInputs = new ArrayList<>(List.of(
                PortSpec.of("ifn", INIT).withDefault(1),
                PortSpec.of("itime", INIT).withDefault(0),
                PortSpec.of("isize", INIT).withDefault(16384),
                PortSpec.of("igen", INIT).withDefault(10),
                PortSpec.of("iarg1", INIT).withDefault(1)));
        StringBuilder ftgenTemplate = new StringBuilder("{ift} ftgen {ifn}, {itime}, {isize}, {igen}, {iarg1}");
        for (int i = 2; i <= 8; i++) {
            ftgenInputs.add(PortSpec.of("iarg" + i, INIT).optional());
            ftgenTemplate.append(", {iarg").append(i).append('}');
        }
        register(new OpcodeSpec("ftgen", "tables", "Create a function table at init time using a GEN routine.",
                ftgenInputs, List.of(PortSpec.of("ift", INIT)), null, ftgenTemplate.toString()));

        // --- Math / utility ---
        register(binary("k_mul", "math", "Multiply two control signals.", CONTROL, "kout", "*"));
        register(binary("a_mul", "math", "Multiply two audio signals.", AUDIO, "aout", "*"));
        register(new OpcodeSpec("k_to_a", "utility", "Interpolate control signal to audio-rate.",
                List.of(PortSpec.of("kin", CONTROL)),
                List.of(PortSpec.of("aout", AUDIO)),
                null, "{aout} interp {kin}"));

        // --- Filters / mixing / output ---
        register(new OpcodeSpec("moogladder", "filter", "Moog ladder low-pass filter.",
                List.of(PortSpec.of("ain", AUDIO),
                        PortSpec.of("kcf", CONTROL).withDefault(2000),
                        PortSpec.of("kres", CONTROL).withDefault(0.2)),
                List.of(PortSpec.of("aout", AUDIO)),
                null, "{aout} moogladder {ain}, {kcf}, {kres}"));
        register(binary("mix2", "mixer", "Mix two audio signals.", AUDIO, "aout", "+"));
        register(new OpcodeSpec("outs", "output", "Stereo output sink.",
                List.of(PortSpec.of("left", AUDIO), PortSpec.of("right", AUDIO)),
                List.of(),
                null, "outs {left}, {right}"));

        // --- Constants ---
        register(constant("const_k", "Control-rate constant value.", PortSpec.of("kout", CONTROL)));
        register(constant("const_i", "Init-rate constant value.", PortSpec.of("iout", INIT)));
        register(constant("const_a", "Audio-rate constant value.", PortSpec.of("aout", AUDIO)));
    }

    private static OpcodeSpec binary(String name, String category, String description,
            com.synthgraph.api.SignalRate rate, String out, String operator) {
        return new OpcodeSpec(name, category, description,
                List.of(PortSpec.of("a", rate), PortSpec.of("b", rate)),
                List.of(PortSpec.of(out, rate)),
                null, "{" + out + "} = ({a}) " + operator + " ({b})");
    }

    private static OpcodeSpec constant(String name, String description, PortSpec out) {
        return new OpcodeSpec(name, "constants", description,
                List.of(), List.of(out),
                Map.of("value", 0), "{" + out.id() + "} = {value}");
    }
}
