package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.List;

import com.synthgraph.io.PatchDefinition.EngineConfig;
import com.synthgraph.io.SynthGraphSettings;

/** Lays out the orchestra text and the document that wraps it. */
public final class ProgramDocumentWriter {
    static final String INDENT = "  ";

    private ProgramDocumentWriter() {
        // Utility class
    }

    /** Body lines of one instrument and the channel it listens on. */
    record InstrumentBlock(int number, int midiChannel, List<String> lines) {
    }

    static String orchestra(EngineConfig header, List<InstrumentBlock> blocks) {
        List<String> out = new ArrayList<>();
        out.add("sr = " + header.getSr());
        out.add("ksmps = " + header.resolvedKsmps());
        out.add("nchnls = " + header.getNchnls());
        out.add("0dbfs = " + header.getZeroDbfs());
        for (InstrumentBlock block : blocks) {
            out.add("");
            out.add("massign " + block.midiChannel() + ", " + block.number());
            out.add("");
            out.add("instr " + block.number());
            for (String line : block.lines())
                out.add(line.isEmpty() ? "" : INDENT + line);
            out.add("endin");
        }
        return String.join("\n", out);
    }

    public static String options(SynthGraphSettings.Compiler settings, String midiInput, String rtmidiModule) {
        boolean mac = "macos".equals(settings.getPlatform());
        String module = mac && "cmidi".equals(rtmidiModule) ? "coremidi" : rtmidiModule;
        StringBuilder sb = new StringBuilder("-d -odac -M").append(midiInput)
                .append(" -+rtmidi=").append(module)
                .append(" -b ").append(settings.getSoftwareBuffer())
                .append(" -B").append(settings.getHardwareBuffer());
        if (mac)
            sb.append(" -+rtaudio=auhal");
        return sb.toString();
    }

    static String document(String orchestra, String options) {
        return String.join("\n",
                "<CsoundSynthesizer>",
                "<CsOptions>",
                options,
                "</CsOptions>",
                "<CsInstruments>",
                orchestra,
                "</CsInstruments>",
                "<CsScore>",
                "f 1 0 16384 10 1",
                "f 0 z",
                "</CsScore>",
                "</CsoundSynthesizer>");
    }
}
