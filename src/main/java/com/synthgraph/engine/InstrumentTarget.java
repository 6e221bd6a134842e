package com.synthgraph.engine;

import java.util.Objects;

import com.synthgraph.io.PatchDefinition;

/**
 * A patch to compile as one instrument of a bundle.
 *
 * @param midiChannel 1..16 binds the instrument to that channel, 0 leaves it
 *                    omni
 */
public record InstrumentTarget(PatchDefinition patch, int midiChannel) {
    public static final int OMNI = 0;

    public InstrumentTarget {
        Objects.requireNonNull(patch, "patch");
    }

    public static InstrumentTarget omni(PatchDefinition patch) {
        return new InstrumentTarget(patch, OMNI);
    }

    public boolean channelBound() {
        return midiChannel != OMNI;
    }
}
