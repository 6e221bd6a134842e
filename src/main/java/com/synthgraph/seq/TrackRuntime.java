package com.synthgraph.seq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import com.synthgraph.io.SequencerDefinition.PadDef;
import com.synthgraph.io.SequencerDefinition.TrackDef;

/**
 * Mutable state of one track. Every field is guarded by the owning engine's
 * lock; this class does no locking of its own.
 */
final class TrackRuntime {
    static final int PAD_COUNT = 8;
    static final int SHORT_PATTERN = 16;
    static final int LONG_PATTERN = 32;

    final String trackId;
    final int midiChannel;
    final int stepCount;
    final int velocity;
    final double gateRatio;
    final Step[][] pads;
    final List<Integer> padLoopSequence;
    final boolean padLoopRepeat;

    boolean enabled;
    Boolean queuedEnabled;
    int activePad;
    Integer queuedPad;
    boolean padLoopEnabled;
    /** Index into {@link #padLoopSequence} of the pad now playing, or -1. */
    int padLoopPosition = -1;
    final TreeSet<Integer> soundingNotes = new TreeSet<>();

    private TrackRuntime(TrackDef def, Step[][] pads, List<Integer> loop) {
        this.trackId = def.getTrackId();
        this.midiChannel = Step.clamp(def.getMidiChannel(), 1, 16);
        this.stepCount = normalizeStepCount(def.getStepCount());
        this.velocity = Step.clamp(def.getVelocity(), 1, 127);
        this.gateRatio = Math.max(0.05, Math.min(1.0, def.getGateRatio()));
        this.pads = pads;
        this.padLoopSequence = loop;
        this.padLoopRepeat = def.isPadLoopRepeat();
        this.enabled = def.isEnabled();
        this.queuedEnabled = def.getQueuedEnabled();
        this.activePad = isPadIndex(def.getActivePad()) ? def.getActivePad() : 0;
        this.queuedPad = def.getQueuedPad() != null && isPadIndex(def.getQueuedPad()) ? def.getQueuedPad() : null;
        this.padLoopEnabled = def.isPadLoopEnabled() && !loop.isEmpty();
        if (padLoopEnabled)
            this.padLoopPosition = loop.indexOf(activePad);
    }

    /**
     * Builds a track from its document form. Every track owns all eight pads;
     * pads the document leaves out are silent.
     *
     * @throws IllegalArgumentException on a missing id, a pad index outside
     *                                  0..7, a repeated pad, or a malformed step
     */
    static TrackRuntime from(TrackDef def) {
        if (def.getTrackId() == null || def.getTrackId().isBlank())
            throw new IllegalArgumentException("Track id is required.");
        int stepCount = normalizeStepCount(def.getStepCount());
        List<PadDef> padDefs = def.getPads() == null ? List.of() : def.getPads();
        if (padDefs.size() > PAD_COUNT)
            throw new IllegalArgumentException("Track '" + def.getTrackId() + "' has more than " + PAD_COUNT + " pads.");

        Step[][] pads = new Step[PAD_COUNT][];
        for (PadDef pad : padDefs) {
            if (!isPadIndex(pad.getPadIndex()))
                throw new IllegalArgumentException("Pad index " + pad.getPadIndex() + " of track '"
                        + def.getTrackId() + "' is outside 0.." + (PAD_COUNT - 1) + ".");
            if (pads[pad.getPadIndex()] != null)
                throw new IllegalArgumentException("Pad " + pad.getPadIndex() + " of track '"
                        + def.getTrackId() + "' is defined twice.");
            pads[pad.getPadIndex()] = normalizeSteps(pad.getSteps(), stepCount);
        }
        for (int i = 0; i < PAD_COUNT; i++)
            if (pads[i] == null)
                pads[i] = normalizeSteps(List.of(), stepCount);

        List<Integer> loop = new ArrayList<>();
        if (def.getPadLoopSequence() != null)
            for (Integer p : def.getPadLoopSequence())
                if (p != null && isPadIndex(p))
                    loop.add(p);
        return new TrackRuntime(def, pads, Collections.unmodifiableList(loop));
    }

    private static Step[] normalizeSteps(List<Object> raw, int stepCount) {
        Step[] steps = new Step[stepCount];
        for (int i = 0; i < stepCount; i++)
            steps[i] = raw != null && i < raw.size() ? Step.parse(raw.get(i)) : Step.REST;
        return steps;
    }

    static int normalizeStepCount(int requested) {
        return requested == SHORT_PATTERN ? SHORT_PATTERN : LONG_PATTERN;
    }

    static boolean isPadIndex(int index) {
        return index >= 0 && index < PAD_COUNT;
    }

    int localStep(int transportStep) {
        return transportStep % stepCount;
    }

    boolean atLocalBoundary(int transportStep) {
        return transportStep % stepCount == 0;
    }

    /** Steps of the active pad, or null when no pad is active. */
    Step[] activeSteps() {
        return isPadIndex(activePad) ? pads[activePad] : null;
    }

    /**
     * Moves the pad loop one entry forward.
     *
     * @return the pad to play next, or null when the loop is off or has ended
     */
    Integer advancePadLoop() {
        if (!padLoopEnabled)
            return null;
        int next = padLoopPosition + 1;
        if (next >= padLoopSequence.size()) {
            if (!padLoopRepeat) {
                padLoopEnabled = false;
                padLoopPosition = -1;
                return null;
            }
            next = 0;
        }
        padLoopPosition = next;
        return padLoopSequence.get(next);
    }
}
