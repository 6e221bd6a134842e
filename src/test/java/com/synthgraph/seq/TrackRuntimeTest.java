package com.synthgraph.seq;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.synthgraph.io.SequencerDefinition.TrackDef;

public class TrackRuntimeTest {

    @Test
    public void testClampsAndDefaults() {
        TrackDef def = TrackDef.of("t", 22, 16);
        def.setVelocity(0);
        def.setGateRatio(0.0);
        def.setActivePad(12);
        def.setQueuedPad(9);
        TrackRuntime t = TrackRuntime.from(def);

        assertEquals(16, t.midiChannel);
        assertEquals(1, t.velocity);
        assertEquals(0.05, t.gateRatio, 0.0);
        assertEquals(0, t.activePad);
        assertNull(t.queuedPad);
        assertEquals(TrackRuntime.PAD_COUNT, t.pads.length);
        for (Step[] pad : t.pads) {
            assertEquals(16, pad.length);
            assertTrue(pad[0].isRest());
        }
    }

    @Test
    public void testStepCountNormalization() {
        assertEquals(16, TrackRuntime.normalizeStepCount(16));
        assertEquals(32, TrackRuntime.normalizeStepCount(32));
        assertEquals(32, TrackRuntime.normalizeStepCount(8));
        assertEquals(32, TrackRuntime.normalizeStepCount(64));
    }

    @Test
    public void testPadStepsTruncatedToLength() {
        List<Object> steps = new ArrayList<>();
        for (int i = 0; i < 40; i++)
            steps.add(40 + i);
        TrackRuntime t = TrackRuntime.from(TrackDef.of("t", 1, 16).pad(2, steps));
        assertEquals(16, t.pads[2].length);
        assertEquals(List.of(55), t.pads[2][15].notes());
    }

    @Test
    public void testRejectsBadPads() {
        assertRejected(TrackDef.of("t", 1, 16).pad(8, List.of()), "Pad index 8 of track 't' is outside 0..7.");
        assertRejected(TrackDef.of("t", 1, 16).pad(1, List.of()).pad(1, List.of()), "Pad 1 of track 't' is defined twice.");
        TrackDef many = TrackDef.of("t", 1, 16);
        for (int i = 0; i < 9; i++)
            many.pad(i % 8, List.of());
        assertRejected(many, "Track 't' has more than 8 pads.");
        assertRejected(TrackDef.of(" ", 1, 16), "Track id is required.");
    }

    @Test
    public void testPadLoopSetup() {
        TrackDef def = TrackDef.of("t", 1, 32);
        def.setPadLoopEnabled(true);
        def.setPadLoopSequence(Arrays.asList(3, null, -1, 8, 5));
        def.setActivePad(5);
        TrackRuntime t = TrackRuntime.from(def);

        assertEquals(List.of(3, 5), t.padLoopSequence);
        assertEquals(1, t.padLoopPosition);
        assertEquals(Integer.valueOf(3), t.advancePadLoop());
        assertEquals(Integer.valueOf(5), t.advancePadLoop());
    }

    @Test
    public void testPadLoopNeedsEntries() {
        TrackDef def = TrackDef.of("t", 1, 16);
        def.setPadLoopEnabled(true);
        def.setPadLoopSequence(List.of(9));
        TrackRuntime t = TrackRuntime.from(def);
        assertFalse(t.padLoopEnabled);
        assertNull(t.advancePadLoop());
    }

    @Test
    public void testLocalSteps() {
        TrackRuntime t = TrackRuntime.from(TrackDef.of("t", 1, 16));
        assertEquals(3, t.localStep(19));
        assertTrue(t.atLocalBoundary(16));
        assertFalse(t.atLocalBoundary(31));
    }

    @Test
    public void testTransportStepCount() {
        TrackRuntime a = TrackRuntime.from(TrackDef.of("a", 1, 16));
        TrackRuntime b = TrackRuntime.from(TrackDef.of("b", 2, 32));
        assertEquals(32, SequencerEngine.transportStepCount(List.of(a, b)));
        assertEquals(16, SequencerEngine.transportStepCount(List.of(a)));
        assertEquals(16, SequencerEngine.transportStepCount(List.of()));
        b.enabled = false;
        assertEquals(16, SequencerEngine.transportStepCount(List.of(a, b)));
    }

    private static void assertRejected(TrackDef def, String message) {
        try {
            TrackRuntime.from(def);
            fail("accepted " + def);
        } catch (IllegalArgumentException e) {
            assertEquals(message, e.getMessage());
        }
    }
}
