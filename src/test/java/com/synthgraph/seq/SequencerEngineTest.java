package com.synthgraph.seq;

import static org.junit.Assert.*;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.synthgraph.io.PatchReader;
import com.synthgraph.io.SequencerDefinition;
import com.synthgraph.io.SequencerDefinition.TrackDef;
import com.synthgraph.io.SynthGraphSettings;

public class SequencerEngineTest {
    private RecordingMidiSink sink;
    private List<String> events;
    private List<Map<String, Object>> payloads;
    private SequencerEngine engine;

    @Before
    public void setUp() {
        sink = new RecordingMidiSink();
        events = Collections.synchronizedList(new ArrayList<>());
        payloads = Collections.synchronizedList(new ArrayList<>());
        // The clock never fires within a test; steps are driven with tick()
        SynthGraphSettings.Sequencer settings = new SynthGraphSettings.Sequencer();
        settings.setInitialDelayMillis(60_000);
        engine = SequencerEngine.direct("session-1234567890", sink, "0", (session, type, payload) -> {
            events.add(type);
            payloads.add(payload);
        }, settings);
    }

    @After
    public void tearDown() {
        engine.shutdown();
    }

    private void tick(int times) {
        for (int i = 0; i < times; i++)
            engine.tick();
    }

    private static List<Object> steps(Object... raw) {
        List<Object> out = new ArrayList<>();
        Collections.addAll(out, raw);
        return out;
    }

    // ── Configuration ─────────────────────────────────────────────

    @Test
    public void testDefaultTrackInstalledOnDemand() {
        SequencerStatus before = engine.status();
        assertFalse(before.running());
        assertTrue(before.tracks().isEmpty());
        assertEquals(120, before.bpm());

        SequencerStatus status = engine.queuePad("voice-1", 3);
        TrackStatus voice = status.track("voice-1");
        assertEquals(1, voice.midiChannel());
        assertEquals(16, voice.stepCount());
        assertEquals(3, voice.activePad());
        assertNull(voice.queuedPad());
    }

    @Test
    public void testFixtureConfiguration() throws Exception {
        SequencerDefinition def;
        try (InputStream in = getClass().getResourceAsStream("/patches/two_track_sequence.json")) {
            def = PatchReader.readSequencer(in);
        }
        SequencerStatus status = engine.configure(def);

        assertEquals(132, status.bpm());
        assertEquals(16, status.stepCount());
        TrackStatus lead = status.track("lead");
        assertEquals(32, lead.stepCount());
        assertEquals(1.0, lead.gateRatio(), 0.0);
        assertFalse(lead.enabled());
        assertEquals(Boolean.TRUE, lead.queuedEnabled());
        assertEquals(Integer.valueOf(0), lead.padLoopPosition());
        assertNull(status.track("bass").padLoopPosition());
        assertNull(status.track("missing"));
    }

    @Test
    public void testBpmClamped() {
        assertEquals(30, engine.configure(SequencerDefinition.of(5, TrackDef.of("a", 1, 16))).bpm());
        assertEquals(300, engine.configure(SequencerDefinition.of(900, TrackDef.of("a", 1, 16))).bpm());
    }

    @Test
    public void testStepCountNormalized() {
        SequencerStatus status = engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 24)));
        assertEquals(32, status.track("a").stepCount());
        assertEquals(32, status.stepCount());
    }

    @Test
    public void testInvalidConfigurationKeepsPrevious() {
        engine.configure(SequencerDefinition.of(100, TrackDef.of("a", 1, 16)));
        try {
            engine.configure(SequencerDefinition.of(140, TrackDef.of("b", 1, 16), TrackDef.of("b", 2, 16)));
            fail("duplicate track accepted");
        } catch (IllegalArgumentException e) {
            assertEquals("Duplicate track id 'b'.", e.getMessage());
        }
        try {
            engine.configure(SequencerDefinition.of(140, TrackDef.of("c", 1, 16).pad(0, steps("x"))));
            fail("bad step accepted");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Step value must be"));
        }
        SequencerStatus status = engine.status();
        assertEquals(100, status.bpm());
        assertNotNull(status.track("a"));
    }

    @Test
    public void testInvalidReferences() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16)));
        try {
            engine.queuePad("b", 0);
            fail();
        } catch (InvalidReferenceException e) {
            assertEquals("Track 'b' is not configured.", e.getMessage());
        }
        try {
            engine.queuePad("a", 8);
            fail();
        } catch (InvalidReferenceException e) {
            assertEquals("Pad '8' is not configured for track 'a'.", e.getMessage());
        }
        try {
            engine.queueEnabled("zz", true);
            fail();
        } catch (InvalidReferenceException e) {
            assertEquals("Track 'zz' is not configured.", e.getMessage());
        }
    }

    // ── Playback ──────────────────────────────────────────────────

    @Test
    public void testOneCycleWithRestsHoldsAndChords() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16)
                .pad(0, steps(60, null, List.of(64, 67), Map.of("hold", true)))));

        tick(1);
        assertEquals(List.of("on 1 60 100"), sink.drain());
        assertEquals(List.of(60), engine.status().track("a").activeNotes());

        tick(1);
        assertEquals(List.of("off 1 60"), sink.drain());

        tick(1);
        assertEquals(List.of("on 1 64 100", "on 1 67 100"), sink.drain());

        tick(1); // hold keeps the chord
        assertTrue(sink.drain().isEmpty());
        assertEquals(List.of(64, 67), engine.status().track("a").activeNotes());

        tick(1);
        assertEquals(List.of("off 1 64", "off 1 67"), sink.drain());

        tick(11);
        SequencerStatus status = engine.status();
        assertEquals(0, status.currentStep());
        assertEquals(1, status.cycle());
        assertTrue(status.track("a").activeNotes().isEmpty());
        assertTrue(sink.drain().isEmpty());
        assertEquals(16, events.size());
        assertEquals(15, payloads.get(15).get("step"));
        assertEquals(0, payloads.get(15).get("next_step"));
        assertEquals(1L, payloads.get(15).get("cycle"));
    }

    @Test
    public void testStepVelocityOverride() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 4, 16)
                .pad(0, steps(Map.of("note", List.of(64, 67), "velocity", 200), Map.of("note", 70, "velocity", 20)))));
        tick(2);
        assertEquals(List.of("on 4 64 127", "on 4 67 127", "off 4 64", "off 4 67", "on 4 70 20"), sink.drain());
    }

    @Test
    public void testTransportIsLeastCommonMultiple() {
        SequencerStatus status = engine.configure(SequencerDefinition.of(120,
                TrackDef.of("short", 1, 16).pad(0, steps(60)).pad(1, steps(62)),
                TrackDef.of("long", 2, 32)));
        assertEquals(32, status.stepCount());

        engine.start();
        engine.queuePad("short", 1);
        tick(15);
        assertEquals(Integer.valueOf(1), engine.status().track("short").queuedPad());
        assertFalse(events.contains(SequencerEngine.EVENT_PAD_SWITCHED));

        tick(1);
        status = engine.status();
        assertEquals(16, status.currentStep());
        assertEquals(0, status.cycle());
        assertEquals(1, status.track("short").activePad());
        assertNull(status.track("short").queuedPad());
        assertEquals(0, status.track("short").localStep());
        assertEquals(16, status.track("long").localStep());
        assertTrue(events.contains(SequencerEngine.EVENT_PAD_SWITCHED));

        sink.drain();
        tick(1);
        assertEquals(List.of("on 1 62 100"), sink.drain());
    }

    @Test
    public void testQueuedPadWhileStoppedAppliesAtOnce() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16)));
        tick(5);
        SequencerStatus status = engine.queuePad("a", 2);
        assertEquals(2, status.track("a").activePad());
        assertEquals(0, status.currentStep());
    }

    @Test
    public void testQueuedEnableWaitsForBoundary() {
        List<Object> held = steps(50);
        for (int i = 1; i < 16; i++)
            held.add(Map.of("hold", true));
        TrackDef b = TrackDef.of("b", 2, 16).pad(0, held);
        b.setEnabled(false);
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16), b));
        engine.start();

        engine.queueEnabled("b", true);
        tick(1);
        assertFalse(engine.status().track("b").enabled());
        assertEquals(Boolean.TRUE, engine.status().track("b").queuedEnabled());

        tick(15);
        TrackStatus bs = engine.status().track("b");
        assertTrue(bs.enabled());
        assertNull(bs.queuedEnabled());

        sink.drain();
        tick(1);
        assertEquals(List.of("on 2 50 100"), sink.drain());

        engine.queueEnabled("b", false);
        tick(14);
        assertTrue(engine.status().track("b").enabled());
        assertTrue(sink.drain().isEmpty());
        tick(1);
        assertFalse(engine.status().track("b").enabled());
        assertEquals(List.of("off 2 50"), sink.drain());
    }

    @Test
    public void testEnableWhileStoppedAppliesAtOnce() {
        TrackDef b = TrackDef.of("b", 2, 32);
        b.setEnabled(false);
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16), b));
        assertEquals(16, engine.status().stepCount());

        SequencerStatus status = engine.queueEnabled("b", true);
        assertTrue(status.track("b").enabled());
        assertEquals(32, status.stepCount());
    }

    @Test
    public void testPadLoopRepeats() {
        TrackDef a = TrackDef.of("a", 1, 16).pad(0, steps(60)).pad(1, steps(62));
        a.setPadLoopEnabled(true);
        a.setPadLoopSequence(List.of(0, 1));
        engine.configure(SequencerDefinition.of(120, a));

        tick(16);
        assertEquals(1, engine.status().track("a").activePad());
        assertEquals(Integer.valueOf(1), engine.status().track("a").padLoopPosition());
        tick(16);
        assertEquals(0, engine.status().track("a").activePad());
        assertEquals(Integer.valueOf(0), engine.status().track("a").padLoopPosition());
    }

    @Test
    public void testPadLoopWithoutRepeatEnds() {
        TrackDef a = TrackDef.of("a", 1, 16);
        a.setPadLoopEnabled(true);
        a.setPadLoopRepeat(false);
        a.setPadLoopSequence(List.of(0, 1));
        engine.configure(SequencerDefinition.of(120, a));

        tick(16);
        assertEquals(1, engine.status().track("a").activePad());
        tick(16);
        TrackStatus status = engine.status().track("a");
        assertEquals(1, status.activePad());
        assertNull(status.padLoopPosition());
    }

    @Test
    public void testQueuedPadBeatsPadLoop() {
        TrackDef a = TrackDef.of("a", 1, 16);
        a.setPadLoopEnabled(true);
        a.setPadLoopSequence(List.of(0, 1));
        engine.configure(SequencerDefinition.of(120, a));
        engine.start();
        engine.queuePad("a", 5);
        tick(16);
        assertEquals(5, engine.status().track("a").activePad());
    }

    // ── Stop and reconfigure ──────────────────────────────────────

    @Test
    public void testStopSilencesAndRewinds() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 3, 16).pad(0, steps(60))));
        SequencerStatus started = engine.start();
        assertTrue(started.running());
        assertTrue(engine.start().running());
        tick(1);
        sink.drain();

        SequencerStatus status = engine.stop();
        assertFalse(status.running());
        assertEquals(0, status.currentStep());
        assertTrue(status.track("a").activeNotes().isEmpty());
        assertEquals(List.of("off 3 60", "cc 3 123", "cc 3 120"), sink.drain());
    }

    @Test
    public void testStopWhileStoppedReleasesNotes() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16).pad(0, steps(60))));
        tick(1);
        sink.drain();
        SequencerStatus status = engine.stop();
        assertEquals(0, status.currentStep());
        assertEquals(List.of("off 1 60"), sink.drain());
    }

    @Test
    public void testReconfigureReleasesMovedTracks() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16).pad(0, steps(60, Map.of("hold", true)))));
        tick(1);
        sink.drain();

        // Same channel: the note keeps sounding
        SequencerStatus status = engine.configure(SequencerDefinition.of(120,
                TrackDef.of("a", 1, 16).pad(0, steps(60, Map.of("hold", true)))));
        assertEquals(List.of(60), status.track("a").activeNotes());
        assertEquals(1, status.currentStep());
        assertTrue(sink.drain().isEmpty());

        status = engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 2, 16)));
        assertTrue(status.track("a").activeNotes().isEmpty());
        assertEquals(List.of("off 1 60", "cc 1 123", "cc 1 120"), sink.drain());
    }

    // ── MIDI ──────────────────────────────────────────────────────

    @Test
    public void testMidiFailureIsReportedNotFatal() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16).pad(0, steps(60, 62))));
        sink.failing = true;
        tick(1);
        assertEquals(List.of(SequencerEngine.EVENT_STEP, SequencerEngine.EVENT_MIDI_ERROR), events);
        assertEquals("port closed", payloads.get(1).get("error"));

        sink.failing = false;
        tick(1);
        assertEquals(2, engine.status().currentStep());
        assertTrue(sink.drain().contains("on 1 62 100"));
    }

    @Test
    public void testMidiInputSelector() {
        engine.configure(SequencerDefinition.of(120, TrackDef.of("a", 1, 16).pad(0, steps(60))));
        engine.setMidiInput("IAC Bus 1");
        tick(1);
        assertEquals(List.of("IAC Bus 1"), sink.selectors());
    }

    // ── Real time ─────────────────────────────────────────────────

    @Test
    public void testClockDrivesStepsThroughRelay() throws Exception {
        SynthGraphSettings.Sequencer settings = new SynthGraphSettings.Sequencer();
        settings.setInitialDelayMillis(0);
        CountDownLatch steps = new CountDownLatch(16);
        SequencerEngine live = SequencerEngine.create("live", sink, "0", (session, type, payload) -> {
            if (SequencerEngine.EVENT_STEP.equals(type))
                steps.countDown();
        }, settings);
        try {
            live.configure(SequencerDefinition.of(300, TrackDef.of("a", 1, 16).pad(0, steps(60))));
            live.start();
            assertTrue(steps.await(5, TimeUnit.SECONDS));
            assertTrue(live.status().cycle() >= 1);
        } finally {
            live.shutdown();
        }
        assertFalse(live.status().running());
        assertEquals(0, live.status().currentStep());
    }
}
