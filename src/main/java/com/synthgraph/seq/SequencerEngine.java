package com.synthgraph.seq;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.ShortMessage;

import com.synthgraph.api.EventPublisher;
import com.synthgraph.api.MidiSink;
import com.synthgraph.io.SequencerDefinition;
import com.synthgraph.io.SequencerDefinition.TrackDef;
import com.synthgraph.io.SynthGraphSettings;
import com.synthgraph.util.ErrorRateLimiter;
import com.synthgraph.wiring.SequencerEventRelay;

import lombok.extern.log4j.Log4j2;

/**
 * Multi-track step sequencer for one session.
 *
 * <p>
 * All runtime state sits behind one {@link ReentrantLock}. The scheduling
 * thread takes it once per step; {@link #configure}, {@link #queuePad},
 * {@link #queueEnabled}, {@link #status} and the lifecycle calls take it for
 * the duration of the call. Events are published after the lock is released.
 *
 * <h2>Transport</h2>
 * The shared transport is 16 steps when the least common multiple of the
 * enabled tracks' step counts is at most 16, otherwise 32. A track's local
 * boundary is a transport step divisible by its own step count; queued pad
 * switches and queued disables commit there. A queued enable commits once
 * every other enabled track is at a boundary too.
 */
@Log4j2
public final class SequencerEngine {
    public static final int MIN_BPM = 30;
    public static final int MAX_BPM = 300;

    public static final String EVENT_STEP = "sequencer_step";
    public static final String EVENT_PAD_SWITCHED = "sequencer_pad_switched";
    public static final String EVENT_MIDI_ERROR = "sequencer_midi_error";

    static final String DEFAULT_TRACK_ID = "voice-1";

    private final String sessionId;
    private final MidiSink sink;
    private final EventPublisher events;
    private final SequencerEventRelay relay;
    private final SynthGraphSettings.Sequencer settings;
    private final ReentrantLock lock = new ReentrantLock();
    private final ErrorRateLimiter midiWarnings = new ErrorRateLimiter(log, 1000);

    // Guarded by lock
    private String midiInput;
    private Map<String, TrackRuntime> tracks;
    private int transportStepCount = TrackRuntime.SHORT_PATTERN;
    private int currentStep;
    private long cycle;
    private boolean running;
    private Thread thread;
    private SequencerClock clock;
    private final List<PendingEvent> pending = new ArrayList<>();

    // Read by the clock between steps without the lock
    private volatile int bpm;

    private SequencerEngine(String sessionId, MidiSink sink, String midiInput, SynthGraphSettings.Sequencer settings,
            EventPublisher events, SequencerEventRelay relay) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.midiInput = midiInput;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.events = Objects.requireNonNull(events, "events");
        this.relay = relay;
        this.bpm = clampBpm(settings.getDefaultBpm());
    }

    /**
     * Creates an engine whose events reach {@code listener} through its own
     * bounded relay; {@link #shutdown()} closes the relay.
     */
    public static SequencerEngine create(String sessionId, MidiSink sink, String midiInput,
            EventPublisher listener, SynthGraphSettings.Sequencer settings) {
        SequencerEventRelay relay = new SequencerEventRelay(settings.getEventBufferSize(), listener);
        return new SequencerEngine(sessionId, sink, midiInput, settings, relay, relay);
    }

    /** Publishes events synchronously, on whichever thread raises them. */
    static SequencerEngine direct(String sessionId, MidiSink sink, String midiInput,
            EventPublisher events, SynthGraphSettings.Sequencer settings) {
        return new SequencerEngine(sessionId, sink, midiInput, settings, events, null);
    }

    public String sessionId() {
        return sessionId;
    }

    // ── Commands ──────────────────────────────────────────────────

    /**
     * Replaces the configuration immediately, running or not. Tracks that
     * disappear, move to another channel or change enabled state have their
     * notes released first; other tracks keep what is sounding.
     *
     * @throws IllegalArgumentException if the configuration is malformed; the
     *                                  previous configuration stays in place
     */
    public SequencerStatus configure(SequencerDefinition def) {
        Map<String, TrackRuntime> next = buildTracks(def);
        lock.lock();
        try {
            if (tracks != null) {
                for (TrackRuntime old : tracks.values()) {
                    TrackRuntime replacement = next.get(old.trackId);
                    if (replacement == null || replacement.midiChannel != old.midiChannel
                            || replacement.enabled != old.enabled) {
                        releaseLocked(old);
                        silenceChannelLocked(old.midiChannel);
                    } else {
                        replacement.soundingNotes.addAll(old.soundingNotes);
                    }
                }
            }
            tracks = next;
            bpm = clampBpm(def.getBpm());
            transportStepCount = transportStepCount(next.values());
            currentStep = currentStep % transportStepCount;
            log.info("Sequencer {} configured: {} track(s) at {} bpm", sessionId, next.size(), bpm);
            return statusLocked();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /** Starts the scheduling thread; a no-op when already running. */
    public SequencerStatus start() {
        lock.lock();
        try {
            ensureConfigLocked();
            if (running)
                return statusLocked();
            running = true;
            SequencerClock c = new SequencerClock(() -> SequencerClock.stepNanos(bpm),
                    settings.getSpinThresholdMicros(), settings.getSleepMicros(), settings.getInitialDelayMillis());
            clock = c;
            thread = new Thread(() -> runLoop(c), "sequencer-" + shortId(sessionId));
            thread.setDaemon(true);
            thread.start();
            log.info("Sequencer {} started at {} bpm", sessionId, bpm);
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the scheduling thread, silences every track and rewinds to step 0.
     * Waits for the thread at most the configured join timeout.
     */
    public SequencerStatus stop() {
        Thread t;
        lock.lock();
        try {
            if (!running) {
                currentStep = 0;
                if (tracks != null)
                    tracks.values().forEach(this::releaseLocked);
                return statusLocked();
            }
            running = false;
            clock.cancel();
            t = thread;
        } finally {
            lock.unlock();
            flushEvents();
        }

        // Joined without the lock: the loop takes it on every step.
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(settings.getStopJoinTimeoutMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive())
                log.warn("Sequencer {} thread did not stop within {} ms", sessionId, settings.getStopJoinTimeoutMillis());
        }

        lock.lock();
        try {
            thread = null;
            clock = null;
            currentStep = 0;
            silenceAllLocked();
            log.info("Sequencer {} stopped at cycle {}", sessionId, cycle);
            return statusLocked();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /** Stops the sequencer and closes its event relay. */
    public void shutdown() {
        stop();
        if (relay != null)
            relay.close();
    }

    /**
     * Queues a pad switch. While running it commits at the track's next local
     * boundary; while stopped it applies at once and rewinds to step 0.
     *
     * @throws InvalidReferenceException for an unknown track or a pad outside 0..7
     */
    public SequencerStatus queuePad(String trackId, int padIndex) {
        lock.lock();
        try {
            TrackRuntime track = requireTrackLocked(trackId);
            if (!TrackRuntime.isPadIndex(padIndex))
                throw new InvalidReferenceException("Pad '" + padIndex + "' is not configured for track '" + trackId + "'.");
            if (running) {
                track.queuedPad = padIndex;
            } else {
                track.activePad = padIndex;
                track.queuedPad = null;
                currentStep = 0;
            }
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues enabling or disabling a track. While stopped the change applies
     * at once.
     *
     * @throws InvalidReferenceException for an unknown track
     */
    public SequencerStatus queueEnabled(String trackId, boolean enabled) {
        lock.lock();
        try {
            TrackRuntime track = requireTrackLocked(trackId);
            if (running) {
                track.queuedEnabled = enabled;
            } else {
                track.enabled = enabled;
                track.queuedEnabled = null;
                if (!enabled)
                    releaseLocked(track);
                transportStepCount = transportStepCount(tracks.values());
                currentStep = currentStep % transportStepCount;
            }
            return statusLocked();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /** Changes the MIDI input later messages are sent to. */
    public void setMidiInput(String selector) {
        lock.lock();
        try {
            midiInput = selector;
        } finally {
            lock.unlock();
        }
    }

    public SequencerStatus status() {
        lock.lock();
        try {
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    // ── Scheduling ────────────────────────────────────────────────

    private void runLoop(SequencerClock c) {
        try {
            c.run(() -> stepFromClock(c));
        } catch (RuntimeException e) {
            log.error("Sequencer {} scheduling loop died", sessionId, e);
        } finally {
            lock.lock();
            try {
                // Not cancelled by stop(): the loop ended on its own.
                if (clock == c && running) {
                    running = false;
                    clock = null;
                    thread = null;
                    silenceAllLocked();
                }
            } finally {
                lock.unlock();
                flushEvents();
            }
            if (c.resyncs() > 0)
                log.debug("Sequencer {} clock resynchronized {} time(s)", sessionId, c.resyncs());
        }
    }

    private void stepFromClock(SequencerClock c) {
        lock.lock();
        try {
            if (clock != c || !running)
                return;
            performStepLocked();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /** Plays the current step and advances, regardless of the running flag. */
    void tick() {
        lock.lock();
        try {
            performStepLocked();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    private void performStepLocked() {
        if (tracks == null)
            return;
        int step = currentStep;
        int playing = 0;

        // 1. Sound the current step
        for (TrackRuntime track : tracks.values()) {
            Step[] steps = track.activeSteps();
            if (!track.enabled || steps == null) {
                releaseLocked(track);
                continue;
            }
            playing++;
            Step s = steps[track.localStep(step)];
            if (!s.isRest()) {
                releaseLocked(track);
                int velocity = s.velocity() != null ? s.velocity() : track.velocity;
                for (int note : s.notes()) {
                    sendLocked(channel -> MidiMessages.noteOn(channel, note, velocity), track.midiChannel);
                    track.soundingNotes.add(note);
                }
            } else if (!s.hold()) {
                releaseLocked(track);
            }
        }

        // 2. Advance the transport
        int nextStep = (currentStep + 1) % transportStepCount;
        if (nextStep == 0)
            cycle++;

        // 3. Commit what is due at this boundary
        for (TrackRuntime track : tracks.values()) {
            boolean boundary = track.atLocalBoundary(nextStep);
            if (track.queuedEnabled != null) {
                if (track.queuedEnabled) {
                    if (canStartOnBoundaryLocked(track, nextStep)) {
                        track.enabled = true;
                        track.queuedEnabled = null;
                    }
                } else if (!track.enabled) {
                    track.queuedEnabled = null;
                } else if (boundary) {
                    track.enabled = false;
                    track.queuedEnabled = null;
                    releaseLocked(track);
                }
            }
            if (!boundary)
                continue;
            int previous = track.activePad;
            if (track.queuedPad != null) {
                track.activePad = track.queuedPad;
                track.queuedPad = null;
            } else {
                Integer looped = track.advancePadLoop();
                if (looped != null)
                    track.activePad = looped;
            }
            if (track.activePad != previous) {
                log.debug("Sequencer {} track {} switched to pad {} at cycle {}",
                        sessionId, track.trackId, track.activePad, cycle);
                pending.add(new PendingEvent(EVENT_PAD_SWITCHED, payload(
                        "track_id", track.trackId, "active_pad", track.activePad, "cycle", cycle)));
            }
        }

        transportStepCount = transportStepCount(tracks.values());
        currentStep = nextStep % transportStepCount;
        pending.add(0, new PendingEvent(EVENT_STEP, payload(
                "step", step, "next_step", currentStep, "cycle", cycle, "track_count", playing)));
    }

    private boolean canStartOnBoundaryLocked(TrackRuntime candidate, int nextStep) {
        for (TrackRuntime other : tracks.values()) {
            if (other == candidate || !other.enabled)
                continue;
            if (!other.atLocalBoundary(nextStep))
                return false;
        }
        return true;
    }

    static int transportStepCount(Iterable<TrackRuntime> tracks) {
        long loop = 0;
        for (TrackRuntime t : tracks) {
            if (!t.enabled)
                continue;
            loop = loop == 0 ? t.stepCount : lcm(loop, t.stepCount);
        }
        return loop == 0 || loop <= TrackRuntime.SHORT_PATTERN ? TrackRuntime.SHORT_PATTERN : TrackRuntime.LONG_PATTERN;
    }

    private static long lcm(long a, long b) {
        long x = a, y = b;
        while (y != 0) {
            long r = x % y;
            x = y;
            y = r;
        }
        return a / x * b;
    }

    // ── MIDI ──────────────────────────────────────────────────────

    @FunctionalInterface
    private interface MessageFactory {
        ShortMessage create(int channel) throws InvalidMidiDataException;
    }

    private void sendLocked(MessageFactory factory, int channel) {
        try {
            sink.send(midiInput, factory.create(channel));
        } catch (InvalidMidiDataException | MidiUnavailableException | RuntimeException e) {
            midiWarnings.warn("Sequencer " + sessionId + " MIDI message failed: " + e.getMessage(), e);
            pending.add(new PendingEvent(EVENT_MIDI_ERROR, payload("error", String.valueOf(e.getMessage()))));
        }
    }

    /** Note-off for every sounding note of the track, lowest first. */
    private void releaseLocked(TrackRuntime track) {
        for (int note : track.soundingNotes)
            sendLocked(channel -> MidiMessages.noteOff(channel, note), track.midiChannel);
        track.soundingNotes.clear();
    }

    private void silenceChannelLocked(int midiChannel) {
        sendLocked(channel -> MidiMessages.controlChange(channel, MidiMessages.ALL_NOTES_OFF, 0), midiChannel);
        sendLocked(channel -> MidiMessages.controlChange(channel, MidiMessages.ALL_SOUND_OFF, 0), midiChannel);
    }

    private void silenceAllLocked() {
        if (tracks == null)
            return;
        for (TrackRuntime track : tracks.values()) {
            releaseLocked(track);
            silenceChannelLocked(track.midiChannel);
        }
    }

    // ── Events ────────────────────────────────────────────────────

    private record PendingEvent(String type, Map<String, Object> payload) {
    }

    private void flushEvents() {
        List<PendingEvent> out;
        lock.lock();
        try {
            if (pending.isEmpty())
                return;
            out = new ArrayList<>(pending);
            pending.clear();
        } finally {
            lock.unlock();
        }
        for (PendingEvent e : out)
            events.publish(sessionId, e.type(), e.payload());
    }

    private static Map<String, Object> payload(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2)
            m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    // ── Helpers ───────────────────────────────────────────────────

    private void ensureConfigLocked() {
        if (tracks != null)
            return;
        TrackDef def = TrackDef.of(DEFAULT_TRACK_ID, 1, TrackRuntime.SHORT_PATTERN);
        def.pad(0, new ArrayList<>());
        Map<String, TrackRuntime> defaults = new LinkedHashMap<>();
        defaults.put(DEFAULT_TRACK_ID, TrackRuntime.from(def));
        tracks = defaults;
        transportStepCount = transportStepCount(defaults.values());
    }

    private TrackRuntime requireTrackLocked(String trackId) {
        ensureConfigLocked();
        TrackRuntime track = tracks.get(trackId);
        if (track == null)
            throw new InvalidReferenceException("Track '" + trackId + "' is not configured.");
        return track;
    }

    private static Map<String, TrackRuntime> buildTracks(SequencerDefinition def) {
        Map<String, TrackRuntime> out = new LinkedHashMap<>();
        Set<String> ids = new HashSet<>();
        List<TrackDef> defs = def.getTracks() == null ? List.of() : def.getTracks();
        for (TrackDef td : defs) {
            TrackRuntime track = TrackRuntime.from(td);
            if (!ids.add(track.trackId))
                throw new IllegalArgumentException("Duplicate track id '" + track.trackId + "'.");
            out.put(track.trackId, track);
        }
        return out;
    }

    private SequencerStatus statusLocked() {
        if (tracks == null)
            return new SequencerStatus(sessionId, false, bpm, TrackRuntime.SHORT_PATTERN, 0, 0, List.of());
        List<TrackStatus> out = new ArrayList<>(tracks.size());
        for (TrackRuntime t : tracks.values()) {
            out.add(new TrackStatus(t.trackId, t.midiChannel, t.stepCount, t.localStep(currentStep),
                    t.velocity, t.gateRatio, t.activePad, t.queuedPad, t.enabled, t.queuedEnabled,
                    t.padLoopEnabled && t.padLoopPosition >= 0 ? t.padLoopPosition : null,
                    new ArrayList<>(t.soundingNotes)));
        }
        return new SequencerStatus(sessionId, running, bpm, transportStepCount, currentStep, cycle, out);
    }

    static int clampBpm(int bpm) {
        return Math.max(MIN_BPM, Math.min(MAX_BPM, bpm));
    }

    private static String shortId(String id) {
        return id.length() <= 8 ? id : id.substring(0, 8);
    }
}
