package com.synthgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a sequencer configuration request.
 *
 * <p>
 * Step entries are kept raw: each one may be {@code null}, an integer note, a
 * list of integer notes, or an object {@code {note, hold, velocity}}. The
 * engine normalizes them when the configuration is applied.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SequencerDefinition {
    private int bpm = 120;
    @JsonProperty("step_count")
    private int stepCount = 16;
    private List<TrackDef> tracks = new ArrayList<>();

    public static SequencerDefinition of(int bpm, TrackDef... tracks) {
        SequencerDefinition def = new SequencerDefinition();
        def.setBpm(bpm);
        def.setTracks(new ArrayList<>(List.of(tracks)));
        return def;
    }

    /** One track: channel, pattern length and up to eight pads. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TrackDef {
        @JsonProperty("track_id")
        private String trackId;
        @JsonProperty("midi_channel")
        private int midiChannel = 1;
        @JsonProperty("step_count")
        private int stepCount = 16;
        private int velocity = 100;
        @JsonProperty("gate_ratio")
        private double gateRatio = 0.8;
        private boolean enabled = true;
        @JsonProperty("queued_enabled")
        private Boolean queuedEnabled;
        @JsonProperty("active_pad")
        private int activePad;
        @JsonProperty("queued_pad")
        private Integer queuedPad;
        @JsonProperty("pad_loop_enabled")
        private boolean padLoopEnabled;
        @JsonProperty("pad_loop_repeat")
        private boolean padLoopRepeat = true;
        @JsonProperty("pad_loop_sequence")
        private List<Integer> padLoopSequence = new ArrayList<>();
        private List<PadDef> pads = new ArrayList<>();

        public static TrackDef of(String trackId, int midiChannel, int stepCount) {
            TrackDef t = new TrackDef();
            t.setTrackId(trackId);
            t.setMidiChannel(midiChannel);
            t.setStepCount(stepCount);
            return t;
        }

        public TrackDef pad(int padIndex, List<Object> steps) {
            PadDef p = new PadDef();
            p.setPadIndex(padIndex);
            p.setSteps(steps);
            pads.add(p);
            return this;
        }
    }

    /** A pattern slot holding raw step entries. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PadDef {
        @JsonProperty("pad_index")
        private int padIndex;
        private List<Object> steps = new ArrayList<>();
    }
}
