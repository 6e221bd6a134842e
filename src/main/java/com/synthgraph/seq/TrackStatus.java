package com.synthgraph.seq;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Snapshot of one track, taken under the engine lock. */
public record TrackStatus(
        @JsonProperty("track_id") String trackId,
        @JsonProperty("midi_channel") int midiChannel,
        @JsonProperty("step_count") int stepCount,
        @JsonProperty("local_step") int localStep,
        int velocity,
        @JsonProperty("gate_ratio") double gateRatio,
        @JsonProperty("active_pad") int activePad,
        @JsonProperty("queued_pad") Integer queuedPad,
        boolean enabled,
        @JsonProperty("queued_enabled") Boolean queuedEnabled,
        @JsonProperty("pad_loop_position") Integer padLoopPosition,
        @JsonProperty("active_notes") List<Integer> activeNotes) {

    public TrackStatus {
        activeNotes = List.copyOf(activeNotes);
    }
}
