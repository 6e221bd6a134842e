package com.synthgraph.seq;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Snapshot of a session's sequencer, taken under the engine lock. */
public record SequencerStatus(
        @JsonProperty("session_id") String sessionId,
        boolean running,
        int bpm,
        @JsonProperty("step_count") int stepCount,
        @JsonProperty("current_step") int currentStep,
        long cycle,
        List<TrackStatus> tracks) {

    public SequencerStatus {
        tracks = List.copyOf(tracks);
    }

    /** Returns the status of the given track, or null. */
    public TrackStatus track(String trackId) {
        for (TrackStatus t : tracks)
            if (t.trackId().equals(trackId))
                return t;
        return null;
    }
}
