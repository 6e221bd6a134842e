package com.synthgraph.seq;

/** A sequencer call named a track or pad that is not configured. */
public class InvalidReferenceException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidReferenceException(String message) {
        super(message);
    }
}
