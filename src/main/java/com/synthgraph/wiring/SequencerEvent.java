package com.synthgraph.wiring;

import java.util.Map;

/**
 * Mutable ring-buffer slot carrying one sequencer notification.
 *
 * Instances are pre-allocated by the ring buffer and reused; the producer
 * fills a slot with {@link #set} and the consumer clears it after delivery.
 * The payload map itself is built by the producer and handed over as is.
 */
public final class SequencerEvent {
    private String sessionId;
    private String type;
    private Map<String, Object> payload;

    public void set(String sessionId, String type, Map<String, Object> payload) {
        this.sessionId = sessionId;
        this.type = type;
        this.payload = payload;
    }

    public String sessionId() {
        return sessionId;
    }

    public String type() {
        return type;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public void clear() {
        sessionId = null;
        type = null;
        payload = null;
    }
}
