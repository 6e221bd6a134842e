package com.synthgraph.api;

import java.util.Map;

/**
 * Receives session events raised by the sequencer (step advanced, pad
 * switched, MIDI failure).
 *
 * Called from the event relay's consumer thread, never from the scheduler.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(String sessionId, String eventType, Map<String, Object> payload);
}
