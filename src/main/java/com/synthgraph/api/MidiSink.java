package com.synthgraph.api;

import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.ShortMessage;

/**
 * Destination for raw channel messages produced by the sequencer.
 *
 * The selector names the MIDI input the synthesis engine listens on. Calls
 * arrive from the scheduling thread and from callers of stop/configure, so
 * implementations must tolerate concurrent use.
 */
@FunctionalInterface
public interface MidiSink {

    void send(String selector, ShortMessage message) throws MidiUnavailableException;
}
