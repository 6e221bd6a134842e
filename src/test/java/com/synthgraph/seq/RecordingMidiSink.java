package com.synthgraph.seq;

import java.util.ArrayList;
import java.util.List;

import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.ShortMessage;

import com.synthgraph.api.MidiSink;

/** Captures sent messages as short strings such as {@code "on 1 60 100"}. */
class RecordingMidiSink implements MidiSink {
    private final List<String> messages = new ArrayList<>();
    private final List<String> selectors = new ArrayList<>();
    volatile boolean failing;

    @Override
    public synchronized void send(String selector, ShortMessage m) throws MidiUnavailableException {
        if (failing)
            throw new MidiUnavailableException("port closed");
        selectors.add(selector);
        int ch = m.getChannel() + 1;
        switch (m.getCommand()) {
            case ShortMessage.NOTE_ON -> messages.add("on " + ch + " " + m.getData1() + " " + m.getData2());
            case ShortMessage.NOTE_OFF -> messages.add("off " + ch + " " + m.getData1());
            case ShortMessage.CONTROL_CHANGE -> messages.add("cc " + ch + " " + m.getData1());
            default -> messages.add("? " + m.getCommand());
        }
    }

    synchronized List<String> drain() {
        List<String> out = new ArrayList<>(messages);
        messages.clear();
        return out;
    }

    synchronized List<String> selectors() {
        return new ArrayList<>(selectors);
    }
}
