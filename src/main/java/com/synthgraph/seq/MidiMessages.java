package com.synthgraph.seq;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.ShortMessage;

/**
 * Channel messages sent by the sequencer. Channels are 1-based here and
 * converted to the 0-based form {@link ShortMessage} expects.
 */
public final class MidiMessages {
    public static final int ALL_SOUND_OFF = 120;
    public static final int ALL_NOTES_OFF = 123;

    private MidiMessages() {
        // Utility class
    }

    public static ShortMessage noteOn(int channel, int note, int velocity) throws InvalidMidiDataException {
        return new ShortMessage(ShortMessage.NOTE_ON, channel - 1, clampNote(note), velocity);
    }

    /** Note-off with release velocity 0. */
    public static ShortMessage noteOff(int channel, int note) throws InvalidMidiDataException {
        return new ShortMessage(ShortMessage.NOTE_OFF, channel - 1, clampNote(note), 0);
    }

    public static ShortMessage controlChange(int channel, int controller, int value) throws InvalidMidiDataException {
        return new ShortMessage(ShortMessage.CONTROL_CHANGE, channel - 1, controller, value);
    }

    static int clampNote(int note) {
        return Math.max(0, Math.min(127, note));
    }
}
