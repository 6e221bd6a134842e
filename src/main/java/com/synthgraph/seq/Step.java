package com.synthgraph.seq;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One slot of a pad: the notes to strike and whether silence here sustains
 * what is already sounding.
 *
 * @param notes    distinct notes in 0..127, in the order given
 * @param hold     when the step has no notes, keep the previous notes sounding
 * @param velocity overrides the track velocity, may be null
 */
public record Step(List<Integer> notes, boolean hold, Integer velocity) {
    public static final Step REST = new Step(List.of(), false, null);

    public Step {
        notes = List.copyOf(notes);
    }

    public boolean isRest() {
        return notes.isEmpty();
    }

    /**
     * Normalizes a step as it appears in a configuration document: null, an
     * integer note, a list of integer notes, or an object with {@code note},
     * {@code hold} and optional {@code velocity}.
     */
    public static Step parse(Object raw) {
        if (raw instanceof Map<?, ?> m) {
            boolean hold = Boolean.TRUE.equals(m.get("hold"));
            Integer velocity = null;
            Object v = m.get("velocity");
            if (v != null) {
                if (!isInteger(v))
                    throw new IllegalArgumentException("Step velocity must be an integer.");
                velocity = clamp(((Number) v).intValue(), 1, 127);
            }
            return new Step(parseNotes(m.get("note")), hold, velocity);
        }
        List<Integer> notes = parseNotes(raw);
        return notes.isEmpty() ? REST : new Step(notes, false, null);
    }

    private static List<Integer> parseNotes(Object value) {
        if (value == null)
            return List.of();
        if (isInteger(value))
            return List.of(MidiMessages.clampNote(((Number) value).intValue()));
        if (value instanceof List<?> list) {
            List<Integer> notes = new ArrayList<>(list.size());
            for (Object entry : list) {
                if (!isInteger(entry))
                    throw new IllegalArgumentException("Step notes list must contain integers only.");
                int note = MidiMessages.clampNote(((Number) entry).intValue());
                if (!notes.contains(note))
                    notes.add(note);
            }
            return notes;
        }
        throw new IllegalArgumentException(
                "Step value must be null, an integer note, a list of integer notes, or a step object.");
    }

    private static boolean isInteger(Object o) {
        return o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte
                || o instanceof BigInteger;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
