package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Collects the diagnostics of one compile attempt. Not thread-safe. */
final class Diagnostics {
    private final List<String> messages = new ArrayList<>();

    void add(String message) {
        messages.add(message);
    }

    void addAll(List<String> more) {
        messages.addAll(more);
    }

    boolean isEmpty() {
        return messages.isEmpty();
    }

    int size() {
        return messages.size();
    }

    List<String> list() {
        return Collections.unmodifiableList(messages);
    }

    /** Ends the current pass if anything was reported so far. */
    void failIfAny() {
        if (!messages.isEmpty())
            throw new CompilationException(messages);
    }
}
