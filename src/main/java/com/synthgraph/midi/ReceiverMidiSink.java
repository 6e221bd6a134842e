package com.synthgraph.midi;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import javax.sound.midi.MidiDevice;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.Receiver;
import javax.sound.midi.ShortMessage;

import com.synthgraph.api.MidiSink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link MidiSink} backed by {@code javax.sound.midi} receivers, one per
 * selector. Selectors are bound explicitly or opened from the system's
 * devices by index or by name.
 */
public final class ReceiverMidiSink implements MidiSink, AutoCloseable {
    private static final Logger log = LogManager.getLogger(ReceiverMidiSink.class);

    private final Map<String, Route> routes = new ConcurrentHashMap<>();

    /** A bound receiver and, when this sink opened it, the device behind it. */
    private record Route(Receiver receiver, MidiDevice device) {

        void close() {
            receiver.close();
            if (device != null && device.isOpen())
                device.close();
        }
    }

    /** Routes messages for the selector to the receiver, replacing any previous one. */
    public void bind(String selector, Receiver receiver) {
        bind(selector, receiver, null);
    }

    /** As {@link #bind(String, Receiver)}; the device is closed with the route. */
    void bind(String selector, Receiver receiver, MidiDevice owned) {
        Route previous = routes.put(selector, new Route(receiver, owned));
        if (previous == null)
            return;
        if (previous.receiver() != receiver)
            previous.receiver().close();
        if (previous.device() != null && previous.device() != owned && previous.device().isOpen())
            previous.device().close();
    }

    /**
     * Opens a system device that accepts input and binds it. A numeric
     * selector is an index into those devices; anything else must match a
     * device name. A device opened here is closed again when its selector is
     * rebound or the sink is closed.
     */
    public Receiver openDevice(String selector) throws MidiUnavailableException {
        List<MidiDevice.Info> candidates = new ArrayList<>();
        for (MidiDevice.Info info : MidiSystem.getMidiDeviceInfo()) {
            MidiDevice device = MidiSystem.getMidiDevice(info);
            if (device.getMaxReceivers() != 0)
                candidates.add(info);
        }
        MidiDevice.Info chosen = null;
        if (selector.chars().allMatch(Character::isDigit) && !selector.isEmpty()) {
            int index = Integer.parseInt(selector);
            if (index < candidates.size())
                chosen = candidates.get(index);
        } else {
            for (MidiDevice.Info info : candidates)
                if (info.getName().equals(selector))
                    chosen = info;
        }
        if (chosen == null)
            throw new MidiUnavailableException("No MIDI device matches '" + selector + "'");

        MidiDevice device = MidiSystem.getMidiDevice(chosen);
        boolean opened = !device.isOpen();
        if (opened)
            device.open();
        Receiver receiver;
        try {
            receiver = device.getReceiver();
        } catch (MidiUnavailableException e) {
            if (opened)
                device.close();
            throw e;
        }
        bind(selector, receiver, opened ? device : null);
        log.info("MIDI input '{}' bound to device {}", selector, chosen.getName());
        return receiver;
    }

    @Override
    public void send(String selector, ShortMessage message) throws MidiUnavailableException {
        Route route = routes.get(selector);
        if (route == null)
            throw new MidiUnavailableException("No MIDI input bound to '" + selector + "'");
        route.receiver().send(message, -1);
    }

    @Override
    public void close() {
        routes.values().forEach(Route::close);
        routes.clear();
    }
}
