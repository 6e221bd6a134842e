package com.synthgraph.engine;

import com.synthgraph.api.PortSpec;
import com.synthgraph.api.SignalRate;

/**
 * Rate compatibility between a connected output and input.
 *
 * A source rate is accepted when the input lists it explicitly, when both
 * rates are equal, or when an init-rate value feeds a control-rate input.
 */
public final class SignalTypeChecker {

    private SignalTypeChecker() {
        // Utility class
    }

    public static boolean isCompatible(SignalRate source, PortSpec target) {
        return isCompatible(source, target.rate(), target.acceptedRates().contains(source));
    }

    static boolean isCompatible(SignalRate source, SignalRate target, boolean explicitlyAccepted) {
        if (explicitlyAccepted || source == target)
            return true;
        return source == SignalRate.INIT && target == SignalRate.CONTROL;
    }

    public static String mismatch(String fromNode, PortSpec from, String toNode, PortSpec to) {
        return "Signal type mismatch: " + fromNode + "." + from.id() + " (" + from.rate().code() + ") -> "
                + toNode + "." + to.id() + " (" + to.rate().code() + ")";
    }
}
