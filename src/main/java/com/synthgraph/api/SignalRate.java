package com.synthgraph.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Update frequency class of a value flowing through a patch.
 *
 * Each rate has a one-character code. The code is used as the prefix of every
 * variable the compiler allocates, so a variable's name also tells the
 * synthesis engine how often it is evaluated.
 */
public enum SignalRate {
    AUDIO("a"),
    CONTROL("k"),
    INIT("i"),
    STRING("S"),
    FTABLE("f");

    private final String code;

    SignalRate(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Resolves either the one-character code or the enum name (case-insensitive). */
    @JsonCreator
    public static SignalRate fromCode(String value) {
        if (value == null)
            throw new IllegalArgumentException("Signal rate is null");
        for (SignalRate rate : values()) {
            if (rate.code.equals(value) || rate.name().equalsIgnoreCase(value))
                return rate;
        }
        throw new IllegalArgumentException("Unknown signal rate: " + value);
    }
}
