package com.synthgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Process-wide settings, read from the {@code synthgraph.json} classpath
 * resource. Keys absent from the resource keep their field defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SynthGraphSettings {
    public static final String RESOURCE = "/synthgraph.json";

    private Compiler compiler = new Compiler();
    private Sequencer sequencer = new Sequencer();

    public static SynthGraphSettings defaults() {
        return new SynthGraphSettings();
    }

    /** Loads {@link #RESOURCE}, falling back to defaults when it is absent. */
    public static SynthGraphSettings load() {
        try (InputStream in = SynthGraphSettings.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            return new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                    .readValue(in, SynthGraphSettings.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings from " + RESOURCE, e);
        }
    }

    /** Values used when wrapping a compiled program into its document. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Compiler {
        private String midiInput = "0";
        private String rtmidiModule = "cmidi";
        private int softwareBuffer = 128;
        private int hardwareBuffer = 512;
        private String platform = detectPlatform();
    }

    /** Scheduler tuning. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Sequencer {
        private int defaultBpm = 120;
        private long stopJoinTimeoutMillis = 1000;
        private long spinThresholdMicros = 800;
        private long sleepMicros = 1000;
        private long initialDelayMillis = 10;
        private int eventBufferSize = 256;
    }

    static String detectPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin"))
            return "macos";
        if (os.contains("win"))
            return "windows";
        return "linux";
    }
}
