package com.synthgraph.io;

import static org.junit.Assert.*;

import org.junit.Test;

public class SynthGraphSettingsTest {

    @Test
    public void testLoadFromClasspath() {
        SynthGraphSettings settings = SynthGraphSettings.load();
        assertEquals("0", settings.getCompiler().getMidiInput());
        assertEquals("cmidi", settings.getCompiler().getRtmidiModule());
        assertEquals(128, settings.getCompiler().getSoftwareBuffer());
        assertEquals(120, settings.getSequencer().getDefaultBpm());
        assertEquals(256, settings.getSequencer().getEventBufferSize());
    }

    @Test
    public void testDefaults() {
        SynthGraphSettings settings = SynthGraphSettings.defaults();
        assertEquals(512, settings.getCompiler().getHardwareBuffer());
        assertEquals(1000, settings.getSequencer().getStopJoinTimeoutMillis());
        assertNotNull(settings.getCompiler().getPlatform());
    }

    @Test
    public void testDetectPlatform() {
        String platform = SynthGraphSettings.detectPlatform();
        assertTrue(platform, platform.equals("macos") || platform.equals("windows") || platform.equals("linux"));
    }
}
