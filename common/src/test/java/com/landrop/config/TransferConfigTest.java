package com.landrop.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TransferConfigTest {

    @Test
    void builderDefaultsMatchReferenceBehaviour() {
        TransferConfig config = TransferConfig.builder().build();

        assertEquals(1082, config.getPort());
        assertEquals(100L * 1024 * 1024, config.getMaxUploadBytes());
        assertEquals(Paths.get("."), config.getUploadDirectory());
        assertTrue(config.getThreads() > 0);
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(TransferConfig.KEY_PORT, "8081");
        properties.setProperty(TransferConfig.KEY_MAX_UPLOAD_BYTES, "2048");
        properties.setProperty(TransferConfig.KEY_UPLOAD_DIRECTORY, "incoming");
        properties.setProperty(TransferConfig.KEY_STOP_DELAY, "0");

        TransferConfig config = TransferConfig.from(properties);

        assertEquals(8081, config.getPort());
        assertEquals(2048, config.getMaxUploadBytes());
        assertEquals(Paths.get("incoming"), config.getUploadDirectory());
        assertEquals(0, config.getStopDelaySeconds());
        assertEquals(64 * 1024, config.getBufferSize());
    }

    @Test
    void malformedValueNamesTheKey() {
        Properties properties = new Properties();
        properties.setProperty(TransferConfig.KEY_THREADS, "many");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> TransferConfig.from(properties));
        assertTrue(e.getMessage().contains(TransferConfig.KEY_THREADS));
    }

    @Test
    void loadUsesBundledFile() {
        TransferConfig config = TransferConfig.load();

        assertEquals(16, config.getThreads());
        assertEquals(65536, config.getBufferSize());
    }

    @Test
    void parsePortValidatesRange() {
        assertEquals(0, TransferConfig.parsePort("0"));
        assertEquals(65535, TransferConfig.parsePort(" 65535 "));
        assertThrows(IllegalArgumentException.class, () -> TransferConfig.parsePort("65536"));
        assertThrows(IllegalArgumentException.class, () -> TransferConfig.parsePort("-1"));
        assertThrows(IllegalArgumentException.class, () -> TransferConfig.parsePort("http"));
    }
}
