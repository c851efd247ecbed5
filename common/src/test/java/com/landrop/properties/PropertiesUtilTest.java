package com.landrop.properties;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesUtilTest {

    @Test
    void loadsResourceFromClasspath() {
        Properties properties = PropertiesUtil.load(PropertiesUtilTest.class, "sample.properties");

        assertEquals("9090", properties.getProperty("server.port"));
        assertEquals("/tmp/landrop", properties.getProperty("upload.directory"));
    }

    @Test
    void missingResourceFailsOnLoad() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> PropertiesUtil.load(PropertiesUtilTest.class, "absent.properties"));
        assertTrue(e.getMessage().contains("absent.properties"));
    }

    @Test
    void missingResourceIsNullWhenOptional() {
        assertNull(PropertiesUtil.loadIfPresent(PropertiesUtilTest.class, "absent.properties"));
    }

    @Test
    void bundledTransferPropertiesArePresent() {
        Properties properties = PropertiesUtil.loadTransferProperties();

        assertEquals("1082", properties.getProperty("server.port"));
        assertEquals("104857600", properties.getProperty("upload.max-bytes"));
    }
}
