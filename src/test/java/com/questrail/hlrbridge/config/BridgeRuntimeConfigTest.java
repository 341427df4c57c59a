package com.questrail.hlrbridge.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeRuntimeConfigTest
{
    @Test
    void defaults()
    {
        BridgeRuntimeConfig config = BridgeRuntimeConfig.defaults();

        assertEquals("0.0.0.0", config.bindHost());
        assertEquals(2222, config.port());
        assertEquals(1, config.workerThreads());
        assertEquals(128, config.backlog());
        assertTrue(config.tcpNoDelay());
        assertTrue(config.keepAlive());
    }

    @Test
    void readsProperties()
    {
        Properties props = new Properties();
        props.setProperty("gsup-bridge.bind-host", " 127.0.0.1 ");
        props.setProperty("gsup-bridge.port", "4222");
        props.setProperty("gsup-bridge.worker-threads", "4");
        props.setProperty("gsup-bridge.tcp-no-delay", "false");

        BridgeRuntimeConfig config = BridgeRuntimeConfig.fromProperties(props);

        assertEquals("127.0.0.1", config.bindHost());
        assertEquals(4222, config.port());
        assertEquals(4, config.workerThreads());
        assertEquals(128, config.backlog());
        assertFalse(config.tcpNoDelay());
        assertTrue(config.keepAlive());
    }

    @Test
    void rejectsBadValues()
    {
        Properties props = new Properties();
        props.setProperty("gsup-bridge.port", "abc");
        assertThrows(IllegalArgumentException.class, () -> BridgeRuntimeConfig.fromProperties(props));

        assertThrows(IllegalArgumentException.class, () -> BridgeRuntimeConfig.builder().withPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> BridgeRuntimeConfig.builder().withWorkerThreads(0).build());
    }

    @Test
    void loadsClasspathResource()
    {
        BridgeRuntimeConfig config = BridgeRuntimeConfig.load();

        assertEquals("0.0.0.0", config.bindHost());
        assertEquals(BridgeRuntimeConfig.DEFAULT_PORT, config.port());
        assertEquals(BridgeRuntimeConfig.defaults(), config);
    }
}
