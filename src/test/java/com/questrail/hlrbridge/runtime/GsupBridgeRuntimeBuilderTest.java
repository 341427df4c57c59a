package com.questrail.hlrbridge.runtime;

import com.questrail.hlrbridge.config.BridgeRuntimeConfig;
import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GsupBridgeRuntimeBuilderTest {

    private static final AuthVector VECTOR = new AuthVector(new byte[16], new byte[4], new byte[8]);

    @Test
    void configDefaultsToClasspathProperties() {
        GsupBridgeRuntime runtime = GsupBridgeRuntime.builder()
                .withAuthVectorProvider(imsi -> VECTOR)
                .build();

        assertEquals(BridgeRuntimeConfig.load(), runtime.config());
        assertEquals(2222, runtime.config().port());
        assertNull(runtime.localAddress());
    }

    @Test
    void explicitConfigWins() {
        BridgeRuntimeConfig config = BridgeRuntimeConfig.builder().withPort(4222).withBacklog(16).build();

        GsupBridgeRuntime runtime = GsupBridgeRuntime.builder()
                .withConfig(config)
                .withAuthVectorProvider(imsi -> VECTOR)
                .build();

        assertSame(config, runtime.config());
    }

    @Test
    void authVectorProviderIsRequired() {
        assertThrows(NullPointerException.class, () -> GsupBridgeRuntime.builder().build());
    }
}
