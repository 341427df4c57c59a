package com.questrail.hlrbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onConnection(ConnectionEvent event) {
        if (event.up()) {
            log.info("Peer connected: {}", event.remote());
        }
        else if (event.cause() == null) {
            log.info("Peer disconnected: {}", event.remote());
        }
        else {
            log.warn("Peer connection lost: {}", event.remote(), event.cause());
        }
    }

    @Override
    public void onMessage(MessageEvent event) {
        log.debug("GSUP {} {} imsi={}", event.direction(), event.type(), event.imsi());
    }

    @Override
    public void onFrameDropped(FrameDroppedEvent event) {
        log.warn("IPA frame dropped (stream=0x{}, extension={}): {}",
            Integer.toHexString(event.streamId()),
            event.extension() < 0 ? "none" : "0x" + Integer.toHexString(event.extension()),
            event.reason());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge Error: {}", event.message(), event.cause());
    }
}
