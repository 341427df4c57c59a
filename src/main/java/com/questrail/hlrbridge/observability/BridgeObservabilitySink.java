package com.questrail.hlrbridge.observability;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when a peer connects or a connection is lost.
     * @param event the connection event details
     */
    void onConnection(ConnectionEvent event);

    /**
     * Called when a GSUP message is received or sent.
     * @param event the message event
     */
    void onMessage(MessageEvent event);

    /**
     * Called when an IPA frame is discarded without being dispatched.
     * @param event the drop details
     */
    void onFrameDropped(FrameDroppedEvent event);

    /**
     * Called when an error or anomaly occurs while handling a frame or message.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
