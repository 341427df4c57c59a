package com.questrail.hlrbridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnection(ConnectionEvent event) {}

    @Override
    public void onMessage(MessageEvent event) {}

    @Override
    public void onFrameDropped(FrameDroppedEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
