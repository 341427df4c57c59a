package com.questrail.hlrbridge.runtime;

import com.questrail.hlrbridge.auth.AuthVectorProvider;
import com.questrail.hlrbridge.config.BridgeRuntimeConfig;
import com.questrail.hlrbridge.observability.BridgeObservabilitySink;
import com.questrail.hlrbridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.hlrbridge.protocol.ctrl.CtrlManager;
import com.questrail.hlrbridge.protocol.ctrl.CtrlResponse;
import com.questrail.hlrbridge.protocol.gsup.codec.GsupMessageCodec;
import com.questrail.hlrbridge.protocol.gsup.codec.impl.DefaultGsupMessageCodec;
import com.questrail.hlrbridge.protocol.gsup.manager.GsupManager;
import com.questrail.hlrbridge.protocol.gsup.manager.GsupRequestHandler;
import com.questrail.hlrbridge.protocol.ipa.IpaMultiplexer;
import com.questrail.hlrbridge.protocol.ipa.IpaRoutes;
import com.questrail.hlrbridge.protocol.ipa.IpaRoutesFactory;
import com.questrail.hlrbridge.protocol.ipa.IpaStream;
import com.questrail.hlrbridge.protocol.ipa.IpaWriter;
import com.questrail.hlrbridge.protocol.ipa.OsmoExtension;
import com.questrail.hlrbridge.protocol.ipa.ccm.CcmKeepAliveHandler;
import com.questrail.hlrbridge.transport.tcp.netty.NettyTcpServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * GsupBridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the bridge.
 *
 * <p>Per accepted connection the runtime builds:</p>
 * <pre>
 *   IpaMultiplexer
 *        → CcmKeepAliveHandler   (CCM)
 *        → GsupManager           (OSMO/GSUP)
 *        → CtrlManager           (OSMO/CTRL)
 * </pre>
 *
 * <p>The codec, request handler and provider are shared by all connections;
 * writers, managers and the reassembly buffer are per connection.</p>
 */
public final class GsupBridgeRuntime {
    private static final Logger log = LoggerFactory.getLogger(GsupBridgeRuntime.class);

    private final BridgeRuntimeConfig config;
    private final NettyTcpServerEndpoint server;

    private GsupBridgeRuntime(BridgeRuntimeConfig config, NettyTcpServerEndpoint server) {
        this.config = config;
        this.server = server;
    }

    public BridgeRuntimeConfig config() {
        return config;
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /**
     * Bound address once started; {@code null} otherwise.
     */
    public InetSocketAddress localAddress() {
        return server.localAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeRuntimeConfig config;
        private AuthVectorProvider authVectorProvider;
        private GsupMessageCodec codec = DefaultGsupMessageCodec.INSTANCE;
        private BridgeObservabilitySink observabilitySink = new Slf4jBridgeObservabilitySink();
        private Consumer<CtrlResponse> ctrlListener =
                response -> log.info("Unsolicited CTRL {} id={} {}={}",
                        response.type(), response.id(), response.variable(), response.value());

        public Builder withConfig(BridgeRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withAuthVectorProvider(AuthVectorProvider provider) {
            this.authVectorProvider = provider;
            return this;
        }

        public Builder withCodec(GsupMessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withCtrlListener(Consumer<CtrlResponse> listener) {
            this.ctrlListener = listener;
            return this;
        }

        public GsupBridgeRuntime build() {
            // Unset config falls back to gsup-bridge.properties on the classpath
            BridgeRuntimeConfig effective = config != null ? config : BridgeRuntimeConfig.load();
            Objects.requireNonNull(authVectorProvider, "authVectorProvider");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(ctrlListener, "ctrlListener");

            GsupRequestHandler handler = new GsupRequestHandler(authVectorProvider);
            IpaRoutesFactory routes = routesFactory(codec, handler, observabilitySink, ctrlListener);

            NettyTcpServerEndpoint server = new NettyTcpServerEndpoint(
                effective,
                () -> new IpaMultiplexer(routes, observabilitySink)
            );
            return new GsupBridgeRuntime(effective, server);
        }
    }

    static IpaRoutesFactory routesFactory(GsupMessageCodec codec,
                                          GsupRequestHandler handler,
                                          BridgeObservabilitySink sink,
                                          Consumer<CtrlResponse> ctrlListener) {
        return transport -> new IpaRoutes(
            new CcmKeepAliveHandler(new IpaWriter(transport, IpaStream.CCM)),
            Map.of(
                OsmoExtension.GSUP,
                new GsupManager(new IpaWriter(transport, OsmoExtension.GSUP), codec, handler, sink),
                OsmoExtension.CTRL,
                new CtrlManager(new IpaWriter(transport, OsmoExtension.CTRL), ctrlListener)
            )
        );
    }
}
