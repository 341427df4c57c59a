package com.questrail.hlrbridge.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the bridge runtime.
 *
 * <p>Properties keys (all optional):</p>
 * <ul>
 *   <li>{@code gsup-bridge.bind-host} (default {@code 0.0.0.0})</li>
 *   <li>{@code gsup-bridge.port} (default 2222; 0 picks a free port)</li>
 *   <li>{@code gsup-bridge.worker-threads} (default 1)</li>
 *   <li>{@code gsup-bridge.backlog} (default 128)</li>
 *   <li>{@code gsup-bridge.tcp-no-delay} (default true)</li>
 *   <li>{@code gsup-bridge.keep-alive} (default true)</li>
 * </ul>
 */
public record BridgeRuntimeConfig(
    String bindHost,
    int port,
    int workerThreads,
    int backlog,
    boolean tcpNoDelay,
    boolean keepAlive
) {
    public static final String RESOURCE = "gsup-bridge.properties";
    public static final String PREFIX = "gsup-bridge.";

    public static final int DEFAULT_PORT = 2222;

    public BridgeRuntimeConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("backlog must be positive: " + backlog);
        }
    }

    public static BridgeRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code gsup-bridge.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric value does not parse
     */
    public static BridgeRuntimeConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();

        String host = props.getProperty(PREFIX + "bind-host");
        if (host != null) {
            b.withBindHost(host.trim());
        }
        Integer port = intProperty(props, "port");
        if (port != null) {
            b.withPort(port);
        }
        Integer workers = intProperty(props, "worker-threads");
        if (workers != null) {
            b.withWorkerThreads(workers);
        }
        Integer backlog = intProperty(props, "backlog");
        if (backlog != null) {
            b.withBacklog(backlog);
        }
        String noDelay = props.getProperty(PREFIX + "tcp-no-delay");
        if (noDelay != null) {
            b.withTcpNoDelay(Boolean.parseBoolean(noDelay.trim()));
        }
        String keepAlive = props.getProperty(PREFIX + "keep-alive");
        if (keepAlive != null) {
            b.withKeepAlive(Boolean.parseBoolean(keepAlive.trim()));
        }
        return b.build();
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, falling back to
     * {@link #defaults()} if it is absent.
     */
    public static BridgeRuntimeConfig load() {
        Properties props = new Properties();
        try (InputStream in = BridgeRuntimeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    private static Integer intProperty(Properties props, String key) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
        }
    }

    public static final class Builder {
        private String bindHost = "0.0.0.0";
        private int port = DEFAULT_PORT;
        private int workerThreads = 1;
        private int backlog = 128;
        private boolean tcpNoDelay = true;
        private boolean keepAlive = true;

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder withTcpNoDelay(boolean tcpNoDelay) {
            this.tcpNoDelay = tcpNoDelay;
            return this;
        }

        public Builder withKeepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public BridgeRuntimeConfig build() {
            return new BridgeRuntimeConfig(bindHost, port, workerThreads, backlog, tcpNoDelay, keepAlive);
        }
    }
}
