package express.mvp.scrpc.server;

import express.mvp.scrpc.serialization.JavaSerializer;
import express.mvp.scrpc.serialization.Serializer;
import express.mvp.scrpc.transport.TransportConfig;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for an {@link RpcServer} instance.
 *
 * <table border="1">
 *   <caption>Configuration options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>0.0.0.0</td><td>Address to listen on</td></tr>
 *   <tr><td>port</td><td>0</td><td>Port to listen on; 0 picks an ephemeral port</td></tr>
 *   <tr><td>backlog</td><td>5</td><td>Pending connection queue length</td></tr>
 *   <tr><td>pollInterval</td><td>1s</td><td>Longest wait of the accept loop and of an idle worker
 *       before checking for shutdown</td></tr>
 *   <tr><td>transportConfig</td><td>{@link TransportConfig#defaults()}</td><td>Timeouts and
 *       framing limits of every connection</td></tr>
 *   <tr><td>serializer</td><td>{@link JavaSerializer}</td><td>Argument and result codec</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RpcServerConfig config = RpcServerConfig.builder()
 *     .host("127.0.0.1")
 *     .port(3344)
 *     .pollInterval(Duration.ofMillis(200))
 *     .build();
 * }</pre>
 *
 * @see RpcServer
 */
public final class RpcServerConfig {

    /** Default poll interval of the accept loop and the workers. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    /** Default listen backlog. */
    public static final int DEFAULT_BACKLOG = 5;

    private final String host;
    private final int port;
    private final int backlog;
    private final Duration pollInterval;
    private final TransportConfig transportConfig;
    private final Serializer serializer;

    private RpcServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.backlog = builder.backlog;
        this.pollInterval = builder.pollInterval;
        this.transportConfig = builder.transportConfig;
        this.serializer = builder.serializer;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the host address to bind to.
     *
     * @return the host address (e.g., "0.0.0.0" or "127.0.0.1")
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the TCP port to listen on.
     *
     * @return the port number, 0 for an ephemeral port
     */
    public int getPort() {
        return port;
    }

    public int getBacklog() {
        return backlog;
    }

    /**
     * Returns how long the accept loop and idle workers block before re-checking the shutdown flag.
     *
     * <p>This bounds how long {@link RpcServer#stop(boolean)} takes to be observed.
     *
     * @return the poll interval
     */
    public Duration getPollInterval() {
        return pollInterval;
    }

    public TransportConfig getTransportConfig() {
        return transportConfig;
    }

    public Serializer getSerializer() {
        return serializer;
    }

    @Override
    public String toString() {
        return "RpcServerConfig[host=" + host + ", port=" + port + ", backlog=" + backlog
                + ", pollInterval=" + pollInterval + "]";
    }

    /** Builder for {@link RpcServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 0;
        private int backlog = DEFAULT_BACKLOG;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private TransportConfig transportConfig = TransportConfig.defaults();
        private Serializer serializer = JavaSerializer.getInstance();

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the port to listen on.
         *
         * @param port 0-65535, 0 for an ephemeral port
         * @return this builder
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder backlog(int backlog) {
            if (backlog <= 0) {
                throw new IllegalArgumentException("backlog must be positive: " + backlog);
            }
            this.backlog = backlog;
            return this;
        }

        /**
         * Sets the shutdown poll interval.
         *
         * @param pollInterval a positive duration
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder transportConfig(TransportConfig transportConfig) {
            this.transportConfig = Objects.requireNonNull(transportConfig, "transportConfig");
            return this;
        }

        public Builder serializer(Serializer serializer) {
            this.serializer = Objects.requireNonNull(serializer, "serializer");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         */
        public RpcServerConfig build() {
            return new RpcServerConfig(this);
        }
    }
}
