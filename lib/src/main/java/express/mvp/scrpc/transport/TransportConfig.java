package express.mvp.scrpc.transport;

import express.mvp.scrpc.transport.framing.LengthPrefixedFramingHandler;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link FramedTransport} timeouts and framing limits.
 *
 * <p>This immutable configuration object is shared by every transport created from it, including
 * the transports returned by {@link FramedTransport#accept(Duration)}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Transport Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>defaultTimeout</td><td>10s</td><td>Wait used when no per-call timeout is given</td></tr>
 *   <tr><td>connectTimeout</td><td>10s</td><td>TCP connection establishment timeout</td></tr>
 *   <tr><td>payloadChunkTimeout</td><td>60s</td><td>Wait for each chunk of a framed payload</td></tr>
 *   <tr><td>maxConsecutivePayloadTimeouts</td><td>2</td><td>Chunk timeouts in a row that fail
 *       the frame</td></tr>
 *   <tr><td>chunkSize</td><td>4096</td><td>Largest single read/write of a framed message</td></tr>
 *   <tr><td>maxPayloadSize</td><td>64MB</td><td>Largest accepted frame payload</td></tr>
 *   <tr><td>tcpNoDelay</td><td>true</td><td>Disable Nagle's algorithm</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TransportConfig config = TransportConfig.builder()
 *     .defaultTimeout(Duration.ofSeconds(5))
 *     .payloadChunkTimeout(Duration.ofSeconds(30))
 *     .build();
 *
 * FramedTransport transport = FramedTransport.open(config);
 * }</pre>
 *
 * @see FramedTransport
 */
public final class TransportConfig {

    /** Default wait for a single blocking operation. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Default wait for each chunk of a framed payload. */
    public static final Duration DEFAULT_PAYLOAD_CHUNK_TIMEOUT = Duration.ofSeconds(60);

    /** Default largest single read/write while transferring a framed message. */
    public static final int DEFAULT_CHUNK_SIZE = 4096;

    /** Default number of consecutive chunk timeouts that fail a framed payload. */
    public static final int DEFAULT_MAX_CONSECUTIVE_PAYLOAD_TIMEOUTS = 2;

    private static final TransportConfig DEFAULTS = builder().build();

    private final Duration defaultTimeout;
    private final Duration connectTimeout;
    private final Duration payloadChunkTimeout;
    private final int maxConsecutivePayloadTimeouts;
    private final int chunkSize;
    private final int maxPayloadSize;
    private final boolean tcpNoDelay;

    private TransportConfig(Builder builder) {
        this.defaultTimeout = builder.defaultTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.payloadChunkTimeout = builder.payloadChunkTimeout;
        this.maxConsecutivePayloadTimeouts = builder.maxConsecutivePayloadTimeouts;
        this.chunkSize = builder.chunkSize;
        this.maxPayloadSize = builder.maxPayloadSize;
        this.tcpNoDelay = builder.tcpNoDelay;
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the configuration with every parameter at its default.
     *
     * @return the shared default configuration
     */
    public static TransportConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the wait used when an operation is not given its own timeout.
     *
     * @return the default timeout
     */
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Returns the TCP connection establishment timeout.
     *
     * @return the connect timeout
     */
    public Duration connectTimeout() {
        return connectTimeout;
    }

    /**
     * Returns the wait applied to each chunk of a framed payload once its prefix has been read.
     *
     * @return the per-chunk payload timeout
     */
    public Duration payloadChunkTimeout() {
        return payloadChunkTimeout;
    }

    /**
     * Returns how many chunk timeouts in a row, with no bytes arriving in between, fail a framed
     * payload with "insufficient data".
     *
     * @return the consecutive timeout threshold (at least 1)
     */
    public int maxConsecutivePayloadTimeouts() {
        return maxConsecutivePayloadTimeouts;
    }

    /**
     * Returns the largest single read or write used while transferring a framed message.
     *
     * @return the chunk size in bytes
     */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Returns the largest frame payload accepted or produced.
     *
     * @return the maximum payload size in bytes
     */
    public int maxPayloadSize() {
        return maxPayloadSize;
    }

    /**
     * Returns whether TCP_NODELAY is set on connected sockets.
     *
     * @return {@code true} if Nagle's algorithm is disabled
     */
    public boolean tcpNoDelay() {
        return tcpNoDelay;
    }

    @Override
    public String toString() {
        return "TransportConfig["
                + "defaultTimeout=" + defaultTimeout
                + ", connectTimeout=" + connectTimeout
                + ", payloadChunkTimeout=" + payloadChunkTimeout
                + ", maxConsecutivePayloadTimeouts=" + maxConsecutivePayloadTimeouts
                + ", chunkSize=" + chunkSize
                + ", maxPayloadSize=" + maxPayloadSize
                + ", tcpNoDelay=" + tcpNoDelay
                + "]";
    }

    /** Builder for {@link TransportConfig}. */
    public static final class Builder {
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration connectTimeout = DEFAULT_TIMEOUT;
        private Duration payloadChunkTimeout = DEFAULT_PAYLOAD_CHUNK_TIMEOUT;
        private int maxConsecutivePayloadTimeouts = DEFAULT_MAX_CONSECUTIVE_PAYLOAD_TIMEOUTS;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxPayloadSize = LengthPrefixedFramingHandler.DEFAULT_MAX_PAYLOAD_SIZE;
        private boolean tcpNoDelay = true;

        private Builder() {}

        /**
         * Sets the wait used when an operation is not given its own timeout.
         *
         * @param defaultTimeout the default timeout (not negative)
         * @return this builder
         */
        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = requireNotNegative(defaultTimeout, "defaultTimeout");
            return this;
        }

        /**
         * Sets the TCP connection establishment timeout.
         *
         * @param connectTimeout the connect timeout (not negative)
         * @return this builder
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requireNotNegative(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Sets the wait applied to each chunk of a framed payload.
         *
         * @param payloadChunkTimeout the per-chunk timeout (not negative)
         * @return this builder
         */
        public Builder payloadChunkTimeout(Duration payloadChunkTimeout) {
            this.payloadChunkTimeout = requireNotNegative(payloadChunkTimeout, "payloadChunkTimeout");
            return this;
        }

        /**
         * Sets how many consecutive chunk timeouts fail a framed payload.
         *
         * @param maxConsecutivePayloadTimeouts the threshold (at least 1)
         * @return this builder
         */
        public Builder maxConsecutivePayloadTimeouts(int maxConsecutivePayloadTimeouts) {
            if (maxConsecutivePayloadTimeouts < 1) {
                throw new IllegalArgumentException(
                        "maxConsecutivePayloadTimeouts must be at least 1: "
                                + maxConsecutivePayloadTimeouts);
            }
            this.maxConsecutivePayloadTimeouts = maxConsecutivePayloadTimeouts;
            return this;
        }

        /**
         * Sets the largest single read or write of a framed message.
         *
         * @param chunkSize the chunk size in bytes (positive)
         * @return this builder
         */
        public Builder chunkSize(int chunkSize) {
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
            }
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Sets the largest accepted frame payload.
         *
         * @param maxPayloadSize the maximum payload size in bytes
         * @return this builder
         */
        public Builder maxPayloadSize(int maxPayloadSize) {
            if (maxPayloadSize <= 0) {
                throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
            }
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        /**
         * Sets whether TCP_NODELAY is enabled on connected sockets.
         *
         * @param tcpNoDelay {@code true} to disable Nagle's algorithm
         * @return this builder
         */
        public Builder tcpNoDelay(boolean tcpNoDelay) {
            this.tcpNoDelay = tcpNoDelay;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         */
        public TransportConfig build() {
            return new TransportConfig(this);
        }

        private static Duration requireNotNegative(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isNegative()) {
                throw new IllegalArgumentException("Invalid timeout period (" + value + ") for " + name);
            }
            return value;
        }
    }
}
