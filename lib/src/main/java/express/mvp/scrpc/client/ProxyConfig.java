package express.mvp.scrpc.client;

import express.mvp.scrpc.serialization.JavaSerializer;
import express.mvp.scrpc.serialization.Serializer;
import express.mvp.scrpc.transport.TransportConfig;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link RpcProxy}.
 *
 * <table border="1">
 *   <caption>Proxy Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>transportConfig</td><td>{@link TransportConfig#defaults()}</td><td>Socket timeouts
 *       and framing limits; its default timeout bounds the wait for each ACK</td></tr>
 *   <tr><td>maxCallDuration</td><td>600s</td><td>Longest wait for a RESULT once the arguments
 *       were accepted</td></tr>
 *   <tr><td>serializer</td><td>{@link JavaSerializer}</td><td>Argument and result codec</td></tr>
 * </table>
 */
public final class ProxyConfig {

    /** Default upper bound on the execution of one remote call. */
    public static final Duration DEFAULT_MAX_CALL_DURATION = Duration.ofSeconds(600);

    private static final ProxyConfig DEFAULTS = builder().build();

    private final TransportConfig transportConfig;
    private final Duration maxCallDuration;
    private final Serializer serializer;

    private ProxyConfig(Builder builder) {
        this.transportConfig = builder.transportConfig;
        this.maxCallDuration = builder.maxCallDuration;
        this.serializer = builder.serializer;
    }

    /**
     * Creates a new builder.
     *
     * @return a builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     *
     * @return the shared default configuration
     */
    public static ProxyConfig defaults() {
        return DEFAULTS;
    }

    public TransportConfig transportConfig() {
        return transportConfig;
    }

    public Duration maxCallDuration() {
        return maxCallDuration;
    }

    public Serializer serializer() {
        return serializer;
    }

    @Override
    public String toString() {
        return "ProxyConfig[transportConfig=" + transportConfig
                + ", maxCallDuration=" + maxCallDuration
                + ", serializer=" + serializer.getClass().getSimpleName() + "]";
    }

    /** Builder for {@link ProxyConfig}. */
    public static final class Builder {
        private TransportConfig transportConfig = TransportConfig.defaults();
        private Duration maxCallDuration = DEFAULT_MAX_CALL_DURATION;
        private Serializer serializer = JavaSerializer.getInstance();

        private Builder() {}

        public Builder transportConfig(TransportConfig transportConfig) {
            this.transportConfig = Objects.requireNonNull(transportConfig, "transportConfig");
            return this;
        }

        /**
         * Sets the longest wait for a call result.
         *
         * @param maxCallDuration the limit (not negative)
         * @return this builder
         */
        public Builder maxCallDuration(Duration maxCallDuration) {
            Objects.requireNonNull(maxCallDuration, "maxCallDuration");
            if (maxCallDuration.isNegative()) {
                throw new IllegalArgumentException(
                        "Invalid timeout period (" + maxCallDuration + ") for maxCallDuration");
            }
            this.maxCallDuration = maxCallDuration;
            return this;
        }

        public Builder serializer(Serializer serializer) {
            this.serializer = Objects.requireNonNull(serializer, "serializer");
            return this;
        }

        public ProxyConfig build() {
            return new ProxyConfig(this);
        }
    }
}
