package com.questrail.bmux.config;

import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.error.ConfigurationException;

import java.time.Duration;

/**
 * Resolved configuration for a bmux server.
 *
 * <p>This is a plain value: where it comes from (file, environment, flags) is
 * the embedding application's business. All timeouts are independent, and a
 * zero duration disables the corresponding timeout; for the shutdown timeout
 * that means waiting without bound.</p>
 *
 * @param headerPrefixSize size of the envelope length prefix; only
 *        {@value PacketEnvelope#PREFIX_LENGTH} is supported
 * @param multicore on the event-loop model, run one worker loop per available
 *        processor instead of a single loop; ignored by the blocking model
 * @param packetLogging install a global middleware that logs every dispatched
 *        message at DEBUG
 */
public record BmuxServerConfig(
    String address,
    int port,
    TransportScheme scheme,
    ConcurrencyModel concurrencyModel,
    int headerPrefixSize,
    int maxConnections,
    Duration readTimeout,
    Duration writeTimeout,
    Duration idleTimeout,
    Duration shutdownTimeout,
    boolean keepAlive,
    boolean multicore,
    boolean experimental,
    boolean packetLogging
) {
    public BmuxServerConfig {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("address must not be blank");
        }
        if (port < 0 || port > 0xFFFF) {
            throw new ConfigurationException("port must be 0-65535, was " + port);
        }
        if (scheme == null) {
            throw new ConfigurationException("scheme must not be null");
        }
        if (concurrencyModel == null) {
            throw new ConfigurationException("concurrencyModel must not be null");
        }
        if (headerPrefixSize != PacketEnvelope.PREFIX_LENGTH) {
            throw new ConfigurationException(
                "headerPrefixSize must be " + PacketEnvelope.PREFIX_LENGTH + ", was " + headerPrefixSize);
        }
        if (maxConnections <= 0) {
            throw new ConfigurationException("maxConnections must be positive, was " + maxConnections);
        }
        requireTimeout("readTimeout", readTimeout);
        requireTimeout("writeTimeout", writeTimeout);
        requireTimeout("idleTimeout", idleTimeout);
        requireTimeout("shutdownTimeout", shutdownTimeout);
    }

    private static void requireTimeout(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(name + " must be zero or positive");
        }
    }

    public static BmuxServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withAddress(address)
            .withPort(port)
            .withScheme(scheme)
            .withConcurrencyModel(concurrencyModel)
            .withHeaderPrefixSize(headerPrefixSize)
            .withMaxConnections(maxConnections)
            .withReadTimeout(readTimeout)
            .withWriteTimeout(writeTimeout)
            .withIdleTimeout(idleTimeout)
            .withShutdownTimeout(shutdownTimeout)
            .withKeepAlive(keepAlive)
            .withMulticore(multicore)
            .withExperimental(experimental)
            .withPacketLogging(packetLogging);
    }

    public static final class Builder {
        private String address = "0.0.0.0";
        private int port = 30000;
        private TransportScheme scheme = TransportScheme.TCP;
        private ConcurrencyModel concurrencyModel = ConcurrencyModel.EVENT_LOOP;
        private int headerPrefixSize = PacketEnvelope.PREFIX_LENGTH;
        private int maxConnections = 1024;
        private Duration readTimeout = Duration.ofSeconds(15);
        private Duration writeTimeout = Duration.ZERO;
        private Duration idleTimeout = Duration.ZERO;
        private Duration shutdownTimeout = Duration.ofSeconds(15);
        private boolean keepAlive = true;
        private boolean multicore = true;
        private boolean experimental = false;
        private boolean packetLogging = false;

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withScheme(TransportScheme scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder withConcurrencyModel(ConcurrencyModel model) {
            this.concurrencyModel = model;
            return this;
        }

        public Builder withHeaderPrefixSize(int size) {
            this.headerPrefixSize = size;
            return this;
        }

        public Builder withMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder withReadTimeout(Duration timeout) {
            this.readTimeout = timeout;
            return this;
        }

        public Builder withWriteTimeout(Duration timeout) {
            this.writeTimeout = timeout;
            return this;
        }

        public Builder withIdleTimeout(Duration timeout) {
            this.idleTimeout = timeout;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder withKeepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withMulticore(boolean multicore) {
            this.multicore = multicore;
            return this;
        }

        public Builder withExperimental(boolean experimental) {
            this.experimental = experimental;
            return this;
        }

        public Builder withPacketLogging(boolean packetLogging) {
            this.packetLogging = packetLogging;
            return this;
        }

        public BmuxServerConfig build() {
            return new BmuxServerConfig(
                address,
                port,
                scheme,
                concurrencyModel,
                headerPrefixSize,
                maxConnections,
                readTimeout,
                writeTimeout,
                idleTimeout,
                shutdownTimeout,
                keepAlive,
                multicore,
                experimental,
                packetLogging
            );
        }
    }
}
