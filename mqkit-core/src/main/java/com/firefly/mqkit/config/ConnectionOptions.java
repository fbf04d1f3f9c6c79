/*
 * Copyright (c) 2026 Firefly Software Solutions Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.mqkit.config;

import com.firefly.mqkit.Handler;
import com.firefly.mqkit.context.OptionsContext;
import com.firefly.mqkit.logging.MqLogger;
import com.firefly.mqkit.logging.NoopLogger;
import com.firefly.mqkit.serialization.Codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Everything a broker client needs to open and keep a session.
 *
 * <p>Instances are immutable and safe to share between the workers a broker
 * client spawns. They are built by applying {@link Option}s in order to a
 * {@link Builder} that starts from the defaults; when two options touch the same
 * field the later one wins. Building never validates and never fails; see
 * {@link OptionsValidator} for the checks a broker client runs when it consumes
 * the options.
 *
 * <p>Example:
 * <pre>{@code
 * ConnectionOptions options = ConnectionOptions.newOptions(
 *     Options.addresses("kafka-1:9092", "kafka-2:9092"),
 *     Options.version("2.8.0"),
 *     Options.sasl("svc-orders", secret, SaslMechanisms.SCRAM_SHA_512),
 *     Options.codec(Codecs.json()),
 *     Options.otel(true));
 * }</pre>
 */
public final class ConnectionOptions {

    private final List<String> addresses;
    private final ProtocolVersion version;
    private final boolean secure;
    private final TlsConfig tlsConfig;
    private final String username;
    private final String password;
    private final String mechanism;
    private final Codec codec;
    private final Handler errorHandler;
    private final OptionsContext context;
    private final MqLogger logger;
    private final boolean otel;

    private ConnectionOptions(Builder builder) {
        this.addresses = Collections.unmodifiableList(new ArrayList<>(builder.addresses));
        this.version = builder.version;
        this.secure = builder.secure;
        this.tlsConfig = builder.tlsConfig;
        this.username = builder.username;
        this.password = builder.password;
        this.mechanism = builder.mechanism;
        this.codec = builder.codec;
        this.errorHandler = builder.errorHandler;
        this.context = builder.context;
        this.logger = builder.logger;
        this.otel = builder.otel;
    }

    /**
     * Builds connection options from the defaults and the given options, applied in order.
     *
     * @param opts options to apply
     * @return frozen options
     */
    public static ConnectionOptions newOptions(Option... opts) {
        return builder().apply(opts).build();
    }

    public static ConnectionOptions newOptions(List<? extends Option> opts) {
        return builder().apply(opts).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder holding this instance's values, for deriving new options.
     *
     * @return builder seeded with this configuration
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.addresses = new ArrayList<>(addresses);
        b.version = version;
        b.secure = secure;
        b.tlsConfig = tlsConfig;
        b.username = username;
        b.password = password;
        b.mechanism = mechanism;
        b.codec = codec;
        b.errorHandler = errorHandler;
        b.context = context;
        b.logger = logger;
        b.otel = otel;
        return b;
    }

    /** Broker addresses in the order they were given. */
    public List<String> getAddresses() { return addresses; }

    /** Protocol version, or null when the broker client should pick its default. */
    public ProtocolVersion getVersion() { return version; }

    public boolean isSecure() { return secure; }

    /** TLS material, meaningful only when {@link #isSecure()} is true. */
    public TlsConfig getTlsConfig() { return tlsConfig; }

    public String getUsername() { return username; }
    public String getPassword() { return password; }

    /** SASL mechanism, see {@link SaslMechanisms}. */
    public String getMechanism() { return mechanism; }

    public Codec getCodec() { return codec; }

    /** Hook for unrecoverable processing errors, or null when errors are not intercepted. */
    public Handler getErrorHandler() { return errorHandler; }

    /** Carried context, or null when none was attached. */
    public OptionsContext getContext() { return context; }

    public MqLogger getLogger() { return logger; }

    /** Whether OpenTelemetry tracing is enabled. */
    public boolean isOtel() { return otel; }

    public OptionsContext contextOrEmpty() {
        return context != null ? context : OptionsContext.empty();
    }

    /**
     * @return true when secure transport is on and TLS material is present
     */
    public boolean isTlsActive() {
        return secure && tlsConfig != null;
    }

    /**
     * @return true when username, password and mechanism are all non-empty
     */
    public boolean hasSaslCredentials() {
        return !isEmpty(username) && !isEmpty(password) && !isEmpty(mechanism);
    }

    static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    @Override
    public String toString() {
        return "ConnectionOptions{addresses=" + addresses
                + ", version=" + version
                + ", secure=" + secure
                + ", tlsConfig=" + tlsConfig
                + ", username=" + username
                + ", mechanism=" + mechanism
                + ", codec=" + (codec != null ? codec.name() : null)
                + ", errorHandler=" + (errorHandler != null)
                + ", context=" + context
                + ", otel=" + otel + "}";
    }

    /**
     * Mutable settings record the {@link Option}s are applied to.
     *
     * <p>Can also be used directly with chained calls:
     * <pre>{@code
     * ConnectionOptions options = ConnectionOptions.builder()
     *     .addresses("localhost:9092")
     *     .codec(Codecs.string())
     *     .build();
     * }</pre>
     */
    public static class Builder {
        private List<String> addresses = new ArrayList<>();
        private ProtocolVersion version;
        private boolean secure = false;
        private TlsConfig tlsConfig;
        private String username;
        private String password;
        private String mechanism;
        private Codec codec;
        private Handler errorHandler;
        private OptionsContext context;
        private MqLogger logger = NoopLogger.INSTANCE;
        private boolean otel = false;

        /**
         * Applies the options in order.
         *
         * @param opts options, null entries are skipped
         * @return this builder
         */
        public Builder apply(Option... opts) {
            if (opts != null) {
                apply(Arrays.asList(opts));
            }
            return this;
        }

        public Builder apply(List<? extends Option> opts) {
            if (opts == null) {
                return this;
            }
            for (Option o : opts) {
                if (o != null) {
                    o.apply(this);
                }
            }
            return this;
        }

        /** Replaces the address list. */
        public Builder addresses(String... addresses) {
            return addresses(addresses == null ? null : Arrays.asList(addresses));
        }

        /** Replaces the address list. */
        public Builder addresses(List<String> addresses) {
            this.addresses = addresses == null ? new ArrayList<>() : new ArrayList<>(addresses);
            return this;
        }

        public Builder version(ProtocolVersion version) {
            this.version = version;
            return this;
        }

        /** Sets the secure flag only; TLS material is left untouched. */
        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        /** Sets TLS material only; the secure flag is left untouched. */
        public Builder tlsConfig(TlsConfig tlsConfig) {
            this.tlsConfig = tlsConfig;
            return this;
        }

        /** Sets username, password and SASL mechanism together. */
        public Builder sasl(String username, String password, String mechanism) {
            this.username = username;
            this.password = password;
            this.mechanism = mechanism;
            return this;
        }

        public Builder codec(Codec codec) {
            this.codec = codec;
            return this;
        }

        public Builder errorHandler(Handler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public Builder context(OptionsContext context) {
            this.context = context;
            return this;
        }

        /**
         * Merges one value into the context, starting from an empty context if none is set.
         */
        public Builder contextValue(Object key, Object value) {
            OptionsContext base = context != null ? context : OptionsContext.empty();
            this.context = base.withValue(key, value);
            return this;
        }

        /** Sets the logger; null leaves the current logger in place. */
        public Builder logger(MqLogger logger) {
            if (logger != null) {
                this.logger = logger;
            }
            return this;
        }

        public Builder otel(boolean otel) {
            this.otel = otel;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }
    }
}
