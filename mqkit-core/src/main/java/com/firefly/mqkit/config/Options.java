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
import com.firefly.mqkit.serialization.Codec;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for connection-level {@link Option}s.
 *
 * <p>Each option changes one concern. Options are applied in the order given to
 * {@link ConnectionOptions#newOptions(Option...)}, later ones overriding earlier
 * ones that touch the same field.
 */
public final class Options {

    private Options() {
    }

    /**
     * Sets the broker addresses, replacing any set earlier. The addresses are
     * copied when the option is created.
     */
    public static Option addresses(String... addrs) {
        String[] copy = addrs == null ? null : addrs.clone();
        return o -> o.addresses(copy);
    }

    public static Option addresses(List<String> addrs) {
        List<String> copy = addrs == null ? null : new ArrayList<>(addrs);
        return o -> o.addresses(copy);
    }

    /**
     * Username, password and mechanism needed by SASL auth, set as one unit.
     */
    public static Option sasl(String user, String pass, String mechanism) {
        return o -> o.sasl(user, pass, mechanism);
    }

    /**
     * Sets the broker protocol version used for feature negotiation.
     */
    public static Option version(ProtocolVersion version) {
        return o -> o.version(version);
    }

    /**
     * Parses and sets the protocol version. A null or blank token clears it.
     */
    public static Option version(String version) {
        return o -> o.version(version == null || version.isBlank() ? null : ProtocolVersion.of(version));
    }

    /**
     * Secure communication with the broker. Does not supply TLS material.
     */
    public static Option secure(boolean b) {
        return o -> o.secure(b);
    }

    /**
     * TLS material for the handshake. Does not enable secure communication.
     */
    public static Option tlsConfig(TlsConfig t) {
        return o -> o.tlsConfig(t);
    }

    /**
     * Codec used to encode and decode message payloads.
     */
    public static Option codec(Codec c) {
        return o -> o.codec(c);
    }

    /**
     * Handler invoked when message processing fails unrecoverably.
     */
    public static Option errorHandler(Handler h) {
        return o -> o.errorHandler(h);
    }

    /**
     * Replaces the carried context.
     */
    public static Option context(OptionsContext ctx) {
        return o -> o.context(ctx);
    }

    /**
     * Adds one value to the carried context.
     */
    public static Option contextWithValue(Object key, Object value) {
        return o -> o.contextValue(key, value);
    }

    /**
     * Sets the logger. A null logger is ignored.
     */
    public static Option log(MqLogger log) {
        return o -> o.logger(log);
    }

    /**
     * Enables or disables OpenTelemetry tracing.
     */
    public static Option otel(boolean b) {
        return o -> o.otel(b);
    }
}
