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
package com.firefly.mqkit.spring;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot configuration properties for mqkit connection options.
 *
 * <p>Example application.properties:
 * <pre>
 * mqkit.addresses=kafka-1:9092,kafka-2:9092
 * mqkit.version=2.8.0
 * mqkit.secure=true
 * mqkit.tls.ca-file=/path/to/ca.crt
 * mqkit.sasl.username=svc-orders
 * mqkit.sasl.password=secret
 * mqkit.sasl.mechanism=SCRAM-SHA-512
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "mqkit")
public class MqKitProperties {

    /**
     * Whether the mqkit auto-configuration is enabled.
     */
    private boolean enabled = true;

    /**
     * Broker addresses (host:port).
     */
    private List<String> addresses = new ArrayList<>();

    /**
     * Broker protocol version, e.g. 2.8.0.
     */
    private String version;

    /**
     * Enable secure transport. TLS material alone does not enable it.
     */
    private boolean secure = false;

    /**
     * Enable OpenTelemetry tracing.
     */
    private boolean otel = false;

    /**
     * Name of a codec registered in Codecs (json, string, bytes).
     */
    private String codec = "json";

    private Tls tls = new Tls();

    private Sasl sasl = new Sasl();

    /**
     * TLS material.
     */
    @Data
    public static class Tls {

        /**
         * Path to CA certificate file.
         */
        private String caFile;

        /**
         * Path to client certificate file (for mTLS).
         */
        private String certFile;

        /**
         * Path to client key file (for mTLS).
         */
        private String keyFile;

        /**
         * Expected server name for SNI and verification.
         */
        private String serverName;

        /**
         * Skip server certificate verification (testing only).
         */
        private boolean insecureSkipVerify = false;
    }

    /**
     * SASL credentials.
     */
    @Data
    public static class Sasl {

        private String username;

        private String password;

        /**
         * SASL mechanism, e.g. PLAIN or SCRAM-SHA-512.
         */
        private String mechanism;
    }
}
