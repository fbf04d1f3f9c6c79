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

import com.firefly.mqkit.Handler;
import com.firefly.mqkit.config.ConnectionOptions;
import com.firefly.mqkit.config.Option;
import com.firefly.mqkit.config.Options;
import com.firefly.mqkit.config.TlsConfig;
import com.firefly.mqkit.logging.MqLogger;
import com.firefly.mqkit.logging.Slf4jLogger;
import com.firefly.mqkit.serialization.Codec;
import com.firefly.mqkit.serialization.Codecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration for mqkit connection options.
 *
 * <p>Enable by adding the following to your application.properties:
 * <pre>
 * mqkit.enabled=true
 * mqkit.addresses=localhost:9092
 * </pre>
 *
 * <p>The {@link ConnectionOptions} bean applies the options derived from
 * properties first, then the {@link Handler} bean named
 * {@value #ERROR_HANDLER_BEAN} as error hook, then every
 * {@link Option} bean in order. Application options therefore override
 * properties.
 */
@AutoConfiguration
@ConditionalOnClass(ConnectionOptions.class)
@ConditionalOnProperty(prefix = "mqkit", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MqKitProperties.class)
public class MqKitAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MqKitAutoConfiguration.class);

    /** Name of the {@link Handler} bean installed as connection error hook. */
    public static final String ERROR_HANDLER_BEAN = "mqKitErrorHandler";

    /**
     * Creates the logger handed to broker clients.
     *
     * @return SLF4J-backed logger
     */
    @Bean
    @ConditionalOnMissingBean
    public MqLogger mqKitLogger() {
        return Slf4jLogger.create();
    }

    /**
     * Resolves the codec named by {@code mqkit.codec}.
     *
     * @param properties the mqkit properties
     * @return the registered codec
     * @throws IllegalStateException if no codec is registered under that name
     */
    @Bean
    @ConditionalOnMissingBean
    public Codec mqKitCodec(MqKitProperties properties) {
        return Codecs.get(properties.getCodec())
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown codec '" + properties.getCodec() + "', registered codecs: " + Codecs.names()));
    }

    /**
     * Creates the connection options bean.
     *
     * @param properties   the mqkit properties
     * @param logger       logger bean
     * @param codec        codec bean
     * @param errorHandler optional error hook bean
     * @param customizers  application options, applied last
     * @return ConnectionOptions bean
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionOptions mqKitConnectionOptions(MqKitProperties properties,
                                                    MqLogger logger,
                                                    Codec codec,
                                                    @Qualifier(ERROR_HANDLER_BEAN) ObjectProvider<Handler> errorHandler,
                                                    ObjectProvider<Option> customizers) {
        List<Option> opts = new ArrayList<>(propertyOptions(properties));
        opts.add(Options.log(logger));
        opts.add(Options.codec(codec));
        errorHandler.ifAvailable(h -> opts.add(Options.errorHandler(h)));
        opts.addAll(customizers.orderedStream().collect(Collectors.toList()));

        ConnectionOptions options = ConnectionOptions.newOptions(opts);
        log.info("Created mqkit connection options for addresses: {}", options.getAddresses());
        return options;
    }

    static List<Option> propertyOptions(MqKitProperties properties) {
        List<Option> opts = new ArrayList<>();
        opts.add(Options.addresses(properties.getAddresses()));
        opts.add(Options.version(properties.getVersion()));
        opts.add(Options.secure(properties.isSecure()));
        opts.add(Options.otel(properties.isOtel()));

        MqKitProperties.Tls tls = properties.getTls();
        if (hasTlsMaterial(tls)) {
            opts.add(Options.tlsConfig(TlsConfig.builder()
                    .caFile(tls.getCaFile())
                    .certFile(tls.getCertFile())
                    .keyFile(tls.getKeyFile())
                    .serverName(tls.getServerName())
                    .insecureSkipVerify(tls.isInsecureSkipVerify())
                    .build()));
        }

        MqKitProperties.Sasl sasl = properties.getSasl();
        if (hasSasl(sasl)) {
            opts.add(Options.sasl(sasl.getUsername(), sasl.getPassword(), sasl.getMechanism()));
        }
        return opts;
    }

    private static boolean hasTlsMaterial(MqKitProperties.Tls tls) {
        return tls.getCaFile() != null || tls.getCertFile() != null || tls.getKeyFile() != null
                || tls.getServerName() != null || tls.isInsecureSkipVerify();
    }

    private static boolean hasSasl(MqKitProperties.Sasl sasl) {
        return sasl.getUsername() != null || sasl.getPassword() != null || sasl.getMechanism() != null;
    }
}
