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

import com.firefly.mqkit.consumer.Strategy;
import com.firefly.mqkit.consumer.SubscribeOptions;
import com.firefly.mqkit.exception.MqKitException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks broker clients run when they consume options.
 *
 * <p>Options are never validated while they are built. A broker client calls
 * {@link #validate(ConnectionOptions)} before opening a session and
 * {@link #validate(SubscribeOptions)} before registering a subscription, so a
 * bad combination fails fast with a descriptive {@link MqKitException}.
 */
public final class OptionsValidator {

    private OptionsValidator() {
    }

    /**
     * Validates connection options.
     *
     * <ul>
     *   <li>at least one address is configured</li>
     *   <li>a codec is configured</li>
     *   <li>SASL username, password and mechanism are all set or all empty</li>
     * </ul>
     *
     * TLS material without the secure flag is not an error; it is ignored and a
     * warning goes to the configured logger.
     *
     * @param options options to check
     * @throws MqKitException on the first violated rule
     */
    public static void validate(ConnectionOptions options) throws MqKitException {
        if (options.getAddresses().isEmpty()) {
            throw MqKitException.noAddresses();
        }
        if (options.getCodec() == null) {
            throw MqKitException.missingCodec();
        }

        List<String> missing = new ArrayList<>();
        if (ConnectionOptions.isEmpty(options.getUsername())) missing.add("username");
        if (ConnectionOptions.isEmpty(options.getPassword())) missing.add("password");
        if (ConnectionOptions.isEmpty(options.getMechanism())) missing.add("mechanism");
        if (!missing.isEmpty() && missing.size() < 3) {
            throw MqKitException.incompleteSasl(String.join(", ", missing));
        }

        if (!options.isSecure() && options.getTlsConfig() != null) {
            options.getLogger().warn("TLS material is configured but secure transport is disabled;",
                    "the material will be ignored");
        }
    }

    /**
     * Validates subscribe options: the retry count is not negative and a declared
     * strategy has a non-empty identity.
     *
     * @param options options to check
     * @throws MqKitException on the first violated rule
     */
    public static void validate(SubscribeOptions options) throws MqKitException {
        if (options.getRetryNum() < 0) {
            throw MqKitException.negativeRetryNum(options.getRetryNum());
        }
        Strategy strategy = options.getStrategy();
        if (strategy != null) {
            String identity = strategy.strategy();
            if (identity == null || identity.isEmpty()) {
                throw MqKitException.blankStrategy();
            }
        }
    }
}
