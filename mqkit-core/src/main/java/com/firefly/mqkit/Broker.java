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
package com.firefly.mqkit;

import com.firefly.mqkit.config.ConnectionOptions;
import com.firefly.mqkit.consumer.SubscribeOption;
import com.firefly.mqkit.exception.MqKitException;
import com.firefly.mqkit.producer.PublishOption;

/**
 * Contract implemented by broker clients that consume mqkit options.
 *
 * <p>Implementations receive a frozen {@link ConnectionOptions} and must honor
 * its fields: use the TLS material only when the secure flag is set,
 * authenticate with SASL when credentials are present, encode payloads with
 * the configured codec and route unrecoverable processing errors to the error
 * hook when one is set. Option combinations are validated here, at connect and
 * subscribe time, typically through {@link com.firefly.mqkit.config.OptionsValidator}.
 *
 * <p>Example usage:
 * <pre>{@code
 * Broker broker = new KafkaBroker(ConnectionOptions.newOptions(
 *     Options.addresses("kafka-1:9092", "kafka-2:9092"),
 *     Options.codec(Codecs.json())));
 * broker.connect();
 * broker.subscribe("orders", handler,
 *     SubscribeOptions.queue("billing"),
 *     SubscribeOptions.subscribeRetryNum(3),
 *     SubscribeOptions.subscribeStrategy(Strategies.RETRY));
 * }</pre>
 */
public interface Broker extends AutoCloseable {

    ConnectionOptions options();

    void connect() throws MqKitException;

    void publish(String topic, Message message, PublishOption... opts) throws MqKitException;

    Subscription subscribe(String topic, Handler handler, SubscribeOption... opts) throws MqKitException;

    @Override
    void close();
}
