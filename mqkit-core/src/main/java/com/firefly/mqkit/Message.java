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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * A message as handed to a {@link Handler} or passed to {@link Broker#publish}.
 *
 * <p>Key and payload are copied on construction and compared by content.
 *
 * @param topic   topic name
 * @param key     optional partitioning key
 * @param payload encoded body
 * @param headers message headers, never null
 */
public record Message(String topic, byte[] key, byte[] payload, Map<String, String> headers) {

    public Message {
        key = key == null ? null : key.clone();
        payload = payload == null ? null : payload.clone();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static Message of(String topic, byte[] payload) {
        return new Message(topic, null, payload, Map.of());
    }

    public String payloadAsString() {
        return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
    }

    public String keyAsString() {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message other = (Message) o;
        return Objects.equals(topic, other.topic)
                && Arrays.equals(key, other.key)
                && Arrays.equals(payload, other.payload)
                && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, headers);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "Message{topic=" + topic
                + ", key=" + keyAsString()
                + ", payloadBytes=" + (payload == null ? 0 : payload.length)
                + ", headers=" + headers + "}";
    }
}
