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
package com.firefly.mqkit.serialization;

/**
 * Message codec carried by the connection options. Broker clients use it to
 * turn application values into message payloads and back.
 */
public interface Codec {

    byte[] marshal(Object value);

    <T> T unmarshal(byte[] data, Class<T> type);

    /**
     * @return short name of the encoding, e.g. {@code "json"}
     */
    String name();
}
