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

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in codecs and a name-keyed codec registry.
 *
 * <p>The registry starts with {@code json}, {@code string} and {@code bytes}.
 * Avro and Protobuf codecs need a schema or a message type, so they are created
 * through {@link #avro(String)} and {@link #protobuf(com.google.protobuf.Message)}
 * and may be registered under a name of the caller's choosing.
 */
public final class Codecs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, Codec> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(json());
        register(string());
        register(bytes());
    }

    private Codecs() {
    }

    public static void register(Codec codec) {
        register(codec.name(), codec);
    }

    public static void register(String name, Codec codec) {
        REGISTRY.put(name, codec);
    }

    public static Optional<Codec> get(String name) {
        return Optional.ofNullable(name == null ? null : REGISTRY.get(name));
    }

    public static Set<String> names() {
        return Set.copyOf(REGISTRY.keySet());
    }

    public static Codec json() {
        return json(MAPPER);
    }

    public static Codec json(ObjectMapper mapper) {
        return new Codec() {
            @Override
            public byte[] marshal(Object value) {
                if (value == null) return null;
                try {
                    return mapper.writeValueAsBytes(value);
                } catch (IOException e) {
                    throw new CodecException("Error serializing JSON", e);
                }
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                if (data == null) return null;
                try {
                    return mapper.readValue(data, type);
                } catch (IOException e) {
                    throw new CodecException("Error deserializing JSON", e);
                }
            }

            @Override
            public String name() {
                return "json";
            }
        };
    }

    public static Codec string() {
        return new Codec() {
            @Override
            public byte[] marshal(Object value) {
                return value == null ? null : value.toString().getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                if (data == null) return null;
                if (!type.isAssignableFrom(String.class)) {
                    throw new CodecException("String codec cannot decode into " + type.getName());
                }
                return type.cast(new String(data, StandardCharsets.UTF_8));
            }

            @Override
            public String name() {
                return "string";
            }
        };
    }

    public static Codec bytes() {
        return new Codec() {
            @Override
            public byte[] marshal(Object value) {
                if (value == null) return null;
                if (value instanceof byte[]) {
                    return (byte[]) value;
                }
                throw new CodecException("Bytes codec requires byte[], got " + value.getClass().getName());
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                if (data == null) return null;
                if (!type.isAssignableFrom(byte[].class)) {
                    throw new CodecException("Bytes codec cannot decode into " + type.getName());
                }
                return type.cast(data);
            }

            @Override
            public String name() {
                return "bytes";
            }
        };
    }

    /**
     * Codec for Avro generic records written with the binary encoding.
     *
     * @param schemaStr Avro schema as JSON
     * @return avro codec
     */
    public static Codec avro(String schemaStr) {
        org.apache.avro.Schema schema = new org.apache.avro.Schema.Parser().parse(schemaStr);
        return new Codec() {
            @Override
            public byte[] marshal(Object value) {
                if (value == null) return null;
                try {
                    org.apache.avro.io.DatumWriter<Object> writer = new org.apache.avro.generic.GenericDatumWriter<>(schema);
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    org.apache.avro.io.Encoder encoder = org.apache.avro.io.EncoderFactory.get().binaryEncoder(out, null);
                    writer.write(value, encoder);
                    encoder.flush();
                    return out.toByteArray();
                } catch (IOException | RuntimeException e) {
                    throw new CodecException("Error serializing Avro", e);
                }
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                if (data == null) return null;
                try {
                    org.apache.avro.io.DatumReader<Object> reader = new org.apache.avro.generic.GenericDatumReader<>(schema);
                    org.apache.avro.io.Decoder decoder = org.apache.avro.io.DecoderFactory.get().binaryDecoder(data, null);
                    return type.cast(reader.read(null, decoder));
                } catch (IOException | ClassCastException e) {
                    throw new CodecException("Error deserializing Avro", e);
                }
            }

            @Override
            public String name() {
                return "avro";
            }
        };
    }

    /**
     * Codec for one Protobuf message type.
     *
     * @param defaultInstance default instance of the message type to decode into
     * @return protobuf codec
     */
    public static Codec protobuf(com.google.protobuf.Message defaultInstance) {
        return new Codec() {
            @Override
            public byte[] marshal(Object value) {
                if (value == null) return null;
                if (value instanceof com.google.protobuf.Message) {
                    return ((com.google.protobuf.Message) value).toByteArray();
                }
                throw new CodecException("Protobuf serialization requires a com.google.protobuf.Message");
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                if (data == null) return null;
                try {
                    return type.cast(defaultInstance.newBuilderForType().mergeFrom(data).build());
                } catch (com.google.protobuf.InvalidProtocolBufferException | ClassCastException e) {
                    throw new CodecException("Error deserializing Protobuf", e);
                }
            }

            @Override
            public String name() {
                return "protobuf";
            }
        };
    }
}
