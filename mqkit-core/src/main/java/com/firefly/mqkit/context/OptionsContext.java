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
package com.firefly.mqkit.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable bag of out-of-band values attached to connection, publish or
 * subscribe options.
 *
 * <p>Recognized values use the typed keys from {@link ContextKeys}; callers may
 * also attach values under keys of their own. Looking up a key that is not
 * present is a normal outcome and yields {@link Optional#empty()}.
 *
 * <p>mqkit only carries the context. Deadlines and other values are interpreted
 * by the broker client.
 *
 * <pre>{@code
 * OptionsContext ctx = OptionsContext.empty()
 *     .withValue(ContextKeys.DEADLINE, Instant.now().plusSeconds(5))
 *     .withValue("tenant", "acme");
 * }</pre>
 */
public final class OptionsContext {

    private static final OptionsContext EMPTY = new OptionsContext(Collections.emptyMap());

    private final Map<Object, Object> values;

    private OptionsContext(Map<Object, Object> values) {
        this.values = values;
    }

    /**
     * Returns the empty base context.
     *
     * @return context without values
     */
    public static OptionsContext empty() {
        return EMPTY;
    }

    /**
     * Returns a new context holding every value of this one plus {@code key -> value}.
     * An existing value under the same key is shadowed. This context is not modified.
     *
     * @param key   key, not null
     * @param value value, may be null
     * @return derived context
     */
    public OptionsContext withValue(Object key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<Object, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new OptionsContext(Collections.unmodifiableMap(copy));
    }

    /**
     * Typed variant of {@link #withValue(Object, Object)}.
     */
    public <T> OptionsContext withValue(ContextKey<T> key, T value) {
        return withValue((Object) key, value);
    }

    /**
     * Looks up a value.
     *
     * @param key key to look up
     * @return the value, or empty when the key is absent or maps to null
     */
    public Optional<Object> get(Object key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Looks up a value stored under a typed key.
     *
     * @param key typed key
     * @param <T> value type
     * @return the value, or empty when absent or of another type
     */
    public <T> Optional<T> get(ContextKey<T> key) {
        Object value = values.get(key);
        if (key.type().isInstance(value)) {
            return Optional.of(key.type().cast(value));
        }
        return Optional.empty();
    }

    public boolean containsKey(Object key) {
        return values.containsKey(key);
    }

    public Optional<Instant> deadline() {
        return get(ContextKeys.DEADLINE);
    }

    public Optional<String> traceParent() {
        return get(ContextKeys.TRACE_PARENT);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((OptionsContext) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "OptionsContext" + values;
    }
}
