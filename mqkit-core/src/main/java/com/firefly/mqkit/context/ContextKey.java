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

import java.util.Objects;

/**
 * Typed key for values carried in an {@link OptionsContext}.
 *
 * <p>Two keys are equal when both their name and value type match.
 *
 * @param name key name
 * @param type type of the values stored under this key
 * @param <T>  value type
 */
public record ContextKey<T>(String name, Class<T> type) {

    public ContextKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static <T> ContextKey<T> of(String name, Class<T> type) {
        return new ContextKey<>(name, type);
    }

    @Override
    public String toString() {
        return name + "<" + type.getSimpleName() + ">";
    }
}
