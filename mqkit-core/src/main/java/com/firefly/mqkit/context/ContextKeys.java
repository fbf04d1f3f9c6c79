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

/**
 * Keys recognized by mqkit and by broker clients built on it.
 */
public final class ContextKeys {

    /** Point in time after which the operation should be abandoned. */
    public static final ContextKey<Instant> DEADLINE = ContextKey.of("deadline", Instant.class);

    /** W3C {@code traceparent} of the span the operation belongs to. */
    public static final ContextKey<String> TRACE_PARENT = ContextKey.of("traceparent", String.class);

    private ContextKeys() {
    }
}
