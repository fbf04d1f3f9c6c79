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
package com.firefly.mqkit.producer;

import com.firefly.mqkit.context.OptionsContext;

import java.util.Arrays;
import java.util.List;

/**
 * Settings of a single publish call. Built fresh for every call and
 * discarded when the call returns.
 *
 * <p>Example:
 * <pre>{@code
 * broker.publish("orders", message,
 *     PublishOptions.publishContextWithValue(ContextKeys.DEADLINE, Instant.now().plusSeconds(2)));
 * }</pre>
 */
public final class PublishOptions {

    private final OptionsContext context;

    private PublishOptions(Builder builder) {
        this.context = builder.context;
    }

    public static PublishOptions newPublishOptions(PublishOption... opts) {
        return new Builder().apply(opts).build();
    }

    public static PublishOptions newPublishOptions(List<? extends PublishOption> opts) {
        return new Builder().apply(opts).build();
    }

    /** Context of the call, or null when none was attached. */
    public OptionsContext getContext() { return context; }

    public OptionsContext contextOrEmpty() {
        return context != null ? context : OptionsContext.empty();
    }

    @Override
    public String toString() {
        return "PublishOptions{context=" + context + "}";
    }

    public static PublishOption publishContext(OptionsContext ctx) {
        return o -> o.context(ctx);
    }

    public static PublishOption publishContextWithValue(Object key, Object value) {
        return o -> o.contextValue(key, value);
    }

    public static class Builder {
        private OptionsContext context;

        public Builder apply(PublishOption... opts) {
            if (opts != null) {
                apply(Arrays.asList(opts));
            }
            return this;
        }

        public Builder apply(List<? extends PublishOption> opts) {
            if (opts == null) {
                return this;
            }
            for (PublishOption o : opts) {
                if (o != null) {
                    o.apply(this);
                }
            }
            return this;
        }

        public Builder context(OptionsContext context) {
            this.context = context;
            return this;
        }

        public Builder contextValue(Object key, Object value) {
            OptionsContext base = context != null ? context : OptionsContext.empty();
            this.context = base.withValue(key, value);
            return this;
        }

        public PublishOptions build() {
            return new PublishOptions(this);
        }
    }
}
