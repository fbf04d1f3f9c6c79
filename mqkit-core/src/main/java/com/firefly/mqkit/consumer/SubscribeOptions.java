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
package com.firefly.mqkit.consumer;

import com.firefly.mqkit.context.OptionsContext;

import java.util.Arrays;
import java.util.List;

/**
 * Settings of one subscription.
 *
 * <p>Built by {@link #newSubscribeOptions(SubscribeOption...)}: auto-ack is
 * switched on first, then the options are applied in order. The result is
 * immutable and lives as long as the subscription.
 */
public final class SubscribeOptions {

    private final boolean autoAck;
    private final String queue;
    private final int retryNum;
    private final Strategy strategy;
    private final OptionsContext context;

    private SubscribeOptions(Builder builder) {
        this.autoAck = builder.autoAck;
        this.queue = builder.queue;
        this.retryNum = builder.retryNum;
        this.strategy = builder.strategy;
        this.context = builder.context;
    }

    public static SubscribeOptions newSubscribeOptions(SubscribeOption... opts) {
        return new Builder().apply(opts).build();
    }

    public static SubscribeOptions newSubscribeOptions(List<? extends SubscribeOption> opts) {
        return new Builder().apply(opts).build();
    }

    /**
     * Whether a message counts as received once its handler returns without error.
     * Defaults to true; when false the handler acknowledges explicitly.
     */
    public boolean isAutoAck() { return autoAck; }

    /**
     * Queue group name. Subscribers with the same queue name share a subscription
     * and each receives a subset of the messages. Empty means exclusive.
     */
    public String getQueue() { return queue; }

    /** How many times a failed message is retried. 0 disables retries. */
    public int getRetryNum() { return retryNum; }

    /** Failure-handling strategy, or null when none was declared. */
    public Strategy getStrategy() { return strategy; }

    public OptionsContext getContext() { return context; }

    public boolean isSharedSubscription() {
        return !queue.isEmpty();
    }

    public OptionsContext contextOrEmpty() {
        return context != null ? context : OptionsContext.empty();
    }

    @Override
    public String toString() {
        return "SubscribeOptions{autoAck=" + autoAck
                + ", queue='" + queue + '\''
                + ", retryNum=" + retryNum
                + ", strategy=" + (strategy != null ? strategy.strategy() : null)
                + ", context=" + context + "}";
    }

    // =========================================================================
    // Options
    // =========================================================================

    /**
     * Disables auto acking of messages after they have been handled.
     */
    public static SubscribeOption disableAutoAck() {
        return o -> o.autoAck(false);
    }

    /**
     * Sets the name of the queue group to share messages on.
     */
    public static SubscribeOption queue(String name) {
        return o -> o.queue(name);
    }

    public static SubscribeOption subscribeRetryNum(int retryNum) {
        return o -> o.retryNum(retryNum);
    }

    public static SubscribeOption subscribeStrategy(Strategy strategy) {
        return o -> o.strategy(strategy);
    }

    public static SubscribeOption subscribeContext(OptionsContext ctx) {
        return o -> o.context(ctx);
    }

    public static SubscribeOption subscribeContextWithValue(Object key, Object value) {
        return o -> o.contextValue(key, value);
    }

    /**
     * Mutable settings record the {@link SubscribeOption}s are applied to.
     */
    public static class Builder {
        private boolean autoAck = true;
        private String queue = "";
        private int retryNum = 0;
        private Strategy strategy;
        private OptionsContext context;

        public Builder apply(SubscribeOption... opts) {
            if (opts != null) {
                apply(Arrays.asList(opts));
            }
            return this;
        }

        public Builder apply(List<? extends SubscribeOption> opts) {
            if (opts == null) {
                return this;
            }
            for (SubscribeOption o : opts) {
                if (o != null) {
                    o.apply(this);
                }
            }
            return this;
        }

        public Builder autoAck(boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        /** Sets the queue group; null is stored as the empty (exclusive) name. */
        public Builder queue(String queue) {
            this.queue = queue == null ? "" : queue;
            return this;
        }

        /** Records the retry count as given; negative values are rejected by {@code OptionsValidator}. */
        public Builder retryNum(int retryNum) {
            this.retryNum = retryNum;
            return this;
        }

        public Builder strategy(Strategy strategy) {
            this.strategy = strategy;
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

        public SubscribeOptions build() {
            return new SubscribeOptions(this);
        }
    }
}
