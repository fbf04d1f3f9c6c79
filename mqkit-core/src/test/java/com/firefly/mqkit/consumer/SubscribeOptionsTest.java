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

import com.firefly.mqkit.context.ContextKeys;
import com.firefly.mqkit.context.OptionsContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SubscribeOptionsTest {

    @Test
    void testDefaults() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions();

        assertThat(options.isAutoAck()).isTrue();
        assertThat(options.getQueue()).isEmpty();
        assertThat(options.getRetryNum()).isZero();
        assertThat(options.getStrategy()).isNull();
        assertThat(options.getContext()).isNull();
        assertThat(options.isSharedSubscription()).isFalse();
    }

    @Test
    void testDisableAutoAckLeavesOtherDefaults() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(SubscribeOptions.disableAutoAck());

        assertThat(options.isAutoAck()).isFalse();
        assertThat(options.getQueue()).isEmpty();
        assertThat(options.getRetryNum()).isZero();
        assertThat(options.getStrategy()).isNull();
        assertThat(options.getContext()).isNull();
    }

    @Test
    void testSharedSubscriptionWithRetry() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.queue("orders"),
                SubscribeOptions.subscribeRetryNum(3),
                SubscribeOptions.subscribeStrategy(Strategies.RETRY));

        assertThat(options.isAutoAck()).isTrue();
        assertThat(options.getQueue()).isEqualTo("orders");
        assertThat(options.isSharedSubscription()).isTrue();
        assertThat(options.getRetryNum()).isEqualTo(3);
        assertThat(options.getStrategy().strategy()).isEqualTo("retry");
    }

    @Test
    void testLastWriteWins() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(List.of(
                SubscribeOptions.queue("a"),
                SubscribeOptions.subscribeStrategy(Strategies.RETRY),
                SubscribeOptions.subscribeRetryNum(5),
                SubscribeOptions.queue("b"),
                SubscribeOptions.subscribeStrategy(Strategies.SEND_BACK),
                SubscribeOptions.subscribeRetryNum(1)));

        assertThat(options.getQueue()).isEqualTo("b");
        assertThat(options.getStrategy()).isSameAs(Strategies.SEND_BACK);
        assertThat(options.getRetryNum()).isEqualTo(1);
    }

    @Test
    void testNullQueueMeansExclusive() {
        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.queue("orders"),
                SubscribeOptions.queue(null));

        assertThat(options.getQueue()).isEmpty();
        assertThat(options.isSharedSubscription()).isFalse();
    }

    @Test
    void testCustomStrategy() {
        Strategy parking = Strategies.custom("park");

        SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeStrategy(parking));

        assertThat(options.getStrategy().strategy()).isEqualTo("park");
    }

    @Test
    void testContextOptions() {
        SubscribeOptions merged = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeContextWithValue(ContextKeys.TRACE_PARENT, "00-1-2-01"),
                SubscribeOptions.subscribeContextWithValue("tenant", "acme"));

        assertThat(merged.getContext().traceParent()).contains("00-1-2-01");
        assertThat(merged.getContext().get("tenant")).contains("acme");

        OptionsContext replacement = OptionsContext.empty().withValue("k", "v");
        SubscribeOptions replaced = SubscribeOptions.newSubscribeOptions(
                SubscribeOptions.subscribeContextWithValue("tenant", "acme"),
                SubscribeOptions.subscribeContext(replacement));

        assertThat(replaced.getContext()).isSameAs(replacement);
        assertThat(replaced.contextOrEmpty().get("tenant")).isEmpty();
    }

    @Test
    void testContextOrEmpty() {
        assertThat(SubscribeOptions.newSubscribeOptions().contextOrEmpty().isEmpty()).isTrue();
    }
}
