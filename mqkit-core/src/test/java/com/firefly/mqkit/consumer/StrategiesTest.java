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

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class StrategiesTest {

    @Test
    void testBuiltinIdentities() {
        assertThat(Strategies.RETRY.strategy()).isEqualTo("retry");
        assertThat(Strategies.DO_ONCE.strategy()).isEqualTo("do_once");
        assertThat(Strategies.SEND_BACK.strategy()).isEqualTo("send_back");
    }

    @Test
    void testBuiltinIdentitiesAreDistinct() {
        Set<String> identities = Stream.of(Strategies.RETRY, Strategies.DO_ONCE, Strategies.SEND_BACK)
                .map(Strategy::strategy)
                .collect(Collectors.toSet());

        assertThat(identities).hasSize(3);
        assertThat(Strategies.sameKind(Strategies.RETRY, Strategies.DO_ONCE)).isFalse();
    }

    @Test
    void testBuiltinLookup() {
        assertThat(Strategies.builtin("send_back")).containsSame(Strategies.SEND_BACK);
        assertThat(Strategies.builtin("park")).isEmpty();
        assertThat(BuiltinStrategy.fromIdentity("do_once")).contains(BuiltinStrategy.DO_ONCE);
    }

    @Test
    void testOfFallsBackToCustom() {
        assertThat(Strategies.of("retry")).isSameAs(Strategies.RETRY);

        Strategy custom = Strategies.of("park");
        assertThat(custom.strategy()).isEqualTo("park");
        assertThat(Strategies.isBuiltin(custom)).isFalse();
    }

    @Test
    void testCustomRejectsBlankIdentity() {
        assertThatThrownBy(() -> Strategies.custom(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Strategies.custom("   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Strategies.custom(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testSameKindComparesIdentity() {
        Strategy lambdaRetry = () -> "retry";

        assertThat(Strategies.sameKind(lambdaRetry, Strategies.RETRY)).isTrue();
        assertThat(Strategies.sameKind(Strategies.custom("park"), Strategies.custom("park"))).isTrue();
        assertThat(Strategies.sameKind(null, null)).isTrue();
        assertThat(Strategies.sameKind(Strategies.RETRY, null)).isFalse();
        assertThat(Strategies.isBuiltin(lambdaRetry)).isTrue();
    }
}
