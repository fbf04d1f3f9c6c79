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
package com.firefly.mqkit.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProtocolVersionTest {

    @Test
    void testNumericOrdering() {
        assertThat(ProtocolVersion.of("2.10.0")).isGreaterThan(ProtocolVersion.of("2.9.1"));
        assertThat(ProtocolVersion.of("3.0.0")).isGreaterThan(ProtocolVersion.of("2.99.99"));
        assertThat(ProtocolVersion.of("2.8")).isEqualByComparingTo(ProtocolVersion.of("2.8.0"));
    }

    @Test
    void testIsAtLeast() {
        ProtocolVersion v = ProtocolVersion.of("2.8.0");

        assertThat(v.isAtLeast(ProtocolVersion.of("2.8.0"))).isTrue();
        assertThat(v.isAtLeast(ProtocolVersion.of("1.0.0"))).isTrue();
        assertThat(v.isAtLeast(ProtocolVersion.of("3.0.0"))).isFalse();
    }

    @Test
    void testOpaqueSegments() {
        ProtocolVersion v = ProtocolVersion.of("2.8.0-rc1");

        assertThat(v.value()).isEqualTo("2.8.0-rc1");
        assertThat(v.toString()).isEqualTo("2.8.0-rc1");
    }

    @Test
    void testTrimmedAndBlankRejected() {
        assertThat(ProtocolVersion.of(" 1.0.0 ").value()).isEqualTo("1.0.0");
        assertThatThrownBy(() -> ProtocolVersion.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
