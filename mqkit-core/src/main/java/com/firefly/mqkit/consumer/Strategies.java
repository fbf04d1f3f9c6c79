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

import java.util.Objects;
import java.util.Optional;

/**
 * Registry of failure-handling strategies.
 *
 * <p>Example:
 * <pre>{@code
 * SubscribeOptions options = SubscribeOptions.newSubscribeOptions(
 *     SubscribeOptions.subscribeRetryNum(3),
 *     SubscribeOptions.subscribeStrategy(Strategies.RETRY));
 *
 * Strategy parking = Strategies.custom("park");
 * }</pre>
 */
public final class Strategies {

    public static final Strategy RETRY = BuiltinStrategy.RETRY;
    public static final Strategy DO_ONCE = BuiltinStrategy.DO_ONCE;
    public static final Strategy SEND_BACK = BuiltinStrategy.SEND_BACK;

    private Strategies() {
    }

    /**
     * Creates a custom strategy.
     *
     * @param identity strategy identity, must not be blank
     * @return strategy reporting {@code identity}
     * @throws IllegalArgumentException if {@code identity} is blank
     */
    public static Strategy custom(String identity) {
        Objects.requireNonNull(identity, "identity");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("Strategy identity must not be blank");
        }
        return new CustomStrategy(identity);
    }

    /**
     * Resolves a built-in strategy by identity.
     */
    public static Optional<Strategy> builtin(String identity) {
        return BuiltinStrategy.fromIdentity(identity).map(Strategy.class::cast);
    }

    /**
     * Resolves a built-in strategy by identity, falling back to a custom one.
     */
    public static Strategy of(String identity) {
        return builtin(identity).orElseGet(() -> custom(identity));
    }

    public static boolean isBuiltin(Strategy strategy) {
        return strategy != null && BuiltinStrategy.fromIdentity(strategy.strategy()).isPresent();
    }

    /**
     * Strategies are compared by identity string, so a custom {@code "retry"}
     * is the same kind as {@link #RETRY}.
     */
    public static boolean sameKind(Strategy a, Strategy b) {
        if (a == null || b == null) {
            return a == b;
        }
        return Objects.equals(a.strategy(), b.strategy());
    }

    private record CustomStrategy(String identity) implements Strategy {

        @Override
        public String strategy() {
            return identity;
        }

        @Override
        public String toString() {
            return identity;
        }
    }
}
