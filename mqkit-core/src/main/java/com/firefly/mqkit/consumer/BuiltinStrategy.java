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

import java.util.Optional;

/**
 * Strategies that ship with mqkit.
 */
public enum BuiltinStrategy implements Strategy {

    /** Re-deliver the message up to the subscription's retry count before giving up. */
    RETRY("retry"),

    /** Deliver at most once; a failed message is not re-delivered. */
    DO_ONCE("do_once"),

    /** Requeue a failed message to its origin topic for later reprocessing. */
    SEND_BACK("send_back");

    private final String identity;

    BuiltinStrategy(String identity) {
        this.identity = identity;
    }

    @Override
    public String strategy() {
        return identity;
    }

    /**
     * Looks up a built-in strategy by identity.
     *
     * @param identity identity string
     * @return the built-in strategy, or empty if none matches
     */
    public static Optional<BuiltinStrategy> fromIdentity(String identity) {
        for (BuiltinStrategy s : values()) {
            if (s.identity.equals(identity)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return identity;
    }
}
