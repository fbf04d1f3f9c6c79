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

import java.util.Objects;

/**
 * Broker protocol version token, e.g. {@code "2.8.0"}.
 *
 * <p>The token is opaque to mqkit; broker clients use it for feature
 * negotiation. Versions compare segment by segment, numerically where both
 * segments are numbers, so {@code 2.10.0} is newer than {@code 2.9.1}.
 *
 * @param value version token as written
 */
public record ProtocolVersion(String value) implements Comparable<ProtocolVersion> {

    public ProtocolVersion {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Protocol version must not be blank");
        }
        value = value.trim();
    }

    public static ProtocolVersion of(String value) {
        return new ProtocolVersion(value);
    }

    public boolean isAtLeast(ProtocolVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ProtocolVersion other) {
        String[] mine = value.split("\\.");
        String[] theirs = other.value.split("\\.");
        int length = Math.max(mine.length, theirs.length);
        for (int i = 0; i < length; i++) {
            String a = i < mine.length ? mine[i] : "0";
            String b = i < theirs.length ? theirs[i] : "0";
            int cmp = compareSegment(a, b);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int compareSegment(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty() || s.length() > 18) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return value;
    }
}
