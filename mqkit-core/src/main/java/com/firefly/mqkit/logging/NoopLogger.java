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
package com.firefly.mqkit.logging;

/**
 * Logger that discards everything. Used when no logger is configured.
 */
public final class NoopLogger implements MqLogger {

    public static final NoopLogger INSTANCE = new NoopLogger();

    private NoopLogger() {
    }

    @Override
    public void info(Object... args) {
    }

    @Override
    public void warn(Object... args) {
    }

    @Override
    public void error(Object... args) {
    }

    @Override
    public void errorf(String format, Object... args) {
    }

    @Override
    public void infof(String format, Object... args) {
    }
}
