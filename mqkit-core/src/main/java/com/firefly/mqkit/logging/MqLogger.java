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
 * Logging capability used by broker clients built on mqkit.
 *
 * <p>Plain variants accept any loggable values; formatted variants accept a
 * {@link String#format(String, Object...)} pattern followed by its arguments.
 */
public interface MqLogger {

    void info(Object... args);

    void warn(Object... args);

    void error(Object... args);

    void errorf(String format, Object... args);

    void infof(String format, Object... args);
}
