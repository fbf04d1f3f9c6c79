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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link MqLogger} backed by SLF4J.
 *
 * <p>Example:
 * <pre>{@code
 * ConnectionOptions options = ConnectionOptions.newOptions(
 *     Options.addresses("localhost:9092"),
 *     Options.log(Slf4jLogger.create()));
 * }</pre>
 */
public class Slf4jLogger implements MqLogger {

    /** Category used by {@link #create()}. */
    public static final String DEFAULT_CATEGORY = "com.firefly.mqkit";

    private final Logger delegate;

    public Slf4jLogger(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static Slf4jLogger create() {
        return new Slf4jLogger(LoggerFactory.getLogger(DEFAULT_CATEGORY));
    }

    public static Slf4jLogger forClass(Class<?> type) {
        return new Slf4jLogger(LoggerFactory.getLogger(type));
    }

    public Logger getDelegate() {
        return delegate;
    }

    @Override
    public void info(Object... args) {
        if (delegate.isInfoEnabled()) {
            delegate.info(join(args));
        }
    }

    @Override
    public void warn(Object... args) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(join(args));
        }
    }

    @Override
    public void error(Object... args) {
        if (!delegate.isErrorEnabled()) {
            return;
        }
        Throwable cause = lastThrowable(args);
        if (cause != null) {
            delegate.error(join(Arrays.copyOf(args, args.length - 1)), cause);
        } else {
            delegate.error(join(args));
        }
    }

    @Override
    public void errorf(String format, Object... args) {
        if (delegate.isErrorEnabled()) {
            delegate.error(String.format(format, args));
        }
    }

    @Override
    public void infof(String format, Object... args) {
        if (delegate.isInfoEnabled()) {
            delegate.info(String.format(format, args));
        }
    }

    /**
     * Joins plain log arguments with single spaces.
     */
    static String join(Object... args) {
        if (args == null || args.length == 0) {
            return "";
        }
        return Arrays.stream(args)
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
    }

    private static Throwable lastThrowable(Object... args) {
        if (args == null || args.length == 0) {
            return null;
        }
        Object last = args[args.length - 1];
        return last instanceof Throwable ? (Throwable) last : null;
    }
}
