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
package com.firefly.mqkit;

import com.firefly.mqkit.context.OptionsContext;

/**
 * Message processing callback.
 *
 * <p>Used for subscription handlers and for the connection-level error hook
 * ({@link com.firefly.mqkit.config.Options#errorHandler(Handler)}).
 */
@FunctionalInterface
public interface Handler {

    /**
     * Processes one message.
     *
     * @param ctx     context carried by the options of the call, never null
     * @param message the message
     * @throws Exception if processing fails
     */
    void handle(OptionsContext ctx, Message message) throws Exception;
}
