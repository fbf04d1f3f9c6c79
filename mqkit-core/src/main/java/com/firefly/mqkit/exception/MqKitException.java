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
package com.firefly.mqkit.exception;

/**
 * Base exception for configuration problems detected when a broker client
 * consumes mqkit options.
 *
 * <p>Like the rest of the Firefly client stack, these exceptions can carry a hint
 * that points at the option to fix. Check {@link #getHint()}.
 */
public class MqKitException extends Exception {

    private final String hint;

    public MqKitException(String message) {
        super(message);
        this.hint = null;
    }

    public MqKitException(String message, Throwable cause) {
        super(message, cause);
        this.hint = null;
    }

    public MqKitException(String message, String hint) {
        super(message);
        this.hint = hint;
    }

    public MqKitException(String message, String hint, Throwable cause) {
        super(message, cause);
        this.hint = hint;
    }

    /**
     * Gets a hint for resolving this error.
     *
     * @return hint string, or null if no hint is available
     */
    public String getHint() {
        return hint;
    }

    /**
     * Gets the full message including the hint.
     *
     * @return message with hint if available
     */
    public String getFullMessage() {
        if (hint != null && !hint.isEmpty()) {
            return getMessage() + "\n  Hint: " + hint;
        }
        return getMessage();
    }

    @Override
    public String toString() {
        if (hint != null && !hint.isEmpty()) {
            return getClass().getName() + ": " + getMessage() + "\n  Hint: " + hint;
        }
        return super.toString();
    }

    // =========================================================================
    // Factory methods for common configuration errors
    // =========================================================================

    /**
     * Creates an exception for a connection configured without addresses.
     */
    public static MqKitException noAddresses() {
        return new MqKitException(
            "No broker addresses configured",
            "Add Options.addresses(\"host:port\", ...) to the connection options."
        );
    }

    /**
     * Creates an exception for a connection configured without a codec.
     */
    public static MqKitException missingCodec() {
        return new MqKitException(
            "No codec configured",
            "Set a codec with Options.codec(Codecs.json()) or register one in Codecs."
        );
    }

    /**
     * Creates an exception for SASL credentials that are only partially set.
     */
    public static MqKitException incompleteSasl(String missing) {
        return new MqKitException(
            "Incomplete SASL credentials, missing: " + missing,
            "Username, password and mechanism must be set together with Options.sasl(user, password, mechanism)."
        );
    }

    /**
     * Creates an exception for a negative subscription retry count.
     */
    public static MqKitException negativeRetryNum(int retryNum) {
        return new MqKitException(
            "Retry count must not be negative: " + retryNum,
            "Use SubscribeOptions.subscribeRetryNum(0) to disable retries."
        );
    }

    /**
     * Creates an exception for a strategy whose identity is empty.
     */
    public static MqKitException blankStrategy() {
        return new MqKitException(
            "Strategy identity must not be empty",
            "Use one of Strategies.RETRY, DO_ONCE, SEND_BACK or Strategies.custom(name)."
        );
    }

    /**
     * Creates an exception for TLS material that cannot be turned into an SSL context.
     */
    public static MqKitException tlsSetupFailed(Throwable cause) {
        return new MqKitException(
            "Failed to configure TLS",
            "Check that the CA, certificate and key files exist and are PEM encoded. " +
            "Private keys must be PKCS#8 (openssl pkcs8 -topk8 -nocrypt -in key.pem -out key-pkcs8.pem).",
            cause
        );
    }
}
