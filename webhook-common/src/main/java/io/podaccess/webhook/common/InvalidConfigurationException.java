/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common;

/**
 * Raised when the webhook is started with a configuration value which is missing or cannot be parsed
 */
public class InvalidConfigurationException extends RuntimeException {
    /**
     * Creates the exception with a message naming the offending configuration value
     *
     * @param message   Description of the problem
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates the exception with a message and the parsing error which caused it
     *
     * @param message   Description of the problem
     * @param cause     Underlying parsing error
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
