/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

/**
 * Raised when the UID map cannot be obtained
 */
public class UidMapException extends Exception {
    /**
     * Stage at which obtaining the UID map failed
     */
    public enum Kind {
        /**
         * The client for the backend storing the map could not be created
         */
        CLIENT_INITIALIZATION,
        /**
         * The map could not be fetched or does not exist
         */
        FETCH
    }

    private final Kind kind;

    /**
     * Constructor
     *
     * @param kind      Stage of the failure
     * @param message   Description of the failure
     */
    public UidMapException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructor
     *
     * @param kind      Stage of the failure
     * @param message   Description of the failure
     * @param cause     Underlying error
     */
    public UidMapException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return  Stage at which obtaining the UID map failed
     */
    public Kind getKind() {
        return kind;
    }
}
