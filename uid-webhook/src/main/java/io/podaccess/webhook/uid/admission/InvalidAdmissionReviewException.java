/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.admission;

/**
 * Raised when the body posted to the webhook is not a usable AdmissionReview
 */
public class InvalidAdmissionReviewException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Description of the problem
     */
    public InvalidAdmissionReviewException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Description of the problem
     * @param cause     Underlying parsing error
     */
    public InvalidAdmissionReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
