/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.validation;

/**
 * Result of validating a Pod
 *
 * @param valid     Whether the Pod is accepted
 * @param reason    Human-readable reason, also set for accepted Pods
 * @param failure   Kind of the failure, NONE for accepted Pods
 */
public record Validation(boolean valid, String reason, ValidationFailure failure) {
    /**
     * Creates an accepting validation
     *
     * @param reason    Reason of the acceptance
     *
     * @return  Accepting validation
     */
    public static Validation accept(String reason) {
        return new Validation(true, reason, ValidationFailure.NONE);
    }

    /**
     * Creates a rejecting validation
     *
     * @param failure   Kind of the failure
     * @param reason    Reason of the rejection
     *
     * @return  Rejecting validation
     */
    public static Validation reject(ValidationFailure failure, String reason) {
        return new Validation(false, reason, failure);
    }
}
