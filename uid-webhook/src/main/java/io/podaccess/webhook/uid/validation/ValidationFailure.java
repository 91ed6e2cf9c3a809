/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.validation;

/**
 * Why a Pod was rejected. Used for metrics and tests, the operator facing text is the reason of the validation.
 */
public enum ValidationFailure {
    /**
     * The Pod was accepted
     */
    NONE,
    /**
     * The namespace of the webhook could not be determined
     */
    NAMESPACE_UNAVAILABLE,
    /**
     * The Kubernetes client could not be created
     */
    CLIENT_INITIALIZATION,
    /**
     * The UID map could not be fetched
     */
    UID_MAP_FETCH,
    /**
     * The subject has no entry, or an empty entry, in the UID map
     */
    NO_UID_ASSOCIATED,
    /**
     * The entry of the subject in the UID map is not a number
     */
    MALFORMED_UID,
    /**
     * The requested UID differs from the one in the UID map
     */
    UID_MISMATCH,
    /**
     * The evaluation did not finish in time
     */
    TIMEOUT,
    /**
     * The evaluation failed unexpectedly
     */
    INTERNAL_ERROR
}
