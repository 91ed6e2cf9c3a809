/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.validation;

import io.fabric8.kubernetes.api.model.Pod;
import io.podaccess.webhook.common.Admission;

/**
 * A single policy applied to the Pods under admission
 */
public interface PodValidator {
    /**
     * @return  Name of the validator used in logs
     */
    String name();

    /**
     * Validates the Pod. Implementations report every failure through the returned validation instead of throwing.
     *
     * @param pod           The Pod under review
     * @param admission     The admission being evaluated
     *
     * @return  The validation result
     */
    Validation validate(Pod pod, Admission admission);
}
