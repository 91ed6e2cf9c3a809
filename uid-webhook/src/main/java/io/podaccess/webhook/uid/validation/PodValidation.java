/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.validation;

import io.fabric8.kubernetes.api.model.Pod;
import io.podaccess.webhook.common.Admission;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs a chain of Pod validators. The first rejecting validator decides.
 */
public class PodValidation {
    private static final Logger LOGGER = LogManager.getLogger(PodValidation.class);

    private final List<PodValidator> validators;

    /**
     * Constructor
     *
     * @param validators    Validators in the order in which they run
     */
    public PodValidation(List<PodValidator> validators) {
        this.validators = List.copyOf(validators);
    }

    /**
     * Validates the Pod with all validators
     *
     * @param pod           The Pod under review
     * @param admission     The admission being evaluated
     *
     * @return  The first rejecting validation, or an accepting one when all validators accept the Pod
     */
    public Validation validate(Pod pod, Admission admission) {
        for (PodValidator validator : validators) {
            Validation validation = validator.validate(pod, admission);

            if (!validation.valid()) {
                LOGGER.info(admission.getMarker(), "Pod rejected by {}: {}", validator.name(), validation.reason());
                return validation;
            }

            LOGGER.debug(admission.getMarker(), "Pod accepted by {}: {}", validator.name(), validation.reason());
        }

        return Validation.accept("Valid pod");
    }
}
