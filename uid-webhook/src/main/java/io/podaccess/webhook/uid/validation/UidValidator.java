/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.validation;

import io.fabric8.kubernetes.api.model.Pod;
import io.podaccess.webhook.common.Admission;
import io.podaccess.webhook.uid.identity.IdentityResolver;
import io.podaccess.webhook.uid.policy.UidPolicyChecker;

/**
 * Validates that the runAsUser of a Pod is the UID mapped to the identity which submitted it
 */
public class UidValidator implements PodValidator {
    private final IdentityResolver identityResolver;
    private final UidPolicyChecker uidPolicyChecker;

    /**
     * Constructor
     *
     * @param identityResolver  Resolves the subject of the request
     * @param uidPolicyChecker  Checks the UID of the Pod against the UID map
     */
    public UidValidator(IdentityResolver identityResolver, UidPolicyChecker uidPolicyChecker) {
        this.identityResolver = identityResolver;
        this.uidPolicyChecker = uidPolicyChecker;
    }

    @Override
    public String name() {
        return "uid_validator";
    }

    @Override
    public Validation validate(Pod pod, Admission admission) {
        String subject = identityResolver.resolve(admission, pod);
        return uidPolicyChecker.check(pod, subject, admission);
    }
}
