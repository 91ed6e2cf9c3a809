/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import io.fabric8.kubernetes.api.model.Pod;
import io.podaccess.webhook.common.Admission;
import io.podaccess.webhook.uid.validation.Validation;
import io.podaccess.webhook.uid.validation.ValidationFailure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;

/**
 * Checks the runAsUser of a Pod against the UID the UID map authorizes for the subject. Pods which do not set
 * runAsUser are always accepted. Every failure, including the ones of the collaborators, rejects the Pod.
 */
public class UidPolicyChecker {
    private static final Logger LOGGER = LogManager.getLogger(UidPolicyChecker.class);

    /**
     * Reason of accepted Pods
     */
    public static final String VALID_UID = "Valid uid";

    private final NamespaceProvider namespaceProvider;
    private final UidMapProvider uidMapProvider;
    private final String uidMapName;

    /**
     * Constructor
     *
     * @param namespaceProvider     Provides the namespace of the UID map
     * @param uidMapProvider        Fetches the UID map
     * @param uidMapName            Name of the UID map
     */
    public UidPolicyChecker(NamespaceProvider namespaceProvider, UidMapProvider uidMapProvider, String uidMapName) {
        this.namespaceProvider = namespaceProvider;
        this.uidMapProvider = uidMapProvider;
        this.uidMapName = uidMapName;
    }

    /**
     * Checks the Pod. Never throws.
     *
     * @param pod           The Pod under review
     * @param subject       Subject resolved from the request, used as the key in the UID map
     * @param admission     The admission being evaluated
     *
     * @return  The validation result
     */
    public Validation check(Pod pod, String subject, Admission admission) {
        try {
            return doCheck(pod, subject, admission);
        } catch (RuntimeException e) {
            LOGGER.error(admission.getMarker(), "Unexpected error while checking the UID of the Pod", e);
            return Validation.reject(ValidationFailure.INTERNAL_ERROR, "Failed checking the UID: " + e);
        }
    }

    private Validation doCheck(Pod pod, String subject, Admission admission) {
        String namespace;

        try {
            namespace = namespaceProvider.getNamespace();
        } catch (IOException e) {
            LOGGER.warn(admission.getMarker(), "Failed retrieving the webhook namespace", e);
            return Validation.reject(ValidationFailure.NAMESPACE_UNAVAILABLE, "Failed retrieving the webhook namespace: " + e.getMessage());
        }

        Long found = runAsUser(pod);

        if (found == null) {
            return Validation.accept(VALID_UID);
        }

        Map<String, String> uidMap;

        try {
            uidMap = uidMapProvider.getUidMap(namespace, uidMapName);
        } catch (UidMapException e) {
            return switch (e.getKind()) {
                case CLIENT_INITIALIZATION -> Validation.reject(ValidationFailure.CLIENT_INITIALIZATION, "Failed initializing Kubernetes client: " + e.getMessage());
                case FETCH -> Validation.reject(ValidationFailure.UID_MAP_FETCH, "Failed getting ConfigMap: " + e.getMessage());
            };
        }

        String value = uidMap.get(subject);

        // Missing and empty entries have their own reason, so this has to come before parsing
        if (value == null || value.isEmpty()) {
            return Validation.reject(ValidationFailure.NO_UID_ASSOCIATED, "User " + subject + " has no UID associated with it");
        }

        long expected;

        try {
            expected = Long.parseLong(value);
        } catch (NumberFormatException e) {
            return Validation.reject(ValidationFailure.MALFORMED_UID, "Failed to convert UID to int64: " + e.getMessage());
        }

        if (expected != found) {
            return Validation.reject(ValidationFailure.UID_MISMATCH, "Invalid uid, expected: " + expected + ", found: " + found);
        }

        return Validation.accept(VALID_UID);
    }

    private static Long runAsUser(Pod pod) {
        if (pod.getSpec() == null || pod.getSpec().getSecurityContext() == null) {
            return null;
        }

        return pod.getSpec().getSecurityContext().getRunAsUser();
    }
}
