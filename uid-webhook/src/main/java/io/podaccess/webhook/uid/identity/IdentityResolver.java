/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.identity;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.podaccess.webhook.common.Admission;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves the subject whose UID mapping applies to an admission request.
 *
 * When the request comes from a service account, the subject is the service account name declared in the Pod spec,
 * not the one from the user name of the request. Otherwise, the subject is the user name of the request as-is.
 */
public class IdentityResolver {
    private static final Logger LOGGER = LogManager.getLogger(IdentityResolver.class);

    /**
     * Resolves the subject. Never fails, at worst the subject is empty.
     *
     * @param admission     The admission being evaluated
     * @param pod           The Pod under review
     *
     * @return  Name of the subject used as the key in the UID map
     */
    public String resolve(Admission admission, Pod pod) {
        AdmissionRequest request = admission.request();

        if (LOGGER.isDebugEnabled()) {
            logRequest(admission);
        }

        String username = request.getUserInfo() != null ? request.getUserInfo().getUsername() : null;
        Identity identity = Identity.parse(username);

        if (identity instanceof Identity.ServiceAccount serviceAccount) {
            LOGGER.info(admission.getMarker(), "Request made by ServiceAccount: {} in namespace: {}", serviceAccount.name(), serviceAccount.namespace());
            return serviceAccountName(pod);
        } else {
            LOGGER.info(admission.getMarker(), "Request made by User: {} in namespace: {}", identity.username(), admission.namespace());
            return identity.username();
        }
    }

    private static String serviceAccountName(Pod pod) {
        if (pod.getSpec() != null && pod.getSpec().getServiceAccountName() != null) {
            return pod.getSpec().getServiceAccountName();
        } else {
            return "";
        }
    }

    private static void logRequest(Admission admission) {
        try {
            LOGGER.debug(admission.getMarker(), "Admission request: {}", Serialization.asJson(admission.request()));
        } catch (RuntimeException e) {
            LOGGER.debug(admission.getMarker(), "Failed to serialize the admission request", e);
        }
    }
}
