/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import java.io.IOException;

/**
 * Provides the namespace the webhook runs in, which is where the UID map lives
 */
@FunctionalInterface
public interface NamespaceProvider {
    /**
     * @return  The namespace of the webhook
     *
     * @throws IOException  When the namespace cannot be determined
     */
    String getNamespace() throws IOException;
}
