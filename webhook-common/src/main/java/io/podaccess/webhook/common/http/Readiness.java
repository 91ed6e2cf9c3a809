/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common.http;

/**
 * A readiness check implemented by a webhook and called by the {@link HealthCheckAndMetricsServer} when handling a
 * readiness request.
 */
public interface Readiness {

    /**
     * Indicates whether the webhook is ready to accept admission requests. This method is invoked on the HTTP request
     * handling thread so excessive blocking should be avoided.
     *
     * @return  True when the webhook is ready, false otherwise.
     */
    boolean isReady();
}
