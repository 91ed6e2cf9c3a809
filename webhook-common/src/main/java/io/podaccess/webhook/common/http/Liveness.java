/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common.http;

/**
 * A liveness check implemented by a webhook and called by the {@link HealthCheckAndMetricsServer} when handling a
 * health check request.
 */
public interface Liveness {

    /**
     * Indicates whether the webhook is alive or not. This method is invoked on the HTTP request handling thread so
     * excessive blocking should be avoided.
     *
     * @return  True when the webhook is alive, false otherwise.
     */
    boolean isAlive();
}
