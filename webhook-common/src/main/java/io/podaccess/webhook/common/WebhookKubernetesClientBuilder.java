/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Builds the Kubernetes clients used by the webhooks. The configuration is auto-detected, which inside a Pod means the
 * mounted service account token and CA.
 */
public class WebhookKubernetesClientBuilder {
    private final String componentName;
    private final String version;

    /**
     * Constructor
     *
     * @param componentName  The name of the component using the client. Used in the user agent.
     * @param version        The version of the component using the client. Used in the user agent.
     */
    public WebhookKubernetesClientBuilder(final String componentName, final String version) {
        this.componentName = componentName;
        this.version = version;
    }

    /**
     * Builds the KubernetesClient.
     *
     * @return the Kubernetes Client
     */
    public KubernetesClient build() {
        final String userAgent = String.format("%s/%s", componentName, version);
        final Config kubernetesClientConfig = new ConfigBuilder().withUserAgent(userAgent).build();
        return new KubernetesClientBuilder().withConfig(kubernetesClientConfig).build();
    }
}
