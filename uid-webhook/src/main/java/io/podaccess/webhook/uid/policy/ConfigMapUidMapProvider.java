/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads the UID map from the data of a ConfigMap. The Kubernetes client is created on first use and reused afterwards.
 */
public class ConfigMapUidMapProvider implements UidMapProvider, AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(ConfigMapUidMapProvider.class);

    private final Supplier<KubernetesClient> clientSupplier;
    private KubernetesClient client;

    /**
     * Constructor
     *
     * @param clientSupplier    Creates the Kubernetes client. Called again on the next fetch when it fails.
     */
    public ConfigMapUidMapProvider(Supplier<KubernetesClient> clientSupplier) {
        this.clientSupplier = clientSupplier;
    }

    @Override
    public Map<String, String> getUidMap(String namespace, String name) throws UidMapException {
        KubernetesClient kubernetesClient = client();
        ConfigMap configMap;

        try {
            configMap = kubernetesClient.configMaps().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            LOGGER.warn("Error getting ConfigMap {}/{}", namespace, name, e);
            throw new UidMapException(UidMapException.Kind.FETCH, e.getMessage(), e);
        }

        if (configMap == null) {
            throw new UidMapException(UidMapException.Kind.FETCH, "ConfigMap " + namespace + "/" + name + " not found");
        }

        return configMap.getData() != null ? configMap.getData() : Map.of();
    }

    private synchronized KubernetesClient client() throws UidMapException {
        if (client == null) {
            try {
                client = clientSupplier.get();
            } catch (RuntimeException e) {
                LOGGER.warn("Error starting Kubernetes client", e);
                throw new UidMapException(UidMapException.Kind.CLIENT_INITIALIZATION, e.getMessage(), e);
            }
        }

        return client;
    }

    /**
     * Closes the Kubernetes client if it was created
     */
    @Override
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
