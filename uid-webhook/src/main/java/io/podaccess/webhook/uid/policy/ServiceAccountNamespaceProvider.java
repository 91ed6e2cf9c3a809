/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the namespace of the webhook from the file Kubernetes mounts together with the service account token. The
 * first successfully read namespace is kept for the lifetime of the provider, failed reads are retried on the next call.
 */
public class ServiceAccountNamespaceProvider implements NamespaceProvider {
    private static final Logger LOGGER = LogManager.getLogger(ServiceAccountNamespaceProvider.class);

    /**
     * Default location of the namespace file inside a Pod
     */
    public static final String DEFAULT_NAMESPACE_FILE = "/var/run/secrets/kubernetes.io/serviceaccount/namespace";

    private final Path namespaceFile;
    private final AtomicReference<String> namespace = new AtomicReference<>();

    /**
     * Constructor
     *
     * @param namespaceFile Path of the namespace file
     */
    public ServiceAccountNamespaceProvider(Path namespaceFile) {
        this.namespaceFile = namespaceFile;
    }

    @Override
    public String getNamespace() throws IOException {
        String cached = namespace.get();

        if (cached != null) {
            return cached;
        }

        String read = Files.readString(namespaceFile, StandardCharsets.UTF_8).trim();

        if (read.isEmpty()) {
            throw new IOException("Namespace file " + namespaceFile + " is empty");
        }

        if (namespace.compareAndSet(null, read)) {
            LOGGER.info("Webhook namespace {} read from {}", read, namespaceFile);
        }

        return namespace.get();
    }
}
