/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid;

import io.podaccess.webhook.common.config.ConfigParameter;
import io.podaccess.webhook.uid.admission.AdmissionWebhookServer;
import io.podaccess.webhook.uid.policy.ServiceAccountNamespaceProvider;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.podaccess.webhook.common.config.ConfigParameterParser.INTEGER;
import static io.podaccess.webhook.common.config.ConfigParameterParser.LONG;
import static io.podaccess.webhook.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.podaccess.webhook.common.config.ConfigParameterParser.STRING;
import static io.podaccess.webhook.common.config.ConfigParameterParser.strictlyPositive;

/**
 * UID webhook configuration
 */
public class UidWebhookConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Port of the admission webhook server
     */
    public static final ConfigParameter<Integer> PORT = new ConfigParameter<>("UID_WEBHOOK_PORT", strictlyPositive(INTEGER), "8443", CONFIG_VALUES);
    /**
     * Key store with the certificate and key of the webhook. Plain HTTP is served when not set.
     */
    public static final ConfigParameter<String> TLS_KEYSTORE_PATH = new ConfigParameter<>("UID_WEBHOOK_TLS_KEYSTORE_PATH", STRING, null, CONFIG_VALUES);
    /**
     * Password of the key store
     */
    public static final ConfigParameter<String> TLS_KEYSTORE_PASSWORD = new ConfigParameter<>("UID_WEBHOOK_TLS_KEYSTORE_PASSWORD", STRING, null, CONFIG_VALUES);
    /**
     * Type of the key store
     */
    public static final ConfigParameter<String> TLS_KEYSTORE_TYPE = new ConfigParameter<>("UID_WEBHOOK_TLS_KEYSTORE_TYPE", NON_EMPTY_STRING, "PKCS12", CONFIG_VALUES);
    /**
     * Name of the ConfigMap with the UID map
     */
    public static final ConfigParameter<String> UID_MAP_NAME = new ConfigParameter<>("UID_WEBHOOK_UID_MAP_NAME", NON_EMPTY_STRING, "nfs-pod-access-control-uid-mapping", CONFIG_VALUES);
    /**
     * Namespace of the ConfigMap with the UID map. The namespace of the webhook is used when not set.
     */
    public static final ConfigParameter<String> UID_MAP_NAMESPACE = new ConfigParameter<>("UID_WEBHOOK_UID_MAP_NAMESPACE", STRING, null, CONFIG_VALUES);
    /**
     * File from which the namespace of the webhook is read
     */
    public static final ConfigParameter<String> NAMESPACE_FILE = new ConfigParameter<>("UID_WEBHOOK_NAMESPACE_FILE", NON_EMPTY_STRING, ServiceAccountNamespaceProvider.DEFAULT_NAMESPACE_FILE, CONFIG_VALUES);
    /**
     * Maximal time in milliseconds a single validation may take before the Pod is rejected
     */
    public static final ConfigParameter<Long> VALIDATION_TIMEOUT_MS = new ConfigParameter<>("UID_WEBHOOK_VALIDATION_TIMEOUT_MS", strictlyPositive(LONG), "10000", CONFIG_VALUES);
    /**
     * Size of the pool of threads running the validations
     */
    public static final ConfigParameter<Integer> VALIDATION_THREAD_POOL_SIZE = new ConfigParameter<>("UID_WEBHOOK_VALIDATION_THREAD_POOL_SIZE", strictlyPositive(INTEGER), "10", CONFIG_VALUES);
    /**
     * Port of the health check and metrics server
     */
    public static final ConfigParameter<Integer> HEALTH_CHECK_PORT = new ConfigParameter<>("UID_WEBHOOK_HEALTH_CHECK_PORT", strictlyPositive(INTEGER), "8081", CONFIG_VALUES);

    private final Map<String, Object> map;

    private UidWebhookConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the configuration from a map, usually the environment variables. Unknown keys are ignored.
     *
     * @param map   Map with the configuration values
     *
     * @return  UidWebhookConfig object
     */
    public static UidWebhookConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(UidWebhookConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new UidWebhookConfig(generatedMap);
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return         Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  Port of the admission webhook server
     */
    public int getPort() {
        return get(PORT);
    }

    /**
     * @return  Key store of the admission webhook server or null when TLS is not configured
     */
    public AdmissionWebhookServer.TlsKeyStore getTlsKeyStore() {
        String path = get(TLS_KEYSTORE_PATH);

        if (path == null || path.isEmpty()) {
            return null;
        }

        return new AdmissionWebhookServer.TlsKeyStore(path, get(TLS_KEYSTORE_PASSWORD), get(TLS_KEYSTORE_TYPE));
    }

    /**
     * @return  Name of the ConfigMap with the UID map
     */
    public String getUidMapName() {
        return get(UID_MAP_NAME);
    }

    /**
     * @return  Configured namespace of the UID map or null when the namespace of the webhook is used
     */
    public String getUidMapNamespace() {
        return get(UID_MAP_NAMESPACE);
    }

    /**
     * @return  File from which the namespace of the webhook is read
     */
    public String getNamespaceFile() {
        return get(NAMESPACE_FILE);
    }

    /**
     * @return  Validation timeout in milliseconds
     */
    public long getValidationTimeoutMs() {
        return get(VALIDATION_TIMEOUT_MS);
    }

    /**
     * @return  Size of the validation thread pool
     */
    public int getValidationThreadPoolSize() {
        return get(VALIDATION_THREAD_POOL_SIZE);
    }

    /**
     * @return  Port of the health check and metrics server
     */
    public int getHealthCheckPort() {
        return get(HEALTH_CHECK_PORT);
    }

    @Override
    public String toString() {
        return "UidWebhookConfig(" +
                "port=" + getPort() +
                ",tlsKeyStorePath=" + get(TLS_KEYSTORE_PATH) +
                ",tlsKeyStoreType=" + get(TLS_KEYSTORE_TYPE) +
                ",uidMapName=" + getUidMapName() +
                ",uidMapNamespace=" + getUidMapNamespace() +
                ",namespaceFile=" + getNamespaceFile() +
                ",validationTimeoutMs=" + getValidationTimeoutMs() +
                ",validationThreadPoolSize=" + getValidationThreadPoolSize() +
                ",healthCheckPort=" + getHealthCheckPort() +
                ")";
    }
}
