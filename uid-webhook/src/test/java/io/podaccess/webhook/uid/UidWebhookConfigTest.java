/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid;

import io.podaccess.webhook.common.InvalidConfigurationException;
import io.podaccess.webhook.uid.admission.AdmissionWebhookServer;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UidWebhookConfigTest {
    private static final Map<String, String> ENV_VARS = new HashMap<>(12);

    static {
        ENV_VARS.put(UidWebhookConfig.PORT.key(), "9443");
        ENV_VARS.put(UidWebhookConfig.TLS_KEYSTORE_PATH.key(), "/etc/webhook/tls/keystore.p12");
        ENV_VARS.put(UidWebhookConfig.TLS_KEYSTORE_PASSWORD.key(), "changeit");
        ENV_VARS.put(UidWebhookConfig.TLS_KEYSTORE_TYPE.key(), "JKS");
        ENV_VARS.put(UidWebhookConfig.UID_MAP_NAME.key(), "custom-uid-mapping");
        ENV_VARS.put(UidWebhookConfig.UID_MAP_NAMESPACE.key(), "nfs-access-control");
        ENV_VARS.put(UidWebhookConfig.NAMESPACE_FILE.key(), "/tmp/namespace");
        ENV_VARS.put(UidWebhookConfig.VALIDATION_TIMEOUT_MS.key(), "2500");
        ENV_VARS.put(UidWebhookConfig.VALIDATION_THREAD_POOL_SIZE.key(), "4");
        ENV_VARS.put(UidWebhookConfig.HEALTH_CHECK_PORT.key(), "9081");
    }

    @Test
    public void testFromMap() {
        UidWebhookConfig config = UidWebhookConfig.buildFromMap(ENV_VARS);

        assertThat(config.getPort(), is(9443));
        assertThat(config.getTlsKeyStore(), is(new AdmissionWebhookServer.TlsKeyStore("/etc/webhook/tls/keystore.p12", "changeit", "JKS")));
        assertThat(config.getUidMapName(), is("custom-uid-mapping"));
        assertThat(config.getUidMapNamespace(), is("nfs-access-control"));
        assertThat(config.getNamespaceFile(), is("/tmp/namespace"));
        assertThat(config.getValidationTimeoutMs(), is(2500L));
        assertThat(config.getValidationThreadPoolSize(), is(4));
        assertThat(config.getHealthCheckPort(), is(9081));
    }

    @Test
    public void testDefaults() {
        UidWebhookConfig config = UidWebhookConfig.buildFromMap(Map.of());

        assertThat(config.getPort(), is(8443));
        assertThat(config.getTlsKeyStore(), is(nullValue()));
        assertThat(config.getUidMapName(), is("nfs-pod-access-control-uid-mapping"));
        assertThat(config.getUidMapNamespace(), is(nullValue()));
        assertThat(config.getNamespaceFile(), is("/var/run/secrets/kubernetes.io/serviceaccount/namespace"));
        assertThat(config.getValidationTimeoutMs(), is(10_000L));
        assertThat(config.getValidationThreadPoolSize(), is(10));
        assertThat(config.getHealthCheckPort(), is(8081));
    }

    @Test
    public void testTlsKeyStoreWithoutPasswordUsesDefaultType() {
        UidWebhookConfig config = UidWebhookConfig.buildFromMap(Map.of(UidWebhookConfig.TLS_KEYSTORE_PATH.key(), "/etc/webhook/tls/keystore.p12"));

        assertThat(config.getTlsKeyStore(), is(new AdmissionWebhookServer.TlsKeyStore("/etc/webhook/tls/keystore.p12", null, "PKCS12")));
    }

    @Test
    public void testUnknownKeysAreIgnored() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);
        envVars.put("PATH", "/usr/bin");
        envVars.put("UID_WEBHOOK_SOMETHING_ELSE", "value");

        assertThat(UidWebhookConfig.buildFromMap(envVars).getPort(), is(9443));
    }

    @Test
    public void testInvalidValuesThrow() {
        for (String key : new String[] {UidWebhookConfig.PORT.key(), UidWebhookConfig.VALIDATION_TIMEOUT_MS.key(), UidWebhookConfig.VALIDATION_THREAD_POOL_SIZE.key(), UidWebhookConfig.HEALTH_CHECK_PORT.key()}) {
            Map<String, String> notANumber = new HashMap<>(ENV_VARS);
            notANumber.put(key, "not_a_number");
            assertThrows(InvalidConfigurationException.class, () -> UidWebhookConfig.buildFromMap(notANumber));

            Map<String, String> zero = new HashMap<>(ENV_VARS);
            zero.put(key, "0");
            assertThrows(InvalidConfigurationException.class, () -> UidWebhookConfig.buildFromMap(zero));
        }
    }

    @Test
    public void testBlankUidMapNameThrows() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);
        envVars.put(UidWebhookConfig.UID_MAP_NAME.key(), "   ");

        assertThrows(InvalidConfigurationException.class, () -> UidWebhookConfig.buildFromMap(envVars));
    }

    @Test
    public void testToStringDoesNotContainPassword() {
        assertThat(UidWebhookConfig.buildFromMap(ENV_VARS).toString().contains("changeit"), is(false));
    }
}
