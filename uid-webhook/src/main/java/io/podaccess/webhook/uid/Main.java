/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.podaccess.webhook.common.MetricsProvider;
import io.podaccess.webhook.common.MicrometerMetricsProvider;
import io.podaccess.webhook.common.Util;
import io.podaccess.webhook.common.WebhookKubernetesClientBuilder;
import io.podaccess.webhook.common.http.HealthCheckAndMetricsServer;
import io.podaccess.webhook.uid.admission.AdmissionHandler;
import io.podaccess.webhook.uid.admission.AdmissionWebhookServer;
import io.podaccess.webhook.uid.identity.IdentityResolver;
import io.podaccess.webhook.uid.policy.ConfigMapUidMapProvider;
import io.podaccess.webhook.uid.policy.NamespaceProvider;
import io.podaccess.webhook.uid.policy.ServiceAccountNamespaceProvider;
import io.podaccess.webhook.uid.policy.UidPolicyChecker;
import io.podaccess.webhook.uid.validation.PodValidation;
import io.podaccess.webhook.uid.validation.UidValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The main class of the UID admission webhook
 */
@SuppressWarnings("checkstyle:classdataabstractioncoupling")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    /**
     * Starts the admission webhook server and the webserver with health checks and metrics
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        LOGGER.info("UID webhook {} is starting", Main.class.getPackage().getImplementationVersion());

        Util.printEnvInfo();

        UidWebhookConfig config = UidWebhookConfig.buildFromMap(System.getenv());
        LOGGER.info("UID webhook configuration is {}", config);

        MetricsProvider metricsProvider = createMetricsProvider();

        ConfigMapUidMapProvider uidMapProvider = new ConfigMapUidMapProvider(
                new WebhookKubernetesClientBuilder("uid-webhook", Main.class.getPackage().getImplementationVersion())::build);
        UidPolicyChecker uidPolicyChecker = new UidPolicyChecker(namespaceProvider(config), uidMapProvider, config.getUidMapName());
        PodValidation podValidation = new PodValidation(List.of(new UidValidator(new IdentityResolver(), uidPolicyChecker)));

        ExecutorService validationExecutor = Executors.newFixedThreadPool(config.getValidationThreadPoolSize(), new ValidationThreadFactory());
        AdmissionHandler admissionHandler = new AdmissionHandler(podValidation, validationExecutor, config.getValidationTimeoutMs(), metricsProvider);

        AdmissionWebhookServer webhookServer = new AdmissionWebhookServer(config.getPort(), config.getTlsKeyStore(), admissionHandler);
        HealthCheckAndMetricsServer healthCheckAndMetricsServer = new HealthCheckAndMetricsServer(config.getHealthCheckPort(), webhookServer, webhookServer, metricsProvider);

        healthCheckAndMetricsServer.start();
        webhookServer.start();

        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Requesting admission webhook server to stop");
            webhookServer.stop();
            validationExecutor.shutdownNow(); // We do not wait for termination

            LOGGER.info("Requesting health check and metrics server to stop");
            healthCheckAndMetricsServer.stop();

            LOGGER.info("Requesting Kubernetes client to stop");
            uidMapProvider.close();

            LOGGER.info("Shutdown complete");
        }));
    }

    /**
     * Uses the configured UID map namespace when set and the namespace of the webhook otherwise
     *
     * @param config    Webhook configuration
     *
     * @return  The namespace provider
     */
    private static NamespaceProvider namespaceProvider(UidWebhookConfig config) {
        String namespace = config.getUidMapNamespace();

        if (namespace != null && !namespace.isEmpty()) {
            return () -> namespace;
        } else {
            return new ServiceAccountNamespaceProvider(Path.of(config.getNamespaceFile()));
        }
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }

    private static class ValidationThreadFactory implements ThreadFactory {
        private final AtomicInteger threadCounter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "validation-thread-pool-" + threadCounter.getAndIncrement());
        }
    }
}
