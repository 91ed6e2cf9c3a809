/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.admission;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponse;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponseBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReviewBuilder;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.podaccess.webhook.common.Admission;
import io.podaccess.webhook.common.MetricsProvider;
import io.podaccess.webhook.uid.validation.PodValidation;
import io.podaccess.webhook.uid.validation.Validation;
import io.podaccess.webhook.uid.validation.ValidationFailure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.HttpURLConnection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers AdmissionReviews for Pods. The validation runs on a worker pool and is bounded by a timeout, an evaluation
 * which does not finish in time rejects the Pod.
 */
public class AdmissionHandler {
    private static final Logger LOGGER = LogManager.getLogger(AdmissionHandler.class);

    /**
     * API version of the AdmissionReviews answered by the webhook
     */
    public static final String ADMISSION_REVIEW_API_VERSION = "admission.k8s.io/v1";

    /**
     * Name of the admissions counter
     */
    public static final String METRICS_ADMISSIONS = "uid_webhook.admissions";

    /**
     * Name of the admission duration timer
     */
    public static final String METRICS_ADMISSION_DURATION = "uid_webhook.admission.duration";

    private final PodValidation podValidation;
    private final ExecutorService executor;
    private final long validationTimeoutMs;
    private final MetricsProvider metrics;

    /**
     * Constructor
     *
     * @param podValidation         Validation applied to the Pods
     * @param executor              Worker pool running the validations
     * @param validationTimeoutMs   Maximal time a validation may take
     * @param metrics               Metrics provider
     */
    public AdmissionHandler(PodValidation podValidation, ExecutorService executor, long validationTimeoutMs, MetricsProvider metrics) {
        this.podValidation = podValidation;
        this.executor = executor;
        this.validationTimeoutMs = validationTimeoutMs;
        this.metrics = metrics;
    }

    /**
     * Answers the AdmissionReview
     *
     * @param review    AdmissionReview sent by the API server
     *
     * @return  AdmissionReview carrying the response
     *
     * @throws InvalidAdmissionReviewException  When the review carries no request
     */
    public AdmissionReview handle(AdmissionReview review) {
        if (review == null || review.getRequest() == null) {
            throw new InvalidAdmissionReviewException("AdmissionReview has no request");
        }

        Admission admission = new Admission(review.getRequest());
        Timer.Sample sample = Timer.start(metrics.meterRegistry());

        Validation validation = evaluate(admission);

        sample.stop(metrics.timer(METRICS_ADMISSION_DURATION, "Time spent answering admission requests", Tags.empty()));
        metrics.counter(METRICS_ADMISSIONS, "Number of answered admission requests",
                Tags.of("allowed", String.valueOf(validation.valid()), "failure", validation.failure().name())).increment();

        LOGGER.debug(admission.getMarker(), "{} answered with allowed={}: {}", admission, validation.valid(), validation.reason());

        return new AdmissionReviewBuilder()
                .withApiVersion(review.getApiVersion() != null ? review.getApiVersion() : ADMISSION_REVIEW_API_VERSION)
                .withKind("AdmissionReview")
                .withResponse(response(admission, validation))
                .build();
    }

    private Validation evaluate(Admission admission) {
        Pod pod = pod(admission);

        if (pod == null) {
            LOGGER.warn(admission.getMarker(), "{} does not carry a Pod and is allowed without validation", admission);
            return Validation.accept("Not a Pod");
        }

        Future<Validation> future;

        try {
            future = executor.submit(() -> podValidation.validate(pod, admission));
        } catch (RejectedExecutionException e) {
            LOGGER.error(admission.getMarker(), "Failed to schedule the validation", e);
            return Validation.reject(ValidationFailure.INTERNAL_ERROR, "Failed to schedule the validation: " + e.getMessage());
        }

        try {
            return future.get(validationTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn(admission.getMarker(), "Validation did not complete within {} ms", validationTimeoutMs);
            return Validation.reject(ValidationFailure.TIMEOUT, "Validation did not complete within " + validationTimeoutMs + " ms");
        } catch (ExecutionException e) {
            LOGGER.error(admission.getMarker(), "Validation failed", e.getCause());
            return Validation.reject(ValidationFailure.INTERNAL_ERROR, "Validation failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Validation.reject(ValidationFailure.INTERNAL_ERROR, "Validation was interrupted");
        }
    }

    /**
     * Extracts the Pod from the request. Objects the deserializer did not map to the Pod class, for example generic
     * resources, are converted through their JSON form.
     *
     * @param admission     The admission being evaluated
     *
     * @return  The Pod or null when the request does not carry a Pod
     */
    /* test */ static Pod pod(Admission admission) {
        AdmissionRequest request = admission.request();
        Object object = request.getObject();

        if (object instanceof Pod pod) {
            return pod;
        } else if (object != null && "Pod".equals(admission.kind())) {
            return Serialization.unmarshal(Serialization.asJson(object), Pod.class);
        } else {
            return null;
        }
    }

    private static AdmissionResponse response(Admission admission, Validation validation) {
        AdmissionResponseBuilder builder = new AdmissionResponseBuilder()
                .withUid(admission.uid())
                .withAllowed(validation.valid());

        if (!validation.valid()) {
            builder.withStatus(new StatusBuilder()
                    .withCode(HttpURLConnection.HTTP_FORBIDDEN)
                    .withMessage(validation.reason())
                    .build());
        }

        return builder.build();
    }
}
