/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common;

import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Represents the evaluation of a single admission request by the webhook.</p>
 *
 * <p>Each instance has a unique id and wraps the request being evaluated. The kind, namespace and name of the object
 * under review are used to provide consistent context for logging.</p>
 */
public class Admission {
    private static final AtomicInteger IDS = new AtomicInteger();

    private final AdmissionRequest request;
    private final String kind;
    private final String namespace;
    private final String name;
    private final int id;
    private final Marker marker;

    /**
     * Constructs the admission context
     *
     * @param request   The admission request under evaluation
     */
    public Admission(AdmissionRequest request) {
        this.request = request;
        this.kind = request.getKind() != null && request.getKind().getKind() != null ? request.getKind().getKind() : "Unknown";
        this.namespace = request.getNamespace() != null ? request.getNamespace() : "";
        this.name = request.getName() != null ? request.getName() : "";
        this.id = IDS.getAndIncrement();
        this.marker = MarkerManager.getMarker(this.kind + "(" + this.namespace + "/" + this.name + ")");
    }

    /**
     * @return  The admission request under evaluation
     */
    public AdmissionRequest request() {
        return request;
    }

    /**
     * @return  UID of the admission request, copied into the response
     */
    public String uid() {
        return request.getUid();
    }

    /**
     * @return  Operation of the request (CREATE, UPDATE, ...)
     */
    public String operation() {
        return request.getOperation();
    }

    /**
     * @return  Kind of the reviewed object
     */
    public String kind() {
        return kind;
    }

    /**
     * @return  Namespace the request acts on
     */
    public String namespace() {
        return namespace;
    }

    /**
     * @return  Name of the reviewed object. Empty when the object uses a generated name.
     */
    public String name() {
        return name;
    }

    /**
     * @return  The logging marker
     */
    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "Admission #" + id + "(" + operation() + ") " + kind() + "(" + namespace() + "/" + name() + ")";
    }
}
