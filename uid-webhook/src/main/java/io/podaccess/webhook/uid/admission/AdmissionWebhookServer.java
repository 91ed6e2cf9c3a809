/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.admission;

import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.podaccess.webhook.common.http.Liveness;
import io.podaccess.webhook.common.http.Readiness;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.eclipse.jetty.util.ssl.SslContextFactory;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Jetty based web server receiving the AdmissionReviews of Pods on /validate-pods. Serves HTTPS when a key store is
 * configured, which is what the API server requires in a real deployment.
 */
public class AdmissionWebhookServer implements Liveness, Readiness {
    private final static Logger LOGGER = LogManager.getLogger(AdmissionWebhookServer.class);

    /**
     * Path of the Pod validation endpoint
     */
    public static final String VALIDATE_PODS_PATH = "/validate-pods";

    private final Server server;
    private final AdmissionHandler admissionHandler;

    /**
     * Constructs the admission webhook server
     *
     * @param port              Port number which should be used by the web server
     * @param tls               Key store used for TLS or null to serve plain HTTP
     * @param admissionHandler  Handler answering the AdmissionReviews
     */
    public AdmissionWebhookServer(int port, TlsKeyStore tls, AdmissionHandler admissionHandler) {
        this.admissionHandler = admissionHandler;

        server = new Server();

        ServerConnector connector;
        if (tls != null) {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStorePath(tls.path());
            sslContextFactory.setKeyStoreType(tls.type());
            if (tls.password() != null) {
                sslContextFactory.setKeyStorePassword(tls.password());
            }

            connector = new ServerConnector(server, sslContextFactory);
        } else {
            LOGGER.warn("No TLS key store configured, the admission webhook serves plain HTTP");
            connector = new ServerConnector(server);
        }
        connector.setPort(port);
        server.addConnector(connector);

        ContextHandler validatePodsContext = new ContextHandler();
        validatePodsContext.setContextPath(VALIDATE_PODS_PATH);
        validatePodsContext.setHandler(new ValidatePodsHandler());
        validatePodsContext.setAllowNullPathInfo(true);

        server.setHandler(validatePodsContext);
    }

    /**
     * Starts the webserver
     */
    public void start() {
        try {
            server.start();
        } catch (Exception e)   {
            LOGGER.error("Failed to start the admission webhook server", e);
            throw new RuntimeException(e);
        }
    }

    /**
     * Stops the webserver
     */
    public void stop() {
        try {
            server.stop();
        } catch (Exception e)   {
            LOGGER.error("Failed to stop the admission webhook server", e);
            throw new RuntimeException(e);
        }
    }

    @Override
    public boolean isAlive() {
        return !server.isFailed();
    }

    @Override
    public boolean isReady() {
        return server.isStarted();
    }

    /**
     * Key store holding the certificate and key of the webhook
     *
     * @param path      Path of the key store file
     * @param password  Password of the key store or null
     * @param type      Type of the key store, for example PKCS12
     */
    public record TlsKeyStore(String path, String password, String type) { }

    /**
     * Handler responsible for the Pod validation
     */
    class ValidatePodsHandler extends AbstractHandler {
        @Override
        public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException {
            baseRequest.setHandled(true);

            if (!"POST".equals(request.getMethod())) {
                writeError(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Only POST is supported");
                return;
            }

            String body = new String(request.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            AdmissionReview answer;

            try {
                answer = admissionHandler.handle(parse(body));
            } catch (InvalidAdmissionReviewException e) {
                LOGGER.warn("Invalid admission review received: {}", e.getMessage());
                writeError(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
                return;
            }

            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType("application/json");
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.getWriter().print(Serialization.asJson(answer));
        }

        private AdmissionReview parse(String body) {
            if (body.isBlank()) {
                throw new InvalidAdmissionReviewException("Request body is empty");
            }

            try {
                return Serialization.unmarshal(body, AdmissionReview.class);
            } catch (RuntimeException e) {
                throw new InvalidAdmissionReviewException("Failed to parse AdmissionReview: " + e.getMessage(), e);
            }
        }

        private void writeError(HttpServletResponse response, int status, String message) throws IOException {
            response.setStatus(status);
            response.setContentType("text/plain");
            response.getWriter().println(message);
        }
    }
}
