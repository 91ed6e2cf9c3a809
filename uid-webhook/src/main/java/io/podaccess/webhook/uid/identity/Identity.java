/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.identity;

/**
 * The principal which submitted an admission request, as parsed from the user name of the request.
 */
public sealed interface Identity {
    /**
     * Prefix of the user names Kubernetes gives to service accounts: system:serviceaccount:&lt;namespace&gt;:&lt;name&gt;
     */
    String SERVICE_ACCOUNT_PREFIX = "system:serviceaccount:";

    /**
     * @return  The user name the identity was parsed from
     */
    String username();

    /**
     * Parses the user name of an admission request. Never fails.
     *
     * @param username  User name from the request. Null is treated as empty.
     *
     * @return  ServiceAccount for well-formed service account user names, Unrecognized for user names with the
     *          service account prefix but the wrong number of segments, User for everything else.
     */
    static Identity parse(String username) {
        String raw = username != null ? username : "";

        if (raw.startsWith(SERVICE_ACCOUNT_PREFIX)) {
            // Keep trailing empty segments so that "system:serviceaccount:ns:" still counts as four segments
            String[] segments = raw.split(":", -1);

            if (segments.length == 4) {
                return new ServiceAccount(raw, segments[2], segments[3]);
            } else {
                return new Unrecognized(raw);
            }
        }

        return new User(raw);
    }

    /**
     * A Kubernetes service account
     *
     * @param username  Full user name
     * @param namespace Namespace of the service account
     * @param name      Name of the service account
     */
    record ServiceAccount(String username, String namespace, String name) implements Identity { }

    /**
     * A user which is not a service account
     *
     * @param username  User name
     */
    record User(String username) implements Identity { }

    /**
     * A user name which carries the service account prefix but is not a valid service account user name
     *
     * @param username  User name
     */
    record Unrecognized(String username) implements Identity { }
}
