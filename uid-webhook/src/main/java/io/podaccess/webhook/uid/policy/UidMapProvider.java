/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import java.util.Map;

/**
 * Source of the UID map, which maps subject names to their authorized UIDs
 */
@FunctionalInterface
public interface UidMapProvider {
    /**
     * Fetches the current UID map. Called on every evaluation, implementations must not serve stale data.
     *
     * @param namespace Namespace of the map
     * @param name      Name of the map
     *
     * @return  Map of subject names to string encoded UIDs. Never null.
     *
     * @throws UidMapException  When the map cannot be obtained
     */
    Map<String, String> getUidMap(String namespace, String name) throws UidMapException;
}
