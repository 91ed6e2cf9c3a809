/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.TreeMap;

/**
 * Helper methods shared by the webhooks
 */
public class Util {
    private static final Logger LOGGER = LogManager.getLogger(Util.class);

    private Util() { }

    /**
     * Logs the environment of the process. Values of variables containing passwords are masked.
     */
    public static void printEnvInfo() {
        LOGGER.info("Using config:\n{}", envInfo(System.getenv()));
    }

    /**
     * Formats the environment variables one per line, sorted by name
     *
     * @param env   Environment variables
     *
     * @return  The formatted environment
     */
    /* test */ static String envInfo(Map<String, String> env) {
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<String, String> entry : new TreeMap<>(env).entrySet()) {
            sb.append("\t").append(entry.getKey()).append(": ").append(maskPassword(entry.getKey(), entry.getValue())).append("\n");
        }

        return sb.toString();
    }

    /**
     * Masks the value of the environment variable if its name contains `PASSWORD`.
     *
     * @param key   Name of the environment variable
     * @param value Value of the environment variable
     * @return      Value of the environment variable or masked text in case of password
     */
    /* test */ static String maskPassword(String key, String value)  {
        if (key.contains("PASSWORD"))  {
            return "********";
        } else {
            return value;
        }
    }
}
