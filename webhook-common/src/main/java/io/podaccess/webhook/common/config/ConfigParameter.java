/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.common.config;

import io.podaccess.webhook.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * A single webhook configuration parameter. The key doubles as the name of the environment variable it is read from.
 * Required parameters have no default value. Optional parameters without a default value are null when not set.
 *
 * @param key           Name of the parameter and of its environment variable
 * @param <T>           Type of the parsed value
 * @param type          Parser converting the string value
 * @param defaultValue  Value used when the parameter is not set or empty
 * @param required      Whether startup fails when the parameter is not set
 * @param map           Registry of all parameters of one configuration class
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required, Map<String, ConfigParameter<?>> map) {
    /**
     * Creates a required parameter and registers it
     *
     * @param key   Name of the parameter
     * @param type  Parser of the value
     * @param map   Registry of the parameters
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        this(key, type, null, true, map);
        map.put(key(), this);
    }

    /**
     * Creates an optional parameter and registers it
     *
     * @param key           Name of the parameter
     * @param type          Parser of the value
     * @param defaultValue  Default value, may be null
     * @param map           Registry of the parameters
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        this(key, type, defaultValue, false, map);
        map.put(key(), this);
    }

    /**
     * Parses the given values against the registered parameters. Parameters which are missing or empty in the given
     * map get their default value.
     *
     * @param values        Raw values, usually the environment variables
     * @param parameters    Registered parameters
     *
     * @return  Map of parameter keys to their parsed values
     */
    public static Map<String, Object> define(Map<String, String> values, Map<String, ConfigParameter<?>> parameters) {
        Map<String, Object> parsed = new HashMap<>(parameters.size());

        for (ConfigParameter<?> parameter : parameters.values()) {
            String value = values.get(parameter.key());

            if (value == null || value.isEmpty()) {
                parsed.put(parameter.key(), parseDefault(parameter));
            } else {
                parsed.put(parameter.key(), parameter.type().parse(value));
            }
        }

        return parsed;
    }

    private static <T> T parseDefault(ConfigParameter<T> parameter) {
        if (parameter.defaultValue() != null) {
            return parameter.type().parse(parameter.defaultValue());
        } else if (parameter.required()) {
            throw new InvalidConfigurationException("Config value: " + parameter.key() + " is mandatory");
        } else {
            return null;
        }
    }
}
