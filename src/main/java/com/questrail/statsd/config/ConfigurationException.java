package com.questrail.statsd.config;

import com.questrail.statsd.api.StatsdException;

/**
 * Indicates that a configuration value, supplied explicitly or through the
 * environment, is malformed or missing.
 *
 * <p>Always fatal to construction; never replaced by a fallback value.</p>
 */
public final class ConfigurationException extends StatsdException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
