package com.questrail.statsd.config;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * StatsdEnvironment
 * -----------------------------------------------------------------------------
 * Environment-derived defaults for the destination host and port.
 *
 * <p>Explicit configuration always wins. The environment is consulted only for
 * values that were not supplied, and a malformed environment value fails fast
 * with {@link ConfigurationException} rather than being ignored.</p>
 *
 * <p>The variable lookup is injectable so defaults can be exercised without
 * touching the process environment.</p>
 */
public final class StatsdEnvironment {
    public static final String DD_AGENT_HOST_ENV_VAR = "DD_AGENT_HOST";
    public static final String DD_DOGSTATSD_PORT_ENV_VAR = "DD_DOGSTATSD_PORT";

    private final Function<String, String> lookup;

    public StatsdEnvironment(Function<String, String> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public static StatsdEnvironment system() {
        return new StatsdEnvironment(System::getenv);
    }

    public Optional<String> hostName() {
        String value = lookup.apply(DD_AGENT_HOST_ENV_VAR);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    /**
     * @throws ConfigurationException if the variable is set but is not a port number
     */
    public OptionalInt port() {
        String value = lookup.apply(DD_DOGSTATSD_PORT_ENV_VAR);
        if (value == null) {
            return OptionalInt.empty();
        }

        final int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Environment variable '" + DD_DOGSTATSD_PORT_ENV_VAR + "' bad format: '" + value + "'", e);
        }

        if (port < 1 || port > 0xFFFF) {
            throw new ConfigurationException(
                    "Environment variable '" + DD_DOGSTATSD_PORT_ENV_VAR + "' out of range: " + port);
        }
        return OptionalInt.of(port);
    }

    /**
     * Returns {@code config} with a missing host and port filled in from the
     * environment, falling back to {@link StatsdUdpConfig#DEFAULT_PORT} for the port.
     *
     * @throws ConfigurationException if no host is available from either source,
     *                                or if an environment value consulted is malformed
     */
    public StatsdUdpConfig applyDefaults(StatsdUdpConfig config) {
        Objects.requireNonNull(config, "config");

        StatsdUdpConfig effective = config;

        if (!effective.hasHost()) {
            String host = hostName().orElseThrow(() -> new ConfigurationException(
                    "No StatsD host configured; supply one explicitly or set " + DD_AGENT_HOST_ENV_VAR));
            effective = effective.withHost(host);
        }

        if (!effective.hasPort()) {
            effective = effective.withPort(port().orElse(StatsdUdpConfig.DEFAULT_PORT));
        }

        return effective;
    }
}
