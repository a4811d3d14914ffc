package com.questrail.statsd.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.questrail.statsd.config.StatsdEnvironment.DD_AGENT_HOST_ENV_VAR;
import static com.questrail.statsd.config.StatsdEnvironment.DD_DOGSTATSD_PORT_ENV_VAR;
import static org.junit.jupiter.api.Assertions.*;

class StatsdEnvironmentTest {

    private static StatsdEnvironment env(Map<String, String> vars) {
        return new StatsdEnvironment(vars::get);
    }

    private static Map<String, String> vars(String host, String port) {
        Map<String, String> vars = new HashMap<>();
        if (host != null) {
            vars.put(DD_AGENT_HOST_ENV_VAR, host);
        }
        if (port != null) {
            vars.put(DD_DOGSTATSD_PORT_ENV_VAR, port);
        }
        return vars;
    }

    @Test
    void explicitValuesWinOverEnvironment() {
        StatsdUdpConfig config = StatsdUdpConfig.builder()
            .withHost("10.0.0.5")
            .withPort(9125)
            .build();

        StatsdUdpConfig effective = env(vars("agent.local", "7000")).applyDefaults(config);

        assertEquals("10.0.0.5", effective.host());
        assertEquals(9125, effective.port());
    }

    @Test
    void missingValuesComeFromEnvironment() {
        StatsdUdpConfig effective = env(vars("agent.local", " 7000 "))
            .applyDefaults(StatsdUdpConfig.builder().build());

        assertEquals("agent.local", effective.host());
        assertEquals(7000, effective.port());
        assertEquals(StatsdUdpConfig.DEFAULT_MAX_PACKET_SIZE, effective.maxPacketSize());
    }

    @Test
    void emptyExplicitHostFallsBackToEnvironment() {
        StatsdUdpConfig config = StatsdUdpConfig.builder().withHost("").build();

        assertEquals("agent.local", env(vars("agent.local", null)).applyDefaults(config).host());
    }

    @Test
    void portDefaultsWhenNeitherSupplied() {
        StatsdUdpConfig effective = env(vars("agent.local", null))
            .applyDefaults(StatsdUdpConfig.builder().build());

        assertEquals(StatsdUdpConfig.DEFAULT_PORT, effective.port());
    }

    @Test
    void malformedPortVariableFailsFast() {
        StatsdEnvironment environment = env(vars("agent.local", "eighty"));

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> environment.applyDefaults(StatsdUdpConfig.builder().build()));
        assertTrue(e.getMessage().contains(DD_DOGSTATSD_PORT_ENV_VAR));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void outOfRangePortVariableFailsFast() {
        assertThrows(ConfigurationException.class, () -> env(vars(null, "70000")).port());
        assertThrows(ConfigurationException.class, () -> env(vars(null, "0")).port());
    }

    @Test
    void malformedPortVariableIsNotConsultedWhenPortIsExplicit() {
        StatsdUdpConfig config = StatsdUdpConfig.builder().withPort(8200).build();

        StatsdUdpConfig effective = env(vars("agent.local", "eighty")).applyDefaults(config);

        assertEquals(8200, effective.port());
    }

    @Test
    void missingHostEverywhereFails() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> env(vars(null, "8125")).applyDefaults(StatsdUdpConfig.builder().build()));
        assertTrue(e.getMessage().contains(DD_AGENT_HOST_ENV_VAR));
    }

    @Test
    void blankHostVariableCountsAsUnset() {
        assertTrue(env(vars("  ", null)).hostName().isEmpty());
    }
}
