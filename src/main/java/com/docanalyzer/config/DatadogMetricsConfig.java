package com.docanalyzer.config;

import io.micrometer.core.instrument.Clock;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdFlavor;
import io.micrometer.statsd.StatsdMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ships job metrics to a DogStatsD agent. Only active when datadog.enabled=true.
 * Spring Boot adds this registry to its composite alongside the actuator registry.
 */
@Configuration
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsConfig.class);

    @Value("${DD_AGENT_HOST:localhost}")
    private String agentHost;

    @Value("${DD_DOGSTATSD_PORT:8125}")
    private int statsdPort;

    @Bean
    public StatsdConfig statsdConfig() {
        return new StatsdConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public StatsdFlavor flavor() {
                return StatsdFlavor.DATADOG;
            }

            @Override
            public String host() {
                return agentHost;
            }

            @Override
            public int port() {
                return statsdPort;
            }
        };
    }

    @Bean
    public StatsdMeterRegistry statsdMeterRegistry(StatsdConfig statsdConfig) {
        StatsdMeterRegistry registry = new StatsdMeterRegistry(statsdConfig, Clock.SYSTEM);
        logger.info("Datadog StatsD meter registry configured: host={}, port={}", agentHost, statsdPort);
        return registry;
    }
}
