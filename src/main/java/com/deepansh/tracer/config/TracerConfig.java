package com.deepansh.tracer.config;

import com.deepansh.tracer.core.LoggingRunListener;
import com.deepansh.tracer.core.RunListener;
import com.deepansh.tracer.core.RunTracker;
import com.deepansh.tracer.persistence.RunPersister;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the run tracker with its clock, persister and lifecycle listeners.
 */
@Configuration
public class TracerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "tracer.console", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LoggingRunListener loggingRunListener(ObjectMapper objectMapper, TracerProperties properties) {
        return new LoggingRunListener(objectMapper, properties.getConsole().getMaxPayloadChars());
    }

    @Bean
    public RunTracker runTracker(RunPersister persister, ObjectProvider<RunListener> listeners, Clock clock) {
        return new RunTracker(persister, listeners.orderedStream().toList(), clock);
    }
}
