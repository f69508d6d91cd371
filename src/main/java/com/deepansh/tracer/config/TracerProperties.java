package com.deepansh.tracer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the tracer.
 * Bound from application.yml under the "tracer" prefix.
 */
@ConfigurationProperties(prefix = "tracer")
@Data
public class TracerProperties {

    private Console console = new Console();
    private Persistence persistence = new Persistence();

    @Data
    public static class Console {
        private boolean enabled = true;
        /** Rendered inputs/outputs longer than this are cut in log lines */
        private int maxPayloadChars = 500;
    }

    @Data
    public static class Persistence {
        private int corePoolSize = 2;
        private int maxPoolSize = 5;
        private int queueCapacity = 100;
        private int awaitTerminationSeconds = 30;
    }
}
