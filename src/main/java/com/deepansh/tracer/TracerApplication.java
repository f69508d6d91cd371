package com.deepansh.tracer;

import com.deepansh.tracer.config.TracerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(TracerProperties.class)
public class TracerApplication {
    public static void main(String[] args) {
        SpringApplication.run(TracerApplication.class, args);
    }
}
