package com.gemflush.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools and shared beans for the pipeline.
 *
 * Two fixed pools: one runs whole CFP runs (bounded so the tick cannot flood
 * the capability services), the other carries individual external calls so a
 * TimeLimiter can abandon them.
 */
@Configuration
@EnableConfigurationProperties(CfpProperties.class)
public class PipelineConfig {

    public static final String RUN_EXECUTOR = "cfpRunExecutor";
    public static final String CALL_EXECUTOR = "externalCallExecutor";

    @Bean(name = RUN_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService cfpRunExecutor(CfpProperties props) {
        return Executors.newFixedThreadPool(props.getPipeline().getWorkers());
    }

    @Bean(name = CALL_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService externalCallExecutor(CfpProperties props) {
        return Executors.newFixedThreadPool(props.getPipeline().getExternalCallThreads());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
