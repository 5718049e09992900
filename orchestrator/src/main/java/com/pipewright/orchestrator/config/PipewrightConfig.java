package com.pipewright.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipewrightConfig {

    /**
     * Fixed pool that drives process runs. One thread per active run; the
     * pool size caps how many runs hit the executor service at once.
     */
    @Bean(name = "processWorkers", destroyMethod = "shutdown")
    public ExecutorService processWorkers(PipewrightProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()));
    }
}
