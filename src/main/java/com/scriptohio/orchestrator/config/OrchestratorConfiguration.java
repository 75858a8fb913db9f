package com.scriptohio.orchestrator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class OrchestratorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // shared by subtasks and peer reviews
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestratorWorkers(OrchestratorProperties properties) {
        int size = Math.max(1, properties.getWorkerPoolSize());
        log.info("Starting orchestrator worker pool with {} threads", size);
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(), new CustomizableThreadFactory("orchestrator-worker-"));
    }
}
