package com.tokenmetadata.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the metadata pipeline. Fetch, validate and persist all run on these threads; the poll job
 * bounds how many events are queued or running at once, so the executor queue itself is unbounded.
 */
@Configuration
public class AsyncConfig {

    public static final String METADATA_WORKER_EXECUTOR = "metadata-worker-executor";

    @Bean(name = METADATA_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor metadataWorkerExecutor(@Value("${tokenmetadata.pipeline.workers:4}") int workers) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setThreadNamePrefix("metadata-worker-");
        e.initialize();
        return e;
    }
}
