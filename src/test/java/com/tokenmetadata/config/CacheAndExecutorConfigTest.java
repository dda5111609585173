package com.tokenmetadata.config;

import com.tokenmetadata.common.SingleFlightCache;
import com.tokenmetadata.domain.NormalizedRecord;
import com.tokenmetadata.domain.ResolvedMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
}, properties = "tokenmetadata.pipeline.workers=3")
class CacheAndExecutorConfigTest {

    @Autowired
    @Qualifier(CaffeineConfig.FINGERPRINT_CACHE)
    SingleFlightCache<String, NormalizedRecord> fingerprintCache;

    @Autowired
    @Qualifier(CaffeineConfig.CONTENT_ADDRESS_CACHE)
    SingleFlightCache<String, ResolvedMetadata> contentAddressCache;

    @Autowired
    @Qualifier(AsyncConfig.METADATA_WORKER_EXECUTOR)
    ThreadPoolTaskExecutor workerExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    @Qualifier(SchedulerConfig.PIPELINE_RETRY_SCHEDULER)
    ThreadPoolTaskScheduler retryScheduler;

    @Test
    @DisplayName("both dedup caches are separate beans")
    void dedupCachesCreated() {
        assertThat(fingerprintCache).isNotNull();
        assertThat(contentAddressCache).isNotNull().isNotSameAs(fingerprintCache);
        assertThat(fingerprintCache.estimatedSize()).isZero();
    }

    @Test
    @DisplayName("worker pool is sized from tokenmetadata.pipeline.workers")
    void workerExecutorSized() {
        assertThat(workerExecutor.getCorePoolSize()).isEqualTo(3);
        assertThat(workerExecutor.getMaxPoolSize()).isEqualTo(3);
        assertThat(workerExecutor.getThreadNamePrefix()).isEqualTo("metadata-worker-");
    }

    @Test
    @DisplayName("scheduler and retry pools are separate")
    void schedulerPoolsCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(retryScheduler.getThreadNamePrefix()).isEqualTo("pipeline-retry-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }
}
