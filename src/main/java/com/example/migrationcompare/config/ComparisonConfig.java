package com.example.migrationcompare.config;

import com.example.migrationcompare.application.InMemoryPartitionBuffer;
import com.example.migrationcompare.application.PartitionBufferFactory;
import com.example.migrationcompare.infrastructure.SpillingPartitionBuffer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class ComparisonConfig {
    private static final Logger log = LogManager.getLogger(ComparisonConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PartitionBufferFactory partitionBufferFactory(
            @Value("${comparison.engine.spill-to-disk:false}") boolean spillToDisk,
            @Value("${comparison.engine.spill-directory:${java.io.tmpdir}/migration-compare}")
                    String spillDirectory,
            ObjectMapper objectMapper) {
        if (!spillToDisk) {
            return (jobId, side, partitionCount) -> new InMemoryPartitionBuffer(partitionCount);
        }
        Path baseDirectory = Path.of(spillDirectory);
        log.info("Partition buffers spill to {}", baseDirectory.toAbsolutePath());
        return (jobId, side, partitionCount) ->
                new SpillingPartitionBuffer(baseDirectory, jobId, side, partitionCount, objectMapper);
    }

    /** Background executor for comparison jobs. Partition work runs on the engine's own pool. */
    @Bean(name = "comparisonJobExecutor")
    public ThreadPoolTaskExecutor comparisonJobExecutor(
            @Value("${comparison.jobs.pool-size:2}") int poolSize,
            @Value("${comparison.jobs.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ComparisonJob-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
