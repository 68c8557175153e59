package com.creditengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for batch assessments.
 *
 * CONCURRENCY:
 * - Each applicant's pipeline reads only its own input and the immutable
 *   ScoringProperties, so workers never share mutable state
 * - Pool size comes from credit.scoring.batch.concurrency (default 3)
 * - More threads = faster batches BUT more CPU usage; tune to the host
 */
@Configuration
@Slf4j
public class AssessmentExecutorConfig {

    public static final String ASSESSMENT_EXECUTOR = "assessmentExecutor";

    @Bean(name = ASSESSMENT_EXECUTOR)
    public ThreadPoolTaskExecutor assessmentExecutor(ScoringProperties properties) {
        int concurrency = properties.batch().concurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("assessment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();

        log.info("Configured assessment executor with {} worker threads", concurrency);
        return executor;
    }
}
