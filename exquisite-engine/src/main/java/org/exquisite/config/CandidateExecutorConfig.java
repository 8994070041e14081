package org.exquisite.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CandidateExecutorConfig {

    public static final String CANDIDATE_EXECUTOR = "candidateExecutor";

    @Bean(name = CANDIDATE_EXECUTOR)
    public ThreadPoolTaskExecutor candidateExecutor(ExquisiteProperties properties) {
        int poolSize = Math.max(1, properties.getGenerator().getMaxParallelCandidates());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("candidate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
