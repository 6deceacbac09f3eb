package com.coherenceai.infrastructure.persistence;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class PersistenceExecutorConfig {

    @Value("${persistence.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${persistence.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${persistence.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean("knowledgeWriteExecutor")
    public TaskExecutor knowledgeWriteExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        // Never run on the caller thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("KnowledgeWriter-");
        executor.initialize();
        return executor;
    }
}
