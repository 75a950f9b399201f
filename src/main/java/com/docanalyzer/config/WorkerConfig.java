package com.docanalyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker-side execution resources.
 * Analysis work runs on {@code analysisExecutor} so neither servlet threads nor queue
 * consumer threads run the engine directly.
 */
@Configuration
public class WorkerConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConfig.class);

    private final AnalyzerProperties properties;

    public WorkerConfig(AnalyzerProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor analysisExecutor() {
        int threads = properties.queue().workerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("analysis-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(properties.queue().capacity());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Queue mode = {}, worker threads = {}, engine enabled = {}",
                properties.queue().mode(), properties.queue().workerThreads(), properties.engine().enabled());
    }
}
