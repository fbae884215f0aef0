package com.eyelevel.documenttranslator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the thread pool that hosts the long-lived stage worker loops. Every loop occupies one
 * thread for its whole life, so the pool is sized from the configured worker counts and has no queue.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * @param pipelineProperties supplies the per-stage worker counts.
     * @return the executor used by {@link com.eyelevel.documenttranslator.worker.StageWorkerPool}.
     */
    @Bean("stageWorkerExecutor")
    public ThreadPoolTaskExecutor stageWorkerExecutor(PipelineProperties pipelineProperties) {
        int total = Math.max(1, pipelineProperties.getWorkers().total());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(total);
        executor.setMaxPoolSize(total);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stage-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
