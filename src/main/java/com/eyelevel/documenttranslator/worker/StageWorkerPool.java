package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the configured number of polling loops for every stage worker when the context starts, and
 * signals them to stop when it shuts down. Each loop notices the signal after its current poll.
 * Disabled with {@code app.pipeline.workers.enabled=false}.
 */
@Slf4j
@Component
public class StageWorkerPool implements SmartLifecycle {

    private final List<StageWorker> workers;
    private final TaskExecutor taskExecutor;
    private final PipelineProperties.Workers workerCounts;

    private volatile boolean running;

    public StageWorkerPool(List<StageWorker> workers, @Qualifier("stageWorkerExecutor") TaskExecutor taskExecutor,
                           PipelineProperties pipelineProperties) {
        this.workers = workers;
        this.taskExecutor = taskExecutor;
        this.workerCounts = pipelineProperties.getWorkers();
    }

    @Override
    public void start() {
        running = true;
        for (StageWorker worker : workers) {
            int count = workerCounts.countFor(worker.getStage());
            for (int i = 0; i < count; i++) {
                taskExecutor.execute(() -> worker.runLoop(this::isRunning));
            }
            log.info("Started {} {} worker loop(s).", count, worker.getStage());
        }
    }

    @Override
    public void stop() {
        log.info("Stopping stage worker loops.");
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return workerCounts.isEnabled();
    }
}
