package com.eyelevel.documenttranslator.config;

import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.queue.InMemoryStageQueue;
import com.eyelevel.documenttranslator.queue.SqsStageQueue;
import com.eyelevel.documenttranslator.queue.StageQueue;
import com.eyelevel.documenttranslator.queue.StageQueues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the {@link StageQueues} registry for the backend selected by {@code app.pipeline.queue-backend}.
 */
@Slf4j
@Configuration
public class StageQueueConfig {

    @Bean
    @ConditionalOnProperty(name = "app.pipeline.queue-backend", havingValue = "sqs", matchIfMissing = true)
    public StageQueues sqsStageQueues(SqsAsyncClient sqsAsyncClient, PipelineProperties pipelineProperties) {
        Map<PipelineStage, StageQueue> queues = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            String queueName = pipelineProperties.getQueues().nameFor(stage);
            queues.put(stage, new SqsStageQueue(sqsAsyncClient, queueName));
            log.info("Stage {} uses SQS queue '{}'.", stage, queueName);
        }
        return new StageQueues(queues);
    }

    @Bean
    @ConditionalOnProperty(name = "app.pipeline.queue-backend", havingValue = "memory")
    public StageQueues inMemoryStageQueues(PipelineProperties pipelineProperties) {
        log.warn("Using in-memory stage queues. Queued jobs will not survive a restart.");
        Map<PipelineStage, StageQueue> queues = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            queues.put(stage, new InMemoryStageQueue(pipelineProperties.getQueues().nameFor(stage)));
        }
        return new StageQueues(queues);
    }
}
