package com.eyelevel.documenttranslator.service.notification;

import com.eyelevel.documenttranslator.common.json.JsonSerializer;
import com.eyelevel.documenttranslator.model.TranslationJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes a "job created" event to the SQS queue named by {@code app.pipeline.notification-queue}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.pipeline.notification-queue")
public class SqsTaskExecutionNotifier implements TaskExecutionNotifier {

    private final SqsAsyncClient sqsAsyncClient;
    private final JsonSerializer jsonSerializer;
    private final String notificationQueue;

    public SqsTaskExecutionNotifier(SqsAsyncClient sqsAsyncClient,
                                    @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                                    @Value("${app.pipeline.notification-queue}") String notificationQueue) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.jsonSerializer = jsonSerializer;
        this.notificationQueue = notificationQueue;
    }

    @Override
    public void jobCreated(TranslationJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "JOB_CREATED");
        payload.put("jobId", job.getJobId());
        payload.put("tier", job.getTier().getValue());
        payload.put("totalPages", job.getTotalPages());
        payload.put("createdAt", job.getCreatedAt().toString());

        String body = jsonSerializer.serialize(payload);
        sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(notificationQueue).build())
                      .thenCompose(response -> sqsAsyncClient.sendMessage(
                              SendMessageRequest.builder().queueUrl(response.queueUrl()).messageBody(body).build()))
                      .join();
        log.debug("[JobId: {}] Task execution notification sent to '{}'.", job.getJobId(), notificationQueue);
    }
}
