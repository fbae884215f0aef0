package com.eyelevel.documenttranslator.queue;

import com.eyelevel.documenttranslator.exception.QueueAccessException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Durable {@link StageQueue} backed by an SQS queue.
 * <p>
 * A pop receives at most one message with long polling and deletes it straight away, so the entry
 * belongs to the receiving worker from then on. The queue's visibility timeout only matters if the
 * process dies between receive and delete, in which case the message reappears and the next worker
 * skips it when the job record no longer shows the stage's entry status.
 */
@Slf4j
public class SqsStageQueue implements StageQueue {

    private static final int MAX_LONG_POLL_SECONDS = 20;

    private final SqsAsyncClient sqsAsyncClient;
    private final String queueName;
    private volatile String queueUrl;

    public SqsStageQueue(SqsAsyncClient sqsAsyncClient, String queueName) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.queueName = queueName;
    }

    @Override
    public String name() {
        return queueName;
    }

    @Override
    public void push(String jobId) {
        try {
            sqsAsyncClient.sendMessage(SendMessageRequest.builder().queueUrl(queueUrl()).messageBody(jobId).build())
                          .join();
            log.debug("[JobId: {}] Sent to SQS queue '{}'.", jobId, queueName);
        } catch (CompletionException e) {
            throw new QueueAccessException("Failed to push job " + jobId + " to queue " + queueName, unwrap(e));
        }
    }

    @Override
    public Optional<String> pop(Duration timeout) throws InterruptedException {
        int waitSeconds = (int) Math.max(0, Math.min(MAX_LONG_POLL_SECONDS, timeout.toSeconds()));
        ReceiveMessageRequest request = ReceiveMessageRequest.builder().queueUrl(queueUrl()).maxNumberOfMessages(1)
                                                             .waitTimeSeconds(waitSeconds).build();
        ReceiveMessageResponse response;
        try {
            response = sqsAsyncClient.receiveMessage(request).get();
        } catch (ExecutionException e) {
            throw new QueueAccessException("Failed to receive from queue " + queueName, e.getCause());
        }

        List<Message> messages = response.messages();
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }

        Message message = messages.get(0);
        try {
            sqsAsyncClient.deleteMessage(DeleteMessageRequest.builder().queueUrl(queueUrl())
                                                             .receiptHandle(message.receiptHandle()).build()).join();
        } catch (CompletionException e) {
            // Not claimed: the message becomes visible again after the visibility timeout.
            throw new QueueAccessException("Failed to delete received message " + message.messageId()
                                           + " from queue " + queueName, unwrap(e));
        }
        return Optional.ofNullable(message.body());
    }

    @Override
    public long size() {
        try {
            String count = sqsAsyncClient.getQueueAttributes(GetQueueAttributesRequest.builder().queueUrl(queueUrl())
                                                                   .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
                                                                   .build())
                                         .join().attributes().get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES);
            return count == null ? 0L : Long.parseLong(count);
        } catch (CompletionException e) {
            throw new QueueAccessException("Failed to read size of queue " + queueName, unwrap(e));
        }
    }

    private String queueUrl() {
        String url = queueUrl;
        if (url == null) {
            try {
                url = sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build()).join()
                                    .queueUrl();
            } catch (CompletionException e) {
                throw new QueueAccessException("Failed to resolve URL of queue " + queueName, unwrap(e));
            }
            log.info("Resolved SQS queue '{}' to {}", queueName, url);
            queueUrl = url;
        }
        return url;
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
