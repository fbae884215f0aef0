package com.eyelevel.documenttranslator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.net.URI;

/**
 * Configures the SQS client that backs the durable stage queues.
 * Credentials come from static keys under the "local" profile and from the default provider chain otherwise.
 * Only active when {@code app.pipeline.queue-backend=sqs}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.pipeline.queue-backend", havingValue = "sqs", matchIfMissing = true)
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Value("${aws.sqs.retry-count:3}")
    private int sqsRetryCount;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Creates the SQS async client with an adaptive retry policy. An explicit endpoint
     * (e.g. LocalStack) overrides the regional one.
     */
    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        RetryPolicy retryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder().numRetries(sqsRetryCount)
                                             .build();
        var builder = SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider)
                                    .overrideConfiguration(
                                            ClientOverrideConfiguration.builder().retryPolicy(retryPolicy).build());
        if (StringUtils.hasText(sqsEndpoint)) {
            log.info("Using SQS endpoint override: {}", sqsEndpoint);
            builder.endpointOverride(URI.create(sqsEndpoint));
        }
        return builder.build();
    }
}
