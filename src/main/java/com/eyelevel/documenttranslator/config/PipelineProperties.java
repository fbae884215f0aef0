package com.eyelevel.documenttranslator.config;

import com.eyelevel.documenttranslator.model.PipelineStage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.pipeline" prefix: queue backend and names,
 * worker pool sizes per stage, and job-store write behaviour.
 */
@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * {@code sqs} for durable SQS queues, {@code memory} for in-process queues (local runs and tests).
     */
    private String queueBackend = "sqs";

    /**
     * Bounded wait of a worker's blocking pop. SQS long polling caps this at 20 seconds.
     */
    private Duration pollTimeout = Duration.ofSeconds(5);

    /**
     * Optional SQS queue that receives a notification for every created job. Empty disables it.
     */
    private String notificationQueue;

    private Queues queues = new Queues();
    private Workers workers = new Workers();
    private Store store = new Store();

    @Data
    public static class Queues {
        private String extraction = "translator-extract";
        private String chunking = "translator-chunk";
        private String translation = "translator-translate";
        private String reconstruction = "translator-reconstruct";

        public String nameFor(PipelineStage stage) {
            return switch (stage) {
                case EXTRACTION -> extraction;
                case CHUNKING -> chunking;
                case TRANSLATION -> translation;
                case RECONSTRUCTION -> reconstruction;
            };
        }
    }

    @Data
    public static class Workers {
        /**
         * Whether the worker loops start with the application context.
         */
        private boolean enabled = true;
        private int extraction = 3;
        private int chunking = 2;
        private int translation = 3;
        private int reconstruction = 1;

        public int countFor(PipelineStage stage) {
            return switch (stage) {
                case EXTRACTION -> extraction;
                case CHUNKING -> chunking;
                case TRANSLATION -> translation;
                case RECONSTRUCTION -> reconstruction;
            };
        }

        public int total() {
            return extraction + chunking + translation + reconstruction;
        }
    }

    @Data
    public static class Store {
        /**
         * Attempts of one read-modify-write before a revision conflict is surfaced to the caller.
         */
        private int maxWriteAttempts = 5;
    }
}
