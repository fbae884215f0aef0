package com.eyelevel.documenttranslator.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStageQueueTest {

    @Test
    void testPop_ReturnsEntriesInFifoOrder() throws InterruptedException {
        // Given
        InMemoryStageQueue queue = new InMemoryStageQueue("translator-translate");
        queue.push("job-1");
        queue.push("job-2");

        // When
        Optional<String> first = queue.pop(Duration.ZERO);
        Optional<String> second = queue.pop(Duration.ZERO);

        // Then
        assertThat(first).contains("job-1");
        assertThat(second).contains("job-2");
        assertThat(queue.size()).isZero();
    }

    @Test
    void testPop_EmptyQueueTimesOut() throws InterruptedException {
        // Given
        InMemoryStageQueue queue = new InMemoryStageQueue("translator-extract");

        // When
        long start = System.nanoTime();
        Optional<String> result = queue.pop(Duration.ofMillis(50));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // Then
        assertThat(result).isEmpty();
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(40);
    }
}
