package com.eyelevel.documenttranslator.queue;

import com.eyelevel.documenttranslator.exception.QueueAccessException;

import java.time.Duration;
import java.util.Optional;

/**
 * A FIFO channel of job ids awaiting one pipeline stage.
 * <p>
 * {@link #pop(Duration)} must be atomic across concurrent consumers: an entry is handed to at most one
 * caller. That is the only primitive the stage workers rely on to own a job exclusively.
 * Implementations throw {@link QueueAccessException} when the underlying queue is unreachable.
 */
public interface StageQueue {

    /**
     * @return the queue's configured name, used in logs and status output.
     */
    String name();

    void push(String jobId);

    /**
     * Removes and returns the head entry, waiting up to {@code timeout} for one to arrive.
     *
     * @return the job id, or empty if nothing arrived in time.
     * @throws InterruptedException if the calling worker is interrupted while waiting.
     */
    Optional<String> pop(Duration timeout) throws InterruptedException;

    /**
     * @return the number of entries waiting to be claimed. Durable backends may report an approximation.
     */
    long size();
}
