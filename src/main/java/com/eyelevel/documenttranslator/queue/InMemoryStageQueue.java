package com.eyelevel.documenttranslator.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link StageQueue} on a {@link LinkedBlockingQueue}. Entries do not survive a restart,
 * so this backend is meant for local runs and tests.
 */
@Slf4j
public class InMemoryStageQueue implements StageQueue {

    private final String name;
    private final BlockingQueue<String> entries = new LinkedBlockingQueue<>();

    public InMemoryStageQueue(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void push(String jobId) {
        entries.add(jobId);
        log.debug("[JobId: {}] Pushed to in-memory queue '{}' (size {}).", jobId, name, entries.size());
    }

    @Override
    public Optional<String> pop(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(entries.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public long size() {
        return entries.size();
    }
}
