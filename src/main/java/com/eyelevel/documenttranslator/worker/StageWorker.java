package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.exception.QueueAccessException;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.queue.StageQueue;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Base class of the four stage workers. One bean per stage; {@link StageWorkerPool} runs several
 * concurrent {@link #runLoop(BooleanSupplier) loops} on it, so implementations keep no per-job fields.
 * <p>
 * For every popped job id the worker:
 * <ol>
 *     <li>skips it if the record is missing, terminal, or not waiting for this stage;</li>
 *     <li>claims it with a guarded write that sets the stage's working status and claim progress;</li>
 *     <li>runs {@link #process(TranslationJob)}, turning any exception into a failure outcome;</li>
 *     <li>records the outcome with a write guarded on the working status, then enqueues the job for the
 *     next stage. The record is always written before the enqueue.</li>
 * </ol>
 * Whether a job is waiting for this stage is decided by {@link PipelineStage#isAwaitedBy(TranslationJob)},
 * which also rejects duplicate queue entries for stages whose entry and working status are the same.
 */
@Slf4j
public abstract class StageWorker {

    private final PipelineStage stage;
    protected final JobQueueManager jobQueueManager;
    private final StageQueue queue;
    private final Duration pollTimeout;

    protected StageWorker(PipelineStage stage, JobQueueManager jobQueueManager, StageQueue queue,
                          Duration pollTimeout) {
        this.stage = stage;
        this.jobQueueManager = jobQueueManager;
        this.queue = queue;
        this.pollTimeout = pollTimeout;
    }

    public PipelineStage getStage() {
        return stage;
    }

    /**
     * Progress written together with a successful hand-off to the next stage.
     */
    protected abstract double completionProgress();

    /**
     * Performs the stage's unit of work on a claimed job.
     *
     * @param job the record as written by the claim.
     * @return how to transition the job. Exceptions are recorded as failures.
     */
    protected abstract StageOutcome process(TranslationJob job) throws Exception;

    /**
     * Polls until {@code keepRunning} turns false or the thread is interrupted. A failed iteration is logged
     * and the loop carries on with the next poll.
     */
    public void runLoop(BooleanSupplier keepRunning) {
        log.info("{} worker loop started on thread {}.", stage, Thread.currentThread().getName());
        while (keepRunning.getAsBoolean()) {
            try {
                pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("{} worker iteration failed. Resuming polling.", stage, e);
                if (!pauseAfterError()) {
                    break;
                }
            }
        }
        log.info("{} worker loop stopped on thread {}.", stage, Thread.currentThread().getName());
    }

    /**
     * Pops at most one job id, waiting up to the poll timeout, and handles it.
     *
     * @return true if a job id was popped.
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<String> jobId = queue.pop(pollTimeout);
        jobId.ifPresent(this::handle);
        return jobId.isPresent();
    }

    /**
     * Runs one job id through this stage.
     */
    public void handle(String jobId) {
        Optional<TranslationJob> record = jobQueueManager.getJob(jobId);
        if (record.isEmpty()) {
            log.info("[JobId: {}] Skipping {}: job record not found.", jobId, stage);
            return;
        }
        if (record.get().isTerminal()) {
            log.debug("[JobId: {}] Skipping {}: job is already {}.", jobId, stage, record.get().getStatus());
            return;
        }
        if (!isWaitingForStage(record.get())) {
            log.warn("[JobId: {}] Skipping stale {} queue entry: job is {} at {}%.", jobId, stage,
                    record.get().getStatus(), record.get().getProgress());
            return;
        }

        Optional<TranslationJob> claimed = jobQueueManager.modifyJob(jobId, this::isWaitingForStage, job -> {
            job.setStatus(stage.getWorkingStatus());
            job.setProgress(stage.getClaimProgress());
        });
        if (claimed.isEmpty()) {
            log.info("[JobId: {}] Lost the {} claim; the job changed state.", jobId, stage);
            return;
        }
        log.info("[JobId: {}] {} started.", jobId, stage);

        StageOutcome outcome;
        try {
            outcome = process(claimed.get());
        } catch (Exception e) {
            log.error("[JobId: {}] {} failed.", jobId, stage, e);
            outcome = StageOutcome.failure(describe(e));
        }
        record(jobId, outcome);
    }

    private void record(String jobId, StageOutcome outcome) {
        switch (outcome.getType()) {
            case ADVANCE -> advance(jobId, outcome);
            case COMPLETE -> {
                if (!jobQueueManager.completeJob(jobId, outcome.getOutputRef())) {
                    discardOutput(jobId, outcome.getOutputRef());
                }
            }
            case FAILURE -> jobQueueManager.failJob(jobId, outcome.getReason());
            case ABORTED -> log.info("[JobId: {}] {} abandoned: {}", jobId, stage, outcome.getReason());
        }
    }

    private void advance(String jobId, StageOutcome outcome) {
        PipelineStage next = stage.next()
                .orElseThrow(() -> new IllegalStateException(stage + " has no next stage to advance to"));
        Optional<TranslationJob> advanced = jobQueueManager.modifyJob(jobId,
                job -> job.getStatus() == stage.getWorkingStatus(), job -> {
                    outcome.getUpdates().accept(job);
                    job.setStatus(next.getEntryStatus());
                    job.setProgress(completionProgress());
                });
        if (advanced.isEmpty()) {
            log.info("[JobId: {}] {} result dropped: the job left {} while it was running.", jobId, stage,
                    stage.getWorkingStatus());
            return;
        }

        try {
            jobQueueManager.enqueue(next, jobId);
            log.info("[JobId: {}] {} finished; handed to {}.", jobId, stage, next);
        } catch (QueueAccessException e) {
            log.error("[JobId: {}] Could not enqueue for {}.", jobId, next, e);
            jobQueueManager.failJob(jobId, "Failed to enqueue job for " + next.key() + ": " + e.getMessage());
        }
    }

    /**
     * Called when a completion was not recorded because the job had already become terminal, typically
     * through a cancellation that landed while the stage ran.
     */
    protected void discardOutput(String jobId, String outputRef) {
        log.info("[JobId: {}] {} output {} not recorded: the job is already terminal.", jobId, stage, outputRef);
    }

    private boolean isWaitingForStage(TranslationJob job) {
        return stage.isAwaitedBy(job);
    }

    private boolean pauseAfterError() {
        try {
            Thread.sleep(pollTimeout.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
