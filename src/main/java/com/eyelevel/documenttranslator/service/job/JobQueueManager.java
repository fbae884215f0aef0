package com.eyelevel.documenttranslator.service.job;

import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.exception.JobStateConflictException;
import com.eyelevel.documenttranslator.exception.QueueAccessException;
import com.eyelevel.documenttranslator.exception.StaleJobRevisionException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.notification.TaskExecutionNotifier;
import com.eyelevel.documenttranslator.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Entry point for creating jobs and the single gateway through which the rest of the application
 * reads and writes job records and stage queues.
 * <p>
 * Every mutation is a guarded read-modify-write: the record is re-read, a guard is evaluated against its
 * current state, the change is applied to the full record, and the record is written back with its revision.
 * A revision conflict re-runs the whole cycle. Guards are how late writers lose to cancellation: once a job
 * is terminal, no guarded write goes through.
 */
@Slf4j
@Service
public class JobQueueManager {

    public static final String CANCELLED_BY_USER = "Cancelled by user";

    private final JobRecordStore jobRecordStore;
    private final StageQueues stageQueues;
    private final Optional<TaskExecutionNotifier> taskExecutionNotifier;
    private final int maxWriteAttempts;

    public JobQueueManager(final JobRecordStore jobRecordStore, final StageQueues stageQueues,
                           final Optional<TaskExecutionNotifier> taskExecutionNotifier,
                           final PipelineProperties pipelineProperties) {
        this.jobRecordStore = jobRecordStore;
        this.stageQueues = stageQueues;
        this.taskExecutionNotifier = taskExecutionNotifier;
        this.maxWriteAttempts = Math.max(1, pipelineProperties.getStore().getMaxWriteAttempts());
    }

    public TranslationJob createJob(final String sourcePath, final String sourceLang, final String targetLang,
                                    final TranslationTier tier) {
        return createJob(sourcePath, sourceLang, targetLang, tier, 0, null);
    }

    /**
     * Creates a job in {@code PENDING} state and enqueues it for extraction.
     * <p>
     * The record is written before the enqueue. If the enqueue fails the job is marked {@code FAILED} so it
     * does not sit in {@code PENDING} forever, and the queue error is rethrown to the caller.
     *
     * @param sourcePath       Location of the stored upload.
     * @param sourceLang       Normalized source language code, or {@code auto}.
     * @param targetLang       Normalized target language code.
     * @param tier             Requested translation tier.
     * @param totalPages       Page estimate made at submission; extraction replaces it with the real count.
     * @param originalFilename Client-side file name, for display only. May be null.
     * @return The created record.
     * @throws QueueAccessException if the extraction queue cannot be reached.
     */
    public TranslationJob createJob(final String sourcePath, final String sourceLang, final String targetLang,
                                    final TranslationTier tier, final int totalPages, final String originalFilename) {
        final String jobId = UUID.randomUUID().toString();
        final TranslationJob job = jobRecordStore.create(TranslationJob.builder()
                .jobId(jobId)
                .sourcePath(sourcePath)
                .originalFilename(originalFilename)
                .sourceLang(sourceLang)
                .targetLang(targetLang)
                .tier(tier)
                .status(JobStatus.PENDING)
                .progress(ProgressWeights.CREATED)
                .totalPages(Math.max(0, totalPages))
                .processedPages(0)
                .build());
        log.info("[JobId: {}] Created translation job for '{}' ({} -> {}, tier {}).", jobId,
                originalFilename != null ? originalFilename : sourcePath, sourceLang, targetLang, tier.getValue());

        try {
            enqueue(PipelineStage.EXTRACTION, jobId);
        } catch (QueueAccessException e) {
            log.error("[JobId: {}] Could not enqueue new job for extraction.", jobId, e);
            failJob(jobId, "Failed to enqueue job for extraction: " + e.getMessage());
            throw e;
        }

        notifyTaskExecution(job);
        return job;
    }

    public Optional<TranslationJob> getJob(final String jobId) {
        return jobRecordStore.get(jobId);
    }

    /**
     * @throws JobNotFoundException if no record exists for {@code jobId}.
     */
    public TranslationJob requireJob(final String jobId) {
        return jobRecordStore.get(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    }

    /**
     * Full-record overwrite of a record previously read through this manager.
     *
     * @throws StaleJobRevisionException if the record changed since it was read.
     */
    public TranslationJob updateJob(final TranslationJob job) {
        return jobRecordStore.put(job);
    }

    /**
     * Raises the job's progress and, optionally, its processed page count. Neither value ever decreases:
     * a lower progress is logged and ignored. Processed pages are capped at the known total.
     *
     * @param processedPages New processed page count, or null to leave it unchanged.
     * @return The updated record, or empty if the job is already terminal and was left untouched.
     */
    public Optional<TranslationJob> updateProgress(final String jobId, final double progress,
                                                   final Integer processedPages) {
        return modifyJob(jobId, job -> !job.isTerminal(), job -> {
            job.setProgress(clampProgress(progress));
            if (processedPages != null) {
                int pages = Math.max(job.getProcessedPages(), processedPages);
                if (job.getTotalPages() > 0) {
                    pages = Math.min(pages, job.getTotalPages());
                }
                job.setProcessedPages(pages);
            }
        });
    }

    /**
     * Marks a job {@code FAILED} with {@code reason}. Terminal jobs are left unchanged.
     *
     * @return true if this call moved the job to {@code FAILED}.
     */
    public boolean failJob(final String jobId, final String reason) {
        final Optional<TranslationJob> failed = modifyJob(jobId, job -> !job.isTerminal(), job -> {
            job.setStatus(JobStatus.FAILED);
            job.setError(reason);
        });
        if (failed.isPresent()) {
            log.warn("[JobId: {}] Job marked as FAILED. Reason: {}", jobId, reason);
            return true;
        }
        log.warn("[JobId: {}] Attempted to fail a job that is already terminal. No action taken.", jobId);
        return false;
    }

    /**
     * Records the final output and marks the job {@code COMPLETED}. Terminal jobs are left unchanged,
     * which is how a cancellation that lands during reconstruction wins.
     *
     * @return true if this call completed the job.
     */
    public boolean completeJob(final String jobId, final String outputRef) {
        final Optional<TranslationJob> completed = modifyJob(jobId, job -> !job.isTerminal(), job -> {
            job.setFinalOutput(outputRef);
            job.setProgress(ProgressWeights.COMPLETE);
            if (job.getTotalPages() > 0) {
                job.setProcessedPages(job.getTotalPages());
            }
            job.setStatus(JobStatus.COMPLETED);
        });
        if (completed.isPresent()) {
            log.info("[JobId: {}] Job COMPLETED. Output: {}", jobId, outputRef);
            return true;
        }
        log.warn("[JobId: {}] Attempted to complete a job that is already terminal. No action taken.", jobId);
        return false;
    }

    /**
     * Cancels an in-flight job by moving it to {@code FAILED}. Cancellation is cooperative: the worker holding
     * the job notices on its next guarded write and drops its result.
     *
     * @return The cancelled record.
     * @throws JobNotFoundException      if the job does not exist.
     * @throws JobStateConflictException if the job is already completed or failed.
     */
    public TranslationJob cancelJob(final String jobId) {
        final Optional<TranslationJob> cancelled = modifyJob(jobId, job -> {
            rejectIfTerminal(job);
            return true;
        }, job -> {
            job.setStatus(JobStatus.FAILED);
            job.setError(CANCELLED_BY_USER);
        });
        log.info("[JobId: {}] Job cancelled by user.", jobId);
        return cancelled.orElseThrow(() -> new IllegalStateException("Cancellation of job " + jobId + " not applied"));
    }

    /**
     * @return number of job ids waiting in each stage queue, in pipeline order.
     */
    public Map<PipelineStage, Long> queueStatus() {
        return stageQueues.pendingCounts();
    }

    public List<TranslationJob> activeJobs(final int limit) {
        return jobRecordStore.listActive(limit);
    }

    /**
     * Administrative removal of a job record. Stale queue entries for the job are skipped by workers.
     *
     * @throws JobNotFoundException if the job does not exist.
     */
    public void deleteJob(final String jobId) {
        if (!jobRecordStore.delete(jobId)) {
            throw new JobNotFoundException("Job not found: " + jobId);
        }
        log.warn("ADMIN ACTION: [JobId: {}] Job record deleted.", jobId);
    }

    public void enqueue(final PipelineStage stage, final String jobId) {
        stageQueues.get(stage).push(jobId);
        log.debug("[JobId: {}] Enqueued for {}.", jobId, stage);
    }

    /**
     * Guarded read-modify-write of one job record.
     *
     * @param guard    Evaluated against the freshly read record; the write is skipped when it returns false.
     *                 It may also throw to abort with an error.
     * @param mutation Applied to the freshly read record before it is written back.
     * @return The stored record, or empty if the guard rejected the write.
     * @throws JobNotFoundException      if the job does not exist.
     * @throws StaleJobRevisionException if every attempt lost a revision race.
     */
    public Optional<TranslationJob> modifyJob(final String jobId, final Predicate<TranslationJob> guard,
                                              final Consumer<TranslationJob> mutation) {
        for (int attempt = 1; ; attempt++) {
            final TranslationJob current = requireJob(jobId);
            if (!guard.test(current)) {
                return Optional.empty();
            }
            final double storedProgress = current.getProgress();
            mutation.accept(current);
            if (current.getProgress() < storedProgress) {
                log.warn("[JobId: {}] Ignoring progress decrease from {} to {}.", jobId, storedProgress,
                        current.getProgress());
                current.setProgress(storedProgress);
            }

            try {
                return Optional.of(jobRecordStore.put(current));
            } catch (StaleJobRevisionException e) {
                if (attempt >= maxWriteAttempts) {
                    log.error("[JobId: {}] Giving up after {} conflicting write attempts.", jobId, attempt);
                    throw e;
                }
                log.debug("[JobId: {}] Revision conflict on attempt {}. Re-reading record.", jobId, attempt);
            }
        }
    }

    private void notifyTaskExecution(final TranslationJob job) {
        taskExecutionNotifier.ifPresent(notifier -> {
            try {
                notifier.jobCreated(job);
            } catch (RuntimeException e) {
                // The job is already enqueued; workers pick it up regardless.
                log.warn("[JobId: {}] Task execution notification failed. Job remains queued.", job.getJobId(), e);
            }
        });
    }

    private static void rejectIfTerminal(final TranslationJob job) {
        if (job.getStatus() == JobStatus.COMPLETED) {
            throw new JobStateConflictException("Cannot cancel completed job");
        }
        if (job.getStatus() == JobStatus.FAILED) {
            throw new JobStateConflictException("Job already failed");
        }
    }

    private static double clampProgress(final double progress) {
        return Math.max(ProgressWeights.CREATED, Math.min(ProgressWeights.COMPLETE, progress));
    }
}
