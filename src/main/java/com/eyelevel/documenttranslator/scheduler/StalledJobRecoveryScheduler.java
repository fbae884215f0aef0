package com.eyelevel.documenttranslator.scheduler;

import com.eyelevel.documenttranslator.exception.QueueAccessException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.store.JobRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A scheduler for jobs whose record has not been written for a while. A job still at a stage's entry status
 * may be waiting behind a backlog or may have been lost between the record write and the enqueue, so it is
 * enqueued again; workers skip the duplicate entry. A job held by a worker in its working status is marked
 * {@code FAILED}. Records are never deleted here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalledJobRecoveryScheduler {

    private final JobRecordStore jobRecordStore;
    private final JobQueueManager jobQueueManager;

    @Value("${app.scheduler.stalled-job-threshold-minutes:60}")
    private long stalledThresholdMinutes;

    @Scheduled(cron = "${app.scheduler.stalled-job}")
    public void failStalledJobs() {
        sweep(Instant.now());
    }

    /**
     * Handles every non-terminal job whose record has not been written for the configured number of
     * minutes before {@code now}.
     *
     * @return the number of jobs failed by this run. Re-enqueued jobs are not counted.
     */
    public int sweep(final Instant now) {
        final Instant threshold = now.minus(Duration.ofMinutes(stalledThresholdMinutes));
        log.info("Running stalled job sweep. Finding active jobs not updated since {}.", threshold);

        final List<TranslationJob> stalledJobs = jobRecordStore.listStalled(threshold);
        if (CollectionUtils.isEmpty(stalledJobs)) {
            log.info("No stalled jobs found.");
            return 0;
        }

        log.warn("Found {} idle jobs.", stalledJobs.size());
        int failed = 0;
        int requeued = 0;
        for (final TranslationJob job : stalledJobs) {
            final Optional<PipelineStage> awaited = PipelineStage.awaitedBy(job);
            if (awaited.isPresent()) {
                if (requeue(job, awaited.get(), threshold)) {
                    requeued++;
                }
            } else if (fail(job, threshold)) {
                failed++;
            }
        }
        log.info("Finished stalled job sweep. Re-enqueued {} and marked {} jobs as FAILED.", requeued, failed);
        return failed;
    }

    private boolean requeue(final TranslationJob job, final PipelineStage stage, final Instant threshold) {
        // The write refreshes updatedAt so the next sweep does not enqueue the job again.
        final boolean touched = jobQueueManager.modifyJob(job.getJobId(),
                current -> stage.isAwaitedBy(current) && current.getUpdatedAt().isBefore(threshold),
                current -> { }).isPresent();
        if (!touched) {
            return false;
        }
        try {
            jobQueueManager.enqueue(stage, job.getJobId());
            log.warn("[JobId: {}] Waiting for {} since {}. Enqueued again.", job.getJobId(), stage,
                    job.getUpdatedAt());
            return true;
        } catch (QueueAccessException e) {
            log.error("[JobId: {}] Could not enqueue again for {}. Will retry on a later sweep.", job.getJobId(),
                    stage, e);
            return false;
        }
    }

    private boolean fail(final TranslationJob job, final Instant threshold) {
        final String reason = String.format("Job stalled: no progress for %d minutes", stalledThresholdMinutes);
        // A worker may have written the record since the query; only fail it if it is still stalled.
        final boolean applied = jobQueueManager.modifyJob(job.getJobId(),
                current -> !current.isTerminal() && PipelineStage.awaitedBy(current).isEmpty()
                        && current.getUpdatedAt().isBefore(threshold),
                current -> {
                    current.setStatus(JobStatus.FAILED);
                    current.setError(reason);
                }).isPresent();
        if (applied) {
            log.warn("[JobId: {}] Stalled in {} since {}. Marked as FAILED.", job.getJobId(), job.getStatus(),
                    job.getUpdatedAt());
        }
        return applied;
    }
}
