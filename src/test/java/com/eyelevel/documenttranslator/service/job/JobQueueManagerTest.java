package com.eyelevel.documenttranslator.service.job;

import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.config.StageQueueConfig;
import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.exception.JobStateConflictException;
import com.eyelevel.documenttranslator.exception.QueueAccessException;
import com.eyelevel.documenttranslator.exception.StaleJobRevisionException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.eyelevel.documenttranslator.queue.StageQueue;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.notification.TaskExecutionNotifier;
import com.eyelevel.documenttranslator.store.InMemoryJobRecordStore;
import com.eyelevel.documenttranslator.store.JobRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobQueueManagerTest {

    private InMemoryJobRecordStore jobRecordStore;
    private StageQueues stageQueues;
    private JobQueueManager jobQueueManager;

    @BeforeEach
    void setUp() {
        jobRecordStore = new InMemoryJobRecordStore();
        stageQueues = new StageQueueConfig().inMemoryStageQueues(new PipelineProperties());
        jobQueueManager = new JobQueueManager(jobRecordStore, stageQueues, Optional.empty(), new PipelineProperties());
    }

    @Test
    void testCreateJob_StoresPendingRecordAndEnqueuesForExtraction() throws InterruptedException {
        // When
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getProgress()).isZero();
        assertThat(jobQueueManager.getJob(job.getJobId())).isPresent();
        assertThat(stageQueues.get(PipelineStage.EXTRACTION).pop(Duration.ZERO)).contains(job.getJobId());
    }

    @Test
    void testCreateJob_ConcurrentCallsYieldDistinctIds() throws Exception {
        // Given
        int callers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            tasks.add(() -> jobQueueManager.createJob("/data/uploads/x.txt", "en", "vi", TranslationTier.BASIC)
                    .getJobId());
        }

        // When
        List<String> ids = new ArrayList<>();
        try {
            for (Future<String> future : pool.invokeAll(tasks)) {
                ids.add(future.get());
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertThat(Set.copyOf(ids)).hasSize(callers);
        assertThat(jobQueueManager.queueStatus().get(PipelineStage.EXTRACTION)).isEqualTo(callers);
    }

    @Test
    void testCreateJob_EnqueueFailureMarksJobFailed() {
        // Given
        StageQueue brokenQueue = mock(StageQueue.class);
        doThrow(new QueueAccessException("queue unreachable")).when(brokenQueue).push(any());
        Map<PipelineStage, StageQueue> queues = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            queues.put(stage, brokenQueue);
        }
        JobQueueManager manager = new JobQueueManager(jobRecordStore, new StageQueues(queues), Optional.empty(),
                new PipelineProperties());

        // When / Then
        assertThatThrownBy(() -> manager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD))
                .isInstanceOf(QueueAccessException.class);
        assertThat(manager.activeJobs(10)).isEmpty();
    }

    @Test
    void testCreateJob_NotifierFailureDoesNotFailJob() {
        // Given
        TaskExecutionNotifier notifier = mock(TaskExecutionNotifier.class);
        doThrow(new IllegalStateException("notification queue missing")).when(notifier).jobCreated(any());
        JobQueueManager manager = new JobQueueManager(jobRecordStore, stageQueues, Optional.of(notifier),
                new PipelineProperties());

        // When
        TranslationJob job = manager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);

        // Then
        verify(notifier).jobCreated(any());
        assertThat(manager.requireJob(job.getJobId()).getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void testUpdateProgress_NeverDecreasesAndCapsPages() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD,
                3, "a.txt");
        jobQueueManager.updateProgress(job.getJobId(), 50.0, 2);

        // When
        TranslationJob afterLower = jobQueueManager.updateProgress(job.getJobId(), 20.0, 1).orElseThrow();
        TranslationJob afterOverflow = jobQueueManager.updateProgress(job.getJobId(), 60.0, 9).orElseThrow();

        // Then
        assertThat(afterLower.getProgress()).isEqualTo(50.0);
        assertThat(afterLower.getProcessedPages()).isEqualTo(2);
        assertThat(afterOverflow.getProgress()).isEqualTo(60.0);
        assertThat(afterOverflow.getProcessedPages()).isEqualTo(3);
    }

    @Test
    void testUpdateProgress_IgnoredOnceTerminal() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);
        jobQueueManager.failJob(job.getJobId(), "boom");

        // When
        Optional<TranslationJob> result = jobQueueManager.updateProgress(job.getJobId(), 70.0, null);

        // Then
        assertThat(result).isEmpty();
        assertThat(jobQueueManager.requireJob(job.getJobId()).getProgress()).isZero();
    }

    @Test
    void testFailJob_RecordsReasonAndLeavesNoOutput() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);

        // When
        boolean first = jobQueueManager.failJob(job.getJobId(), "Extraction produced no text from a.txt");
        boolean second = jobQueueManager.failJob(job.getJobId(), "later failure");

        // Then
        TranslationJob stored = jobQueueManager.requireJob(job.getJobId());
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getError()).isEqualTo("Extraction produced no text from a.txt");
        assertThat(stored.getFinalOutput()).isNull();
    }

    @Test
    void testCompleteJob_SetsOutputAndFullProgress() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD,
                4, "a.txt");

        // When
        boolean completed = jobQueueManager.completeJob(job.getJobId(), "/data/outputs/x_translated.txt");

        // Then
        TranslationJob stored = jobQueueManager.requireJob(job.getJobId());
        assertThat(completed).isTrue();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.getProgress()).isEqualTo(100.0);
        assertThat(stored.getProcessedPages()).isEqualTo(4);
        assertThat(stored.getFinalOutput()).isEqualTo("/data/outputs/x_translated.txt");
    }

    @Test
    void testCancelJob_InFlightJobBecomesFailed() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);
        jobQueueManager.modifyJob(job.getJobId(), j -> true, j -> {
            j.setStatus(JobStatus.TRANSLATING);
            j.setProgress(55.0);
        });

        // When
        TranslationJob cancelled = jobQueueManager.cancelJob(job.getJobId());

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.getError()).isEqualTo(JobQueueManager.CANCELLED_BY_USER);
        assertThat(jobQueueManager.completeJob(job.getJobId(), "/late/output.txt")).isFalse();
        assertThat(jobQueueManager.requireJob(job.getJobId()).getFinalOutput()).isNull();
    }

    @Test
    void testCancelJob_CompletedJobRejected() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);
        jobQueueManager.completeJob(job.getJobId(), "/data/outputs/out.txt");

        // When / Then
        assertThatThrownBy(() -> jobQueueManager.cancelJob(job.getJobId()))
                .isInstanceOf(JobStateConflictException.class)
                .hasMessage("Cannot cancel completed job");
        assertThat(jobQueueManager.requireJob(job.getJobId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void testCancelJob_FailedJobRejected() {
        // Given
        TranslationJob job = jobQueueManager.createJob("/data/uploads/a.txt", "auto", "vi", TranslationTier.STANDARD);
        jobQueueManager.failJob(job.getJobId(), "provider down");

        // When / Then
        assertThatThrownBy(() -> jobQueueManager.cancelJob(job.getJobId()))
                .isInstanceOf(JobStateConflictException.class)
                .hasMessage("Job already failed");
    }

    @Test
    void testCancelJob_UnknownJob() {
        assertThatThrownBy(() -> jobQueueManager.cancelJob("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void testQueueStatus_CountsEnqueuedIdsPerStage() {
        // Given
        jobQueueManager.enqueue(PipelineStage.TRANSLATION, "a");
        jobQueueManager.enqueue(PipelineStage.TRANSLATION, "b");
        jobQueueManager.enqueue(PipelineStage.RECONSTRUCTION, "c");

        // When
        Map<PipelineStage, Long> status = jobQueueManager.queueStatus();

        // Then
        assertThat(status).containsExactly(
                Map.entry(PipelineStage.EXTRACTION, 0L),
                Map.entry(PipelineStage.CHUNKING, 0L),
                Map.entry(PipelineStage.TRANSLATION, 2L),
                Map.entry(PipelineStage.RECONSTRUCTION, 1L));
    }

    @Test
    void testDeleteJob_UnknownJob() {
        assertThatThrownBy(() -> jobQueueManager.deleteJob("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void testModifyJob_RetriesAfterRevisionConflict() {
        // Given
        JobRecordStore store = mock(JobRecordStore.class);
        TranslationJob stored = TranslationJob.builder().jobId("job-1").status(JobStatus.TRANSLATING)
                .tier(TranslationTier.STANDARD).progress(40.0).revision(3L).build();
        when(store.get("job-1")).thenAnswer(invocation -> Optional.of(stored.toBuilder().build()));
        when(store.put(any()))
                .thenThrow(new StaleJobRevisionException("conflict"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        JobQueueManager manager = new JobQueueManager(store, stageQueues, Optional.empty(), new PipelineProperties());

        // When
        Optional<TranslationJob> result = manager.updateProgress("job-1", 45.0, null);

        // Then
        assertThat(result).map(TranslationJob::getProgress).contains(45.0);
        verify(store, times(2)).put(any());
    }

    @Test
    void testModifyJob_GivesUpAfterMaxAttempts() {
        // Given
        JobRecordStore store = mock(JobRecordStore.class);
        TranslationJob stored = TranslationJob.builder().jobId("job-1").status(JobStatus.TRANSLATING)
                .tier(TranslationTier.STANDARD).revision(3L).build();
        when(store.get("job-1")).thenAnswer(invocation -> Optional.of(stored.toBuilder().build()));
        when(store.put(any())).thenThrow(new StaleJobRevisionException("conflict"));
        PipelineProperties properties = new PipelineProperties();
        properties.getStore().setMaxWriteAttempts(2);
        JobQueueManager manager = new JobQueueManager(store, stageQueues, Optional.empty(), properties);

        // When / Then
        assertThatThrownBy(() -> manager.failJob("job-1", "boom")).isInstanceOf(StaleJobRevisionException.class);
        verify(store, times(2)).put(any());
    }

    @Test
    void testUpdateJob_StaleCopyIsRejected() {
        // Given
        TranslationJob created = jobQueueManager.createJob("/data/uploads/a.txt", "en", "vi", TranslationTier.STANDARD);
        TranslationJob first = jobQueueManager.requireJob(created.getJobId());
        TranslationJob second = jobQueueManager.requireJob(created.getJobId());
        first.setTotalPages(7);

        // When
        TranslationJob stored = jobQueueManager.updateJob(first);

        // Then
        assertThat(stored.getRevision()).isEqualTo(first.getRevision() + 1);
        assertThat(stored.getUpdatedAt()).isAfterOrEqualTo(created.getUpdatedAt());
        second.setTotalPages(9);
        assertThatThrownBy(() -> jobQueueManager.updateJob(second)).isInstanceOf(StaleJobRevisionException.class);
        assertThat(jobQueueManager.requireJob(created.getJobId()).getTotalPages()).isEqualTo(7);
    }
}
