package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.common.json.jackson.JacksonJsonParser;
import com.eyelevel.documenttranslator.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.config.StageQueueConfig;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import com.eyelevel.documenttranslator.exception.TranslationProviderException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.TranslationTier;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.extraction.factory.DocumentExtractorFactory;
import com.eyelevel.documenttranslator.service.extraction.impl.PlainTextDocumentExtractor;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import com.eyelevel.documenttranslator.service.translation.TextChunker;
import com.eyelevel.documenttranslator.store.InMemoryJobRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Runs jobs through the four real stage workers on in-memory queues, one poll at a time.
 */
class TranslationPipelineTest {

    @TempDir
    Path tempDir;

    private InMemoryJobRecordStore jobRecordStore;
    private StageQueues stageQueues;
    private JobQueueManager jobQueueManager;
    private LocalArtifactStorage artifactStorage;
    private StubTranslationProvider translationProvider;
    private TranslationProperties translationProperties;
    private PipelineProperties pipelineProperties;
    private JacksonJsonParser jsonParser;
    private List<StageWorker> workers;

    @BeforeEach
    void setUp() {
        pipelineProperties = new PipelineProperties();
        pipelineProperties.setPollTimeout(Duration.ofMillis(10));
        DocumentTranslationConfig config = new DocumentTranslationConfig();
        config.getStorage().setUploadDir(tempDir.resolve("uploads").toString());
        config.getStorage().setArtifactDir(tempDir.resolve("artifacts").toString());
        config.getStorage().setOutputDir(tempDir.resolve("outputs").toString());

        jobRecordStore = new InMemoryJobRecordStore();
        stageQueues = new StageQueueConfig().inMemoryStageQueues(pipelineProperties);
        jobQueueManager = new JobQueueManager(jobRecordStore, stageQueues, Optional.empty(), pipelineProperties);
        artifactStorage = new LocalArtifactStorage(config);
        translationProvider = new StubTranslationProvider();
        translationProperties = new TranslationProperties();

        ObjectMapper objectMapper = new ObjectMapper();
        jsonParser = new JacksonJsonParser(objectMapper);
        JacksonJsonSerializer jsonSerializer = new JacksonJsonSerializer(objectMapper);
        DocumentExtractorFactory extractorFactory = new DocumentExtractorFactory(
                List.of(new PlainTextDocumentExtractor()));

        workers = List.of(
                new ExtractionWorker(jobQueueManager, stageQueues, pipelineProperties, extractorFactory,
                        artifactStorage, jsonSerializer),
                new ChunkingWorker(jobQueueManager, stageQueues, pipelineProperties, artifactStorage),
                new TranslationWorker(jobQueueManager, stageQueues, pipelineProperties, translationProperties,
                        artifactStorage, new TextChunker(translationProperties), translationProvider, jsonParser,
                        jsonSerializer),
                new ReconstructionWorker(jobQueueManager, stageQueues, pipelineProperties, artifactStorage,
                        jsonParser));
    }

    @Test
    void testThreePageTextDocument_CompletesThroughEveryStage() throws Exception {
        // Given
        Path source = writeUpload("report.txt", "Page one text.\fPage two text.\fPage three text.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "auto", "vi", TranslationTier.STANDARD,
                3, "report.txt");

        // When
        drainQueues();

        // Then
        TranslationJob done = jobQueueManager.requireJob(job.getJobId());
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getProgress()).isEqualTo(100.0);
        assertThat(done.getProcessedPages()).isEqualTo(3);
        assertThat(done.getError()).isNull();

        assertThat(statusSequence(job.getJobId())).containsExactly(JobStatus.PENDING, JobStatus.EXTRACTING,
                JobStatus.CHUNKING, JobStatus.TRANSLATING, JobStatus.RECONSTRUCTING, JobStatus.COMPLETED);

        List<Double> progress = progressSequence(job.getJobId());
        assertThat(progress).isSorted();
        assertThat(progress).contains(0.0, 10.0, 25.0, 30.0, 40.0, 80.0, 85.0, 100.0);

        String output = artifactStorage.read(done.getFinalOutput());
        assertThat(output).isEqualTo("""
                ==================== Page 1 ====================
                [vi] Page one text.

                ==================== Page 2 ====================
                [vi] Page two text.

                ==================== Page 3 ====================
                [vi] Page three text.""");
        assertThat(done.getFinalOutput()).endsWith(job.getJobId() + "_translated.txt");
        assertThat(translationProvider.batchCalls.get()).isEqualTo(1);
        assertThat(translationProvider.singleCalls.get()).isZero();
        assertThat(jobQueueManager.queueStatus().values()).containsOnly(0L);
    }

    @Test
    void testExtractionWithoutText_FailsAtExtraction() throws Exception {
        // Given
        Path source = writeUpload("blank.txt", "   \f\n\n  ");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "auto", "vi", TranslationTier.STANDARD);

        // When
        drainQueues();

        // Then
        TranslationJob failed = jobQueueManager.requireJob(job.getJobId());
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("Extraction produced no text from " + source.getFileName());
        assertThat(failed.getProgress()).isBetween(10.0, 25.0);
        assertThat(failed.getFinalOutput()).isNull();
        assertThat(statusSequence(job.getJobId()))
                .containsExactly(JobStatus.PENDING, JobStatus.EXTRACTING, JobStatus.FAILED);
        assertThat(translationProvider.batchCalls.get() + translationProvider.singleCalls.get()).isZero();
    }

    @Test
    void testBatchFailure_FallsBackToPerChunkCalls() throws Exception {
        // Given
        translationProvider.failBatches();
        Path source = writeUpload("two.txt", "First page.\fSecond page.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "fr", TranslationTier.BASIC);

        // When
        drainQueues();

        // Then
        TranslationJob done = jobQueueManager.requireJob(job.getJobId());
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(translationProvider.batchCalls.get()).isEqualTo(1);
        assertThat(translationProvider.singleCalls.get()).isEqualTo(2);
        assertThat(artifactStorage.read(done.getFinalOutput())).contains("[fr] First page.", "[fr] Second page.");
    }

    @Test
    void testProviderError_RecordedVerbatimOnJob() throws Exception {
        // Given
        translationProperties.setBatchThreshold(0);
        translationProvider.failTranslationsWith(new TranslationProviderException("Google Translate returned HTTP 503"));
        Path source = writeUpload("one.txt", "Only page.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "vi", TranslationTier.STANDARD);

        // When
        drainQueues();

        // Then
        TranslationJob failed = jobQueueManager.requireJob(job.getJobId());
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("Google Translate returned HTTP 503");
        assertThat(failed.getFinalOutput()).isNull();
        assertThat(failed.getProgress()).isEqualTo(40.0);
    }

    @Test
    void testCancellationDuringTranslation_DropsStageResult() throws Exception {
        // Given
        translationProperties.setBatchThreshold(0);
        Path source = writeUpload("long.txt", "Page A.\fPage B.\fPage C.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "vi", TranslationTier.STANDARD);
        translationProvider.beforeTranslate(() -> {
            if (!jobQueueManager.requireJob(job.getJobId()).isTerminal()) {
                jobQueueManager.cancelJob(job.getJobId());
            }
        });

        // When
        drainQueues();

        // Then
        TranslationJob cancelled = jobQueueManager.requireJob(job.getJobId());
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.getError()).isEqualTo(JobQueueManager.CANCELLED_BY_USER);
        assertThat(cancelled.getTranslationOutput()).isNull();
        assertThat(cancelled.getFinalOutput()).isNull();
        assertThat(translationProvider.singleCalls.get()).isEqualTo(1);
        assertThat(stageQueues.get(PipelineStage.RECONSTRUCTION).size()).isZero();
        assertThat(statusSequence(job.getJobId())).endsWith(JobStatus.FAILED);
    }

    @Test
    void testCancellationDuringReconstruction_DeletesOutputFile() throws Exception {
        // Given
        Path source = writeUpload("late.txt", "Last page.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "vi", TranslationTier.STANDARD);
        LocalArtifactStorage cancellingStorage = spy(artifactStorage);
        doAnswer(invocation -> {
            Object outputRef = invocation.callRealMethod();
            jobQueueManager.cancelJob(job.getJobId());
            return outputRef;
        }).when(cancellingStorage).writeOutput(eq(job.getJobId()), anyString());
        ReconstructionWorker reconstruction = new ReconstructionWorker(jobQueueManager, stageQueues,
                pipelineProperties, cancellingStorage, jsonParser);
        for (StageWorker worker : workers.subList(0, 3)) {
            while (worker.pollOnce()) {
                // drain
            }
        }

        // When
        boolean popped = reconstruction.pollOnce();

        // Then
        assertThat(popped).isTrue();
        TranslationJob cancelled = jobQueueManager.requireJob(job.getJobId());
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.getError()).isEqualTo(JobQueueManager.CANCELLED_BY_USER);
        assertThat(cancelled.getFinalOutput()).isNull();
        assertThat(tempDir.resolve("outputs").resolve(job.getJobId() + "_translated.txt")).doesNotExist();
    }

    @Test
    void testDuplicateQueueEntries_AreSkipped() throws Exception {
        // Given
        Path source = writeUpload("dup.txt", "Hello.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "vi", TranslationTier.STANDARD);
        workers.get(0).pollOnce();
        jobQueueManager.enqueue(PipelineStage.EXTRACTION, job.getJobId());
        jobQueueManager.enqueue(PipelineStage.CHUNKING, job.getJobId());

        // When
        drainQueues();
        int writesAfterCompletion = jobRecordStore.history(job.getJobId()).size();
        jobQueueManager.enqueue(PipelineStage.RECONSTRUCTION, job.getJobId());
        drainQueues();

        // Then
        assertThat(jobQueueManager.requireJob(job.getJobId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(statusSequence(job.getJobId())).containsExactly(JobStatus.PENDING, JobStatus.EXTRACTING,
                JobStatus.CHUNKING, JobStatus.TRANSLATING, JobStatus.RECONSTRUCTING, JobStatus.COMPLETED);
        assertThat(jobRecordStore.history(job.getJobId())).hasSize(writesAfterCompletion);
        assertThat(translationProvider.batchCalls.get()).isEqualTo(1);
    }

    @Test
    void testDeletedJob_QueueEntryIsIgnored() throws Exception {
        // Given
        Path source = writeUpload("gone.txt", "Hello.");
        TranslationJob job = jobQueueManager.createJob(source.toString(), "en", "vi", TranslationTier.STANDARD);
        jobQueueManager.deleteJob(job.getJobId());

        // When
        boolean popped = workers.get(0).pollOnce();

        // Then
        assertThat(popped).isTrue();
        assertThat(jobQueueManager.getJob(job.getJobId())).isEmpty();
        assertThat(stageQueues.get(PipelineStage.CHUNKING).size()).isZero();
    }

    private Path writeUpload(String name, String content) throws IOException {
        Path uploads = Files.createDirectories(tempDir.resolve("uploads"));
        return Files.writeString(uploads.resolve(name), content, StandardCharsets.UTF_8);
    }

    private void drainQueues() throws InterruptedException {
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (StageWorker worker : workers) {
                while (worker.pollOnce()) {
                    progressed = true;
                }
            }
        }
    }

    private List<JobStatus> statusSequence(String jobId) {
        List<JobStatus> statuses = new ArrayList<>();
        for (TranslationJob state : jobRecordStore.history(jobId)) {
            if (statuses.isEmpty() || statuses.get(statuses.size() - 1) != state.getStatus()) {
                statuses.add(state.getStatus());
            }
        }
        return statuses;
    }

    private List<Double> progressSequence(String jobId) {
        return jobRecordStore.history(jobId).stream().map(TranslationJob::getProgress).toList();
    }
}
