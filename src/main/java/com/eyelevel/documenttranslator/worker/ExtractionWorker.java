package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.common.json.JsonSerializer;
import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.exception.UnsupportedFileTypeException;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.extraction.DocumentExtractor;
import com.eyelevel.documenttranslator.service.extraction.factory.DocumentExtractorFactory;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.job.ProgressWeights;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads the stored upload page by page and writes the pages as the {@code extraction.json} artifact.
 * Progress moves from 10 to 25 as pages are read.
 */
@Slf4j
@Component
public class ExtractionWorker extends StageWorker {

    static final String ARTIFACT_NAME = "extraction.json";

    private final DocumentExtractorFactory extractorFactory;
    private final LocalArtifactStorage artifactStorage;
    private final JsonSerializer jsonSerializer;

    public ExtractionWorker(JobQueueManager jobQueueManager, StageQueues stageQueues,
                            PipelineProperties pipelineProperties, DocumentExtractorFactory extractorFactory,
                            LocalArtifactStorage artifactStorage,
                            @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer) {
        super(PipelineStage.EXTRACTION, jobQueueManager, stageQueues.get(PipelineStage.EXTRACTION),
                pipelineProperties.getPollTimeout());
        this.extractorFactory = extractorFactory;
        this.artifactStorage = artifactStorage;
        this.jsonSerializer = jsonSerializer;
    }

    @Override
    protected double completionProgress() {
        return ProgressWeights.EXTRACTION_END;
    }

    @Override
    protected StageOutcome process(TranslationJob job) {
        final String jobId = job.getJobId();
        final Path source = Paths.get(job.getSourcePath());
        final String fileName = source.getFileName().toString();
        final String extension = FilenameUtils.getExtension(fileName);

        DocumentExtractor extractor = extractorFactory.getExtractor(extension)
                .orElseThrow(() -> new UnsupportedFileTypeException("Unsupported file type: ." + extension));

        AtomicBoolean jobStillActive = new AtomicBoolean(true);
        ExtractionResult result = extractor.extract(source, (pagesDone, totalPages) -> {
            if (jobStillActive.get()) {
                jobStillActive.set(jobQueueManager
                        .updateProgress(jobId, ProgressWeights.extraction(pagesDone, totalPages), null)
                        .isPresent());
            }
        });
        if (!jobStillActive.get()) {
            return StageOutcome.aborted("job became terminal during extraction");
        }

        if (!result.hasText()) {
            return StageOutcome.failure("Extraction produced no text from " + fileName);
        }

        String artifactRef = artifactStorage.writeArtifact(jobId, ARTIFACT_NAME, jsonSerializer.serialize(result));
        log.info("[JobId: {}] Extracted {} pages from '{}'.", jobId, result.totalPages(), fileName);
        return StageOutcome.advance(record -> {
            record.setExtractionOutput(artifactRef);
            record.setTotalPages(result.totalPages());
        });
    }
}
