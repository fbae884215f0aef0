package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.job.ProgressWeights;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import org.springframework.stereotype.Component;

/**
 * Checks that the extraction artifact is in place and parks the job at 30% for translation.
 * Splitting into chunks happens in {@link TranslationWorker}, next to the provider calls.
 */
@Component
public class ChunkingWorker extends StageWorker {

    private final LocalArtifactStorage artifactStorage;

    public ChunkingWorker(JobQueueManager jobQueueManager, StageQueues stageQueues,
                          PipelineProperties pipelineProperties, LocalArtifactStorage artifactStorage) {
        super(PipelineStage.CHUNKING, jobQueueManager, stageQueues.get(PipelineStage.CHUNKING),
                pipelineProperties.getPollTimeout());
        this.artifactStorage = artifactStorage;
    }

    @Override
    protected double completionProgress() {
        return ProgressWeights.TRANSLATION_HANDOFF;
    }

    @Override
    protected StageOutcome process(TranslationJob job) {
        if (!artifactStorage.exists(job.getExtractionOutput())) {
            return StageOutcome.failure("Extraction output missing: " + job.getExtractionOutput());
        }
        return StageOutcome.advance();
    }
}
