package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.common.json.JsonParser;
import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.artifact.TranslatedChunk;
import com.eyelevel.documenttranslator.model.artifact.TranslationResult;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.job.ProgressWeights;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reassembles the translated chunks into one text document with a delimiter line before each page,
 * then completes the job.
 */
@Slf4j
@Component
public class ReconstructionWorker extends StageWorker {

    private final LocalArtifactStorage artifactStorage;
    private final JsonParser jsonParser;

    public ReconstructionWorker(JobQueueManager jobQueueManager, StageQueues stageQueues,
                                PipelineProperties pipelineProperties, LocalArtifactStorage artifactStorage,
                                @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        super(PipelineStage.RECONSTRUCTION, jobQueueManager, stageQueues.get(PipelineStage.RECONSTRUCTION),
                pipelineProperties.getPollTimeout());
        this.artifactStorage = artifactStorage;
        this.jsonParser = jsonParser;
    }

    public static String pageDelimiter(int pageNumber) {
        return "==================== Page " + pageNumber + " ====================";
    }

    @Override
    protected double completionProgress() {
        return ProgressWeights.COMPLETE;
    }

    @Override
    protected StageOutcome process(TranslationJob job) {
        TranslationResult translation = jsonParser.parseObject(artifactStorage.read(job.getTranslationOutput()),
                TranslationResult.class);
        String document = assemble(translation.chunks());
        String outputRef = artifactStorage.writeOutput(job.getJobId(), document);
        log.info("[JobId: {}] Reconstructed {} chunks into {}.", job.getJobId(), translation.chunks().size(),
                outputRef);
        return StageOutcome.complete(outputRef);
    }

    @Override
    protected void discardOutput(String jobId, String outputRef) {
        log.info("[JobId: {}] Job became terminal during reconstruction. Deleting {}.", jobId, outputRef);
        artifactStorage.delete(outputRef);
    }

    static String assemble(List<TranslatedChunk> chunks) {
        Map<Integer, List<TranslatedChunk>> byPage = new TreeMap<>();
        for (TranslatedChunk chunk : chunks) {
            byPage.computeIfAbsent(chunk.pageNumber(), page -> new ArrayList<>()).add(chunk);
        }

        List<String> sections = new ArrayList<>(byPage.size());
        byPage.forEach((page, pageChunks) -> {
            pageChunks.sort(Comparator.comparingInt(TranslatedChunk::chunkIndex));
            StringBuilder section = new StringBuilder(pageDelimiter(page)).append('\n');
            for (int i = 0; i < pageChunks.size(); i++) {
                if (i > 0) {
                    section.append("\n\n");
                }
                section.append(pageChunks.get(i).translatedText());
            }
            sections.add(section.toString());
        });
        return String.join("\n\n", sections);
    }
}
