package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.common.json.JsonParser;
import com.eyelevel.documenttranslator.common.json.JsonSerializer;
import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import com.eyelevel.documenttranslator.model.PipelineStage;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.model.artifact.ExtractedPage;
import com.eyelevel.documenttranslator.model.artifact.ExtractionResult;
import com.eyelevel.documenttranslator.model.artifact.TranslatedChunk;
import com.eyelevel.documenttranslator.model.artifact.TranslationResult;
import com.eyelevel.documenttranslator.queue.StageQueues;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.job.ProgressWeights;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import com.eyelevel.documenttranslator.service.translation.TextChunker;
import com.eyelevel.documenttranslator.service.translation.TranslationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the extracted pages into chunks and translates them with the job's tier.
 * <p>
 * Documents of at most {@code app.translation.batch-threshold} chunks are sent as one batch; if the batch
 * call fails, every chunk is retried on its own. Progress moves from 40 to 80 as chunks are translated,
 * and {@code processedPages} counts pages whose chunks are all done.
 */
@Slf4j
@Component
public class TranslationWorker extends StageWorker {

    static final String ARTIFACT_NAME = "translation.json";

    private final LocalArtifactStorage artifactStorage;
    private final TextChunker textChunker;
    private final TranslationProvider translationProvider;
    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final TranslationProperties translationProperties;

    public TranslationWorker(JobQueueManager jobQueueManager, StageQueues stageQueues,
                             PipelineProperties pipelineProperties, TranslationProperties translationProperties,
                             LocalArtifactStorage artifactStorage, TextChunker textChunker,
                             TranslationProvider translationProvider,
                             @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                             @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer) {
        super(PipelineStage.TRANSLATION, jobQueueManager, stageQueues.get(PipelineStage.TRANSLATION),
                pipelineProperties.getPollTimeout());
        this.artifactStorage = artifactStorage;
        this.textChunker = textChunker;
        this.translationProvider = translationProvider;
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
        this.translationProperties = translationProperties;
    }

    @Override
    protected double completionProgress() {
        return ProgressWeights.TRANSLATION_END;
    }

    @Override
    protected StageOutcome process(TranslationJob job) {
        final String jobId = job.getJobId();
        ExtractionResult extraction = jsonParser.parseObject(artifactStorage.read(job.getExtractionOutput()),
                ExtractionResult.class);

        List<TranslatedChunk> pending = split(extraction);
        if (pending.isEmpty()) {
            return StageOutcome.failure("No text to translate");
        }
        log.info("[JobId: {}] Translating {} chunks from {} pages ({} -> {}, tier {}).", jobId, pending.size(),
                extraction.totalPages(), job.getSourceLang(), job.getTargetLang(), job.getTier().getValue());

        List<String> batch = pending.size() <= translationProperties.getBatchThreshold()
                ? translateAsBatch(job, pending)
                : null;

        List<TranslatedChunk> translated = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            TranslatedChunk chunk = pending.get(i);
            String text = batch != null
                    ? batch.get(i)
                    : translationProvider.translate(chunk.sourceText(), job.getSourceLang(), job.getTargetLang(),
                    job.getTier());
            translated.add(new TranslatedChunk(chunk.pageNumber(), chunk.chunkIndex(), chunk.sourceText(), text));

            int pagesDone = isLastChunkOfPage(pending, i) ? chunk.pageNumber() : chunk.pageNumber() - 1;
            boolean active = jobQueueManager.updateProgress(jobId,
                    ProgressWeights.translation(i + 1, pending.size()), pagesDone).isPresent();
            if (!active) {
                return StageOutcome.aborted("job became terminal during translation");
            }
        }

        TranslationResult result = new TranslationResult(job.getSourceLang(), job.getTargetLang(), translated,
                extraction.totalPages());
        String artifactRef = artifactStorage.writeArtifact(jobId, ARTIFACT_NAME, jsonSerializer.serialize(result));
        return StageOutcome.advance(record -> {
            record.setTranslationOutput(artifactRef);
            record.setProcessedPages(record.getTotalPages());
        });
    }

    private List<TranslatedChunk> split(ExtractionResult extraction) {
        List<TranslatedChunk> chunks = new ArrayList<>();
        for (ExtractedPage page : extraction.pages()) {
            if (!page.hasText()) {
                continue;
            }
            List<String> parts = textChunker.split(page.text());
            for (int i = 0; i < parts.size(); i++) {
                chunks.add(new TranslatedChunk(page.pageNumber(), i, parts.get(i), null));
            }
        }
        return chunks;
    }

    /**
     * @return the translations in chunk order, or null if the batch call failed and chunks must go one by one.
     */
    private List<String> translateAsBatch(TranslationJob job, List<TranslatedChunk> chunks) {
        List<String> texts = chunks.stream().map(TranslatedChunk::sourceText).toList();
        try {
            List<String> translated = translationProvider.translateBatch(texts, job.getSourceLang(),
                    job.getTargetLang(), job.getTier());
            if (translated == null || translated.size() != texts.size()) {
                log.warn("[JobId: {}] Batch translation returned {} results for {} chunks. Translating chunks "
                        + "individually.", job.getJobId(), translated == null ? 0 : translated.size(), texts.size());
                return null;
            }
            return translated;
        } catch (RuntimeException e) {
            log.warn("[JobId: {}] Batch translation failed: {}. Translating chunks individually.", job.getJobId(),
                    e.getMessage());
            return null;
        }
    }

    private static boolean isLastChunkOfPage(List<TranslatedChunk> chunks, int index) {
        return index == chunks.size() - 1 || chunks.get(index + 1).pageNumber() != chunks.get(index).pageNumber();
    }
}
