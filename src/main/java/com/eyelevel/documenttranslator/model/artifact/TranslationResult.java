package com.eyelevel.documenttranslator.model.artifact;

import java.util.List;

/**
 * Output of the translation stage, persisted as JSON and referenced by the job's translation output.
 */
public record TranslationResult(String sourceLang, String targetLang, List<TranslatedChunk> chunks, int totalPages) {
}
