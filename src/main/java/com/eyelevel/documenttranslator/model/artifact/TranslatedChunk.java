package com.eyelevel.documenttranslator.model.artifact;

/**
 * One translated chunk together with the page it came from and its position within that page.
 */
public record TranslatedChunk(int pageNumber, int chunkIndex, String sourceText, String translatedText) {
}
