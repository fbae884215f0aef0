package com.eyelevel.documenttranslator.model.artifact;

import java.util.List;

/**
 * Output of the extraction stage, persisted as JSON and referenced by the job's extraction output.
 */
public record ExtractionResult(List<ExtractedPage> pages, int totalPages) {

    public boolean hasText() {
        return pages != null && pages.stream().anyMatch(ExtractedPage::hasText);
    }
}
