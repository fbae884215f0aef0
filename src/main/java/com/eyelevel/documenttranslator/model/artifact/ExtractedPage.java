package com.eyelevel.documenttranslator.model.artifact;

/**
 * Text of a single source page. Page numbers start at 1.
 */
public record ExtractedPage(int pageNumber, String text) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
