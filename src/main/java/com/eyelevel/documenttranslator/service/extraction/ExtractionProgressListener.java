package com.eyelevel.documenttranslator.service.extraction;

@FunctionalInterface
public interface ExtractionProgressListener {

    ExtractionProgressListener NONE = (pagesDone, totalPages) -> {
    };

    void onPageExtracted(int pagesDone, int totalPages);
}
