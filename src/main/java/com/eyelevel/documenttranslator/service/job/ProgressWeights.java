package com.eyelevel.documenttranslator.service.job;

/**
 * Fixed mapping from each stage's internal completion to the job's overall 0-100 progress.
 * Extraction owns 10-25, chunking parks the job at 30, translation owns 40-80 and
 * reconstruction moves from 85 to 100. Values can be tuned as long as the stage ranges keep their order.
 */
public final class ProgressWeights {

    public static final double CREATED = 0.0;
    public static final double EXTRACTION_START = 10.0;
    public static final double EXTRACTION_END = 25.0;
    public static final double TRANSLATION_HANDOFF = 30.0;
    public static final double TRANSLATION_START = 40.0;
    public static final double TRANSLATION_END = 80.0;
    public static final double RECONSTRUCTION_START = 85.0;
    public static final double COMPLETE = 100.0;

    private ProgressWeights() {
    }

    public static double extraction(int pagesDone, int totalPages) {
        return scale(EXTRACTION_START, EXTRACTION_END, pagesDone, totalPages);
    }

    public static double translation(int chunksDone, int totalChunks) {
        return scale(TRANSLATION_START, TRANSLATION_END, chunksDone, totalChunks);
    }

    private static double scale(double from, double to, int done, int total) {
        if (total <= 0) {
            return from;
        }
        double fraction = Math.min(1.0, Math.max(0.0, (double) done / total));
        return from + (to - from) * fraction;
    }
}
