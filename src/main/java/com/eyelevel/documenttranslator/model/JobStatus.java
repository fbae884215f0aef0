package com.eyelevel.documenttranslator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link TranslationJob}. The pipeline moves a job forward through these
 * values in declaration order; {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum JobStatus {
    /**
     * The job record exists and its id is waiting in the extraction queue.
     */
    PENDING,
    /**
     * An extraction worker has claimed the job and is reading text out of the source document.
     */
    EXTRACTING,
    /**
     * Extraction finished; the job is waiting for, or held by, a chunking worker.
     */
    CHUNKING,
    /**
     * The job is waiting for, or held by, a translation worker.
     */
    TRANSLATING,
    /**
     * All chunks are translated; the final output is being assembled.
     */
    RECONSTRUCTING,
    /**
     * The final output has been written.
     */
    COMPLETED,
    /**
     * Processing stopped because of an error or a cancellation. See the job's error field.
     */
    FAILED;

    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * @return every status a job can hold while still moving through the pipeline.
     */
    public static Set<JobStatus> activeStatuses() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }
}
