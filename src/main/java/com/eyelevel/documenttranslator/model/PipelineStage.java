package com.eyelevel.documenttranslator.model;

import com.eyelevel.documenttranslator.service.job.ProgressWeights;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The four fixed stages of the pipeline, in processing order. Each stage owns one queue.
 * <p>
 * {@code entryStatus} is the status a job must carry when its id is popped from the stage queue;
 * {@code workingStatus} and {@code claimProgress} are written when a worker claims it.
 */
public enum PipelineStage {
    EXTRACTION(JobStatus.PENDING, JobStatus.EXTRACTING, ProgressWeights.EXTRACTION_START),
    CHUNKING(JobStatus.CHUNKING, JobStatus.CHUNKING, ProgressWeights.TRANSLATION_HANDOFF),
    TRANSLATION(JobStatus.TRANSLATING, JobStatus.TRANSLATING, ProgressWeights.TRANSLATION_START),
    RECONSTRUCTION(JobStatus.RECONSTRUCTING, JobStatus.RECONSTRUCTING, ProgressWeights.RECONSTRUCTION_START);

    private final JobStatus entryStatus;
    private final JobStatus workingStatus;
    private final double claimProgress;

    PipelineStage(JobStatus entryStatus, JobStatus workingStatus, double claimProgress) {
        this.entryStatus = entryStatus;
        this.workingStatus = workingStatus;
        this.claimProgress = claimProgress;
    }

    public JobStatus getEntryStatus() {
        return entryStatus;
    }

    public JobStatus getWorkingStatus() {
        return workingStatus;
    }

    public double getClaimProgress() {
        return claimProgress;
    }

    /**
     * A job waits for this stage while it shows the entry status and no worker has claimed it yet. The progress
     * check matters for stages whose entry and working status are the same.
     */
    public boolean isAwaitedBy(TranslationJob job) {
        return job.getStatus() == entryStatus && job.getProgress() < claimProgress;
    }

    /**
     * @return the stage whose queue the job should be sitting in, or empty if a worker holds it or it is terminal.
     */
    public static Optional<PipelineStage> awaitedBy(TranslationJob job) {
        return Arrays.stream(values()).filter(stage -> stage.isAwaitedBy(job)).findFirst();
    }

    /**
     * @return the stage that follows this one, or empty for reconstruction.
     */
    public Optional<PipelineStage> next() {
        int nextOrdinal = ordinal() + 1;
        return nextOrdinal < values().length ? Optional.of(values()[nextOrdinal]) : Optional.empty();
    }

    /**
     * Key used in queue status payloads, e.g. {@code "extraction"}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
