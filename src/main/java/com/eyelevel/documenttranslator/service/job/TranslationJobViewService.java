package com.eyelevel.documenttranslator.service.job;

import com.eyelevel.documenttranslator.dto.job.JobStatusResponse;
import com.eyelevel.documenttranslator.dto.queue.ActiveJobSummary;
import com.eyelevel.documenttranslator.dto.queue.QueueStatusResponse;
import com.eyelevel.documenttranslator.exception.JobStateConflictException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side views over job records and stage queues for the HTTP layer.
 */
@Slf4j
@Service
public class TranslationJobViewService {

    private final JobQueueManager jobQueueManager;
    private final LocalArtifactStorage artifactStorage;
    private final int activeJobsLimit;

    public TranslationJobViewService(JobQueueManager jobQueueManager, LocalArtifactStorage artifactStorage,
                                     @Value("${app.pipeline.active-jobs-limit:50}") int activeJobsLimit) {
        this.jobQueueManager = jobQueueManager;
        this.artifactStorage = artifactStorage;
        this.activeJobsLimit = activeJobsLimit;
    }

    public JobStatusResponse getStatus(String jobId) {
        return JobStatusResponse.from(jobQueueManager.requireJob(jobId));
    }

    public QueueStatusResponse getQueueStatus() {
        Map<String, Long> queues = new LinkedHashMap<>();
        jobQueueManager.queueStatus().forEach((stage, count) -> queues.put(stage.key(), count));

        List<ActiveJobSummary> activeJobs = jobQueueManager.activeJobs(activeJobsLimit).stream()
                .map(ActiveJobSummary::from)
                .toList();

        return QueueStatusResponse.builder()
                .queues(queues)
                .activeJobs(activeJobs)
                .totalActive(activeJobs.size())
                .build();
    }

    /**
     * @return the translated document text.
     * @throws JobStateConflictException if the job has not completed.
     */
    public String getTranslatedText(String jobId) {
        TranslationJob job = jobQueueManager.requireJob(jobId);
        if (job.getStatus() != JobStatus.COMPLETED || job.getFinalOutput() == null) {
            throw new JobStateConflictException("Job " + jobId + " has no output yet (status: " + job.getStatus() + ")");
        }
        log.debug("[JobId: {}] Serving output {}", jobId, job.getFinalOutput());
        return artifactStorage.read(job.getFinalOutput());
    }
}
