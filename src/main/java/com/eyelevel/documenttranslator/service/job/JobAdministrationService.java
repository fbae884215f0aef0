package com.eyelevel.documenttranslator.service.job;

import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Administrative operations that go beyond the job lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAdministrationService {

    private final JobQueueManager jobQueueManager;
    private final LocalArtifactStorage artifactStorage;

    /**
     * Deletes a job record together with its upload, artifacts and output. A job that is still running
     * is cancelled first so its worker drops the result.
     *
     * @throws com.eyelevel.documenttranslator.exception.JobNotFoundException if the job does not exist.
     */
    public void deleteJob(final String jobId) {
        final TranslationJob job = jobQueueManager.requireJob(jobId);
        if (!job.isTerminal()) {
            jobQueueManager.failJob(jobId, "Deleted by administrator");
        }
        jobQueueManager.deleteJob(jobId);
        artifactStorage.deleteJobFiles(jobId, job.getSourcePath());
        log.warn("ADMIN ACTION: [JobId: {}] Job and its files deleted.", jobId);
    }
}
