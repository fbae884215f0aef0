package com.eyelevel.documenttranslator.service.job;

import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.service.storage.LocalArtifactStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobAdministrationServiceTest {

    @Mock
    private JobQueueManager jobQueueManager;

    @Mock
    private LocalArtifactStorage artifactStorage;

    @InjectMocks
    private JobAdministrationService administrationService;

    @Test
    void testDeleteJob_FailsRunningJobBeforeRemovingIt() {
        // Given
        when(jobQueueManager.requireJob("job-1")).thenReturn(TranslationJob.builder()
                .jobId("job-1").sourcePath("/data/uploads/a.pdf").status(JobStatus.TRANSLATING).build());

        // When
        administrationService.deleteJob("job-1");

        // Then
        InOrder order = inOrder(jobQueueManager, artifactStorage);
        order.verify(jobQueueManager).failJob("job-1", "Deleted by administrator");
        order.verify(jobQueueManager).deleteJob("job-1");
        order.verify(artifactStorage).deleteJobFiles("job-1", "/data/uploads/a.pdf");
    }

    @Test
    void testDeleteJob_TerminalJobIsRemovedDirectly() {
        // Given
        when(jobQueueManager.requireJob("job-1")).thenReturn(TranslationJob.builder()
                .jobId("job-1").sourcePath("/data/uploads/a.pdf").status(JobStatus.COMPLETED).build());

        // When
        administrationService.deleteJob("job-1");

        // Then
        verify(jobQueueManager, never()).failJob(anyString(), anyString());
        verify(jobQueueManager).deleteJob("job-1");
    }

    @Test
    void testDeleteJob_UnknownJob() {
        // Given
        when(jobQueueManager.requireJob("missing")).thenThrow(new JobNotFoundException("Job not found: missing"));

        // When / Then
        assertThatThrownBy(() -> administrationService.deleteJob("missing")).isInstanceOf(JobNotFoundException.class);
        verifyNoInteractions(artifactStorage);
    }
}
