package com.eyelevel.documenttranslator.repository;

import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link TranslationJob} entity.
 */
@Repository
public interface TranslationJobRepository extends JpaRepository<TranslationJob, String> {

    /**
     * Finds jobs in any of the given statuses, newest first. Used to list in-flight jobs.
     *
     * @param statuses The statuses to match, normally every non-terminal status.
     * @param pageable Limits the number of rows returned.
     * @return The matching jobs ordered by creation time, descending.
     */
    List<TranslationJob> findByStatusInOrderByCreatedAtDesc(Collection<JobStatus> statuses, Pageable pageable);

    /**
     * Finds jobs in any of the given statuses that have not been written since {@code threshold}.
     * This is used by the {@link com.eyelevel.documenttranslator.scheduler.StalledJobRecoveryScheduler}.
     */
    List<TranslationJob> findByStatusInAndUpdatedAtBefore(Collection<JobStatus> statuses, Instant threshold);
}

