package com.eyelevel.documenttranslator.store;

import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.exception.StaleJobRevisionException;
import com.eyelevel.documenttranslator.model.JobStatus;
import com.eyelevel.documenttranslator.model.TranslationJob;
import com.eyelevel.documenttranslator.repository.TranslationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link JobRecordStore} backed by the {@code translation_job} table. Revision checks are enforced twice:
 * explicitly against the row read inside the write transaction, and by JPA's {@code @Version} on flush,
 * which catches a concurrent writer committing between the two.
 * <p>
 * Every returned record is a detached copy, so callers can mutate it freely before the next {@link #put}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobRecordStore implements JobRecordStore {

    private final TranslationJobRepository translationJobRepository;

    @Override
    @Transactional
    public TranslationJob create(final TranslationJob record) {
        if (translationJobRepository.existsById(record.getJobId())) {
            throw new IllegalStateException("A job record already exists for id " + record.getJobId());
        }
        final Instant now = Instant.now();
        final TranslationJob toStore = record.toBuilder()
                .revision(null)
                .createdAt(Optional.ofNullable(record.getCreatedAt()).orElse(now))
                .updatedAt(now)
                .build();
        final TranslationJob saved = translationJobRepository.saveAndFlush(toStore);
        log.debug("[JobId: {}] Created job record at revision {}.", saved.getJobId(), saved.getRevision());
        return detach(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TranslationJob> get(final String jobId) {
        return translationJobRepository.findById(jobId).map(this::detach);
    }

    @Override
    @Transactional
    public TranslationJob put(final TranslationJob record) {
        final String jobId = record.getJobId();
        final TranslationJob stored = translationJobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));

        if (!Objects.equals(stored.getRevision(), record.getRevision())) {
            log.debug("[JobId: {}] Rejecting write at revision {}; stored revision is {}.", jobId,
                    record.getRevision(), stored.getRevision());
            throw new StaleJobRevisionException(String.format(
                    "Job %s was modified concurrently (expected revision %s, found %s)", jobId,
                    record.getRevision(), stored.getRevision()));
        }

        try {
            final TranslationJob saved = translationJobRepository.saveAndFlush(
                    record.toBuilder().createdAt(stored.getCreatedAt()).updatedAt(Instant.now()).build());
            log.trace("[JobId: {}] Stored revision {} with status {}.", jobId, saved.getRevision(), saved.getStatus());
            return detach(saved);
        } catch (OptimisticLockingFailureException e) {
            throw new StaleJobRevisionException("Job " + jobId + " was modified concurrently", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranslationJob> listActive(final int limit) {
        return translationJobRepository.findByStatusInOrderByCreatedAtDesc(JobStatus.activeStatuses(),
                        PageRequest.of(0, Math.max(1, limit)))
                .stream().map(this::detach).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranslationJob> listStalled(final Instant updatedBefore) {
        return translationJobRepository.findByStatusInAndUpdatedAtBefore(JobStatus.activeStatuses(), updatedBefore)
                .stream().map(this::detach).toList();
    }

    @Override
    @Transactional
    public boolean delete(final String jobId) {
        if (!translationJobRepository.existsById(jobId)) {
            return false;
        }
        translationJobRepository.deleteById(jobId);
        log.info("[JobId: {}] Job record deleted.", jobId);
        return true;
    }

    private TranslationJob detach(final TranslationJob managed) {
        return managed.toBuilder().build();
    }
}
