package com.eyelevel.documenttranslator.store;

import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.exception.StaleJobRevisionException;
import com.eyelevel.documenttranslator.model.TranslationJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link JobRecordStore} with the same revision semantics as the JPA store. Every successful
 * write is appended to a per-job history so tests can assert the sequence of states a job went through.
 */
public class InMemoryJobRecordStore implements JobRecordStore {

    private final Map<String, TranslationJob> records = new ConcurrentHashMap<>();
    private final Map<String, List<TranslationJob>> history = new ConcurrentHashMap<>();

    @Override
    public synchronized TranslationJob create(TranslationJob record) {
        if (records.containsKey(record.getJobId())) {
            throw new IllegalStateException("A job record already exists for id " + record.getJobId());
        }
        Instant now = Instant.now();
        TranslationJob stored = record.toBuilder()
                .revision(0L)
                .createdAt(record.getCreatedAt() != null ? record.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return save(stored);
    }

    @Override
    public Optional<TranslationJob> get(String jobId) {
        return Optional.ofNullable(records.get(jobId)).map(this::copy);
    }

    @Override
    public synchronized TranslationJob put(TranslationJob record) {
        TranslationJob stored = records.get(record.getJobId());
        if (stored == null) {
            throw new JobNotFoundException("Job not found: " + record.getJobId());
        }
        if (!Objects.equals(stored.getRevision(), record.getRevision())) {
            throw new StaleJobRevisionException("Job " + record.getJobId() + " was modified concurrently");
        }
        return save(record.toBuilder()
                .revision(stored.getRevision() + 1)
                .createdAt(stored.getCreatedAt())
                .updatedAt(Instant.now())
                .build());
    }

    @Override
    public List<TranslationJob> listActive(int limit) {
        return records.values().stream()
                .filter(job -> !job.isTerminal())
                .sorted(Comparator.comparing(TranslationJob::getCreatedAt).reversed())
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public List<TranslationJob> listStalled(Instant updatedBefore) {
        return records.values().stream()
                .filter(job -> !job.isTerminal() && job.getUpdatedAt().isBefore(updatedBefore))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized boolean delete(String jobId) {
        return records.remove(jobId) != null;
    }

    /**
     * @return every stored state of the job, oldest first.
     */
    public List<TranslationJob> history(String jobId) {
        return List.copyOf(history.getOrDefault(jobId, List.of()));
    }

    /**
     * Replaces a record without a revision check, for arranging test fixtures.
     */
    public synchronized void overwrite(TranslationJob record) {
        records.put(record.getJobId(), copy(record));
    }

    private TranslationJob save(TranslationJob record) {
        records.put(record.getJobId(), record);
        history.computeIfAbsent(record.getJobId(), id -> new ArrayList<>()).add(copy(record));
        return copy(record);
    }

    private TranslationJob copy(TranslationJob record) {
        return record.toBuilder().build();
    }
}
