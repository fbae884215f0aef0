package com.eyelevel.documenttranslator.store;

import com.eyelevel.documenttranslator.exception.JobNotFoundException;
import com.eyelevel.documenttranslator.exception.StaleJobRevisionException;
import com.eyelevel.documenttranslator.model.TranslationJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared store holding one record per job, addressed by job id.
 * <p>
 * All pipeline state lives here. Writers follow a read-modify-write discipline: read the full
 * record with {@link #get(String)}, change it, and hand the whole record back to {@link #put(TranslationJob)}.
 * The record's revision travels with it, so a write based on an outdated read is rejected instead of
 * silently overwriting a concurrent update.
 */
public interface JobRecordStore {

    /**
     * Persists a new record.
     *
     * @param record the initial record; its revision must be unset.
     * @return the stored copy, carrying its first revision.
     * @throws IllegalStateException if a record with the same id already exists.
     */
    TranslationJob create(TranslationJob record);

    Optional<TranslationJob> get(String jobId);

    /**
     * Overwrites the full record, refreshing its {@code updatedAt}.
     *
     * @param record a record previously obtained from this store, with modifications applied.
     * @return the stored copy with its new revision.
     * @throws StaleJobRevisionException if the record was written by someone else since it was read.
     * @throws JobNotFoundException      if the record no longer exists.
     */
    TranslationJob put(TranslationJob record);

    /**
     * Lists non-terminal jobs, most recently created first.
     */
    List<TranslationJob> listActive(int limit);

    /**
     * Lists non-terminal jobs whose last write happened before {@code updatedBefore}.
     */
    List<TranslationJob> listStalled(Instant updatedBefore);

    /**
     * Removes a record. Only administrative actions call this; the pipeline never deletes jobs.
     *
     * @return true if a record was removed.
     */
    boolean delete(String jobId);
}
