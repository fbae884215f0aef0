package com.eyelevel.documenttranslator.service.storage;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.exception.ArtifactStorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Local-disk storage for uploads, intermediate stage artifacts and final outputs.
 * <p>
 * Artifacts are referenced from job records by their path as a string. Intermediate artifacts live in
 * a directory per job under the artifact root.
 */
@Slf4j
@Service
public class LocalArtifactStorage {

    private final Path uploadDir;
    private final Path artifactDir;
    private final Path outputDir;

    public LocalArtifactStorage(DocumentTranslationConfig config) {
        DocumentTranslationConfig.Storage storage = config.getStorage();
        this.uploadDir = Paths.get(storage.getUploadDir()).toAbsolutePath().normalize();
        this.artifactDir = Paths.get(storage.getArtifactDir()).toAbsolutePath().normalize();
        this.outputDir = Paths.get(storage.getOutputDir()).toAbsolutePath().normalize();
        log.info("Artifact storage: uploads={}, artifacts={}, outputs={}", uploadDir, artifactDir, outputDir);
    }

    /**
     * Copies an upload stream to a new file named by a random id.
     *
     * @param extension lower-case extension without the dot.
     * @return the stored file.
     */
    public Path storeUpload(InputStream content, String extension) {
        Path target = uploadDir.resolve(UUID.randomUUID() + "." + extension);
        try {
            Files.createDirectories(uploadDir);
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload at {}", target);
            return target;
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to store upload: " + e.getMessage(), e);
        }
    }

    /**
     * Writes an intermediate artifact for a job, replacing any previous one with the same name.
     *
     * @return the reference to store on the job record.
     */
    public String writeArtifact(String jobId, String name, String content) {
        return write(artifactDir.resolve(jobId).resolve(name), content);
    }

    /**
     * Writes the final translated document for a job.
     *
     * @return the reference to store as the job's final output.
     */
    public String writeOutput(String jobId, String content) {
        return write(outputDir.resolve(jobId + "_translated.txt"), content);
    }

    public String read(String reference) {
        try {
            return FileUtils.readFileToString(Paths.get(reference).toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to read artifact " + reference + ": " + e.getMessage(), e);
        }
    }

    public boolean exists(String reference) {
        return reference != null && Files.isRegularFile(Paths.get(reference));
    }

    /**
     * Deletes a single artifact or output, ignoring one that is already gone.
     */
    public void delete(String reference) {
        if (reference != null && !FileUtils.deleteQuietly(Paths.get(reference).toFile())) {
            log.debug("Artifact {} was not deleted or was already gone.", reference);
        }
    }

    /**
     * Removes a job's intermediate artifacts, its output and the given upload, ignoring files that are gone.
     * Failures are logged only: this runs after the job record is already removed.
     */
    public void deleteJobFiles(String jobId, String sourcePath) {
        FileUtils.deleteQuietly(artifactDir.resolve(jobId).toFile());
        FileUtils.deleteQuietly(outputDir.resolve(jobId + "_translated.txt").toFile());
        if (sourcePath != null && Paths.get(sourcePath).toAbsolutePath().normalize().startsWith(uploadDir)) {
            if (!FileUtils.deleteQuietly(Paths.get(sourcePath).toFile())) {
                log.warn("[JobId: {}] Upload {} could not be deleted or was already gone.", jobId, sourcePath);
            }
        }
    }

    private String write(Path target, String content) {
        try {
            FileUtils.writeStringToFile(target.toFile(), content, StandardCharsets.UTF_8);
            return target.toString();
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to write artifact " + target + ": " + e.getMessage(), e);
        }
    }
}
