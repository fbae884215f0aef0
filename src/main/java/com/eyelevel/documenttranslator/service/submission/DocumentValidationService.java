package com.eyelevel.documenttranslator.service.submission;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.exception.FileTooLargeException;
import com.eyelevel.documenttranslator.exception.InvalidDocumentException;
import com.eyelevel.documenttranslator.exception.UnsupportedFileTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentValidationService {

    private final DocumentTranslationConfig documentTranslationConfig;

    /**
     * Validates an upload before anything is stored.
     *
     * @param fileName The client-side name of the file, which may include path information.
     * @param fileSize The size of the file in bytes.
     * @return The lower-case extension of the accepted file, without the dot.
     * @throws InvalidDocumentException     if the file is empty, unnamed or hidden.
     * @throws UnsupportedFileTypeException if the extension is not accepted.
     * @throws FileTooLargeException        if the file exceeds {@code app.processing.max-file-size}.
     */
    public String validate(final String fileName, final long fileSize) {
        log.trace("Validating file '{}' with size {} bytes.", fileName, fileSize);

        final String baseName = FilenameUtils.getName(fileName);
        if (!StringUtils.hasText(baseName) || baseName.trim().equals(".")) {
            throw new InvalidDocumentException("File has an invalid or empty name.");
        }
        if (baseName.startsWith(".")) {
            throw new InvalidDocumentException("Hidden files are not accepted.");
        }

        final String extension = FilenameUtils.getExtension(baseName).toLowerCase(Locale.ROOT);
        if (!documentTranslationConfig.getSupportedExtensions().contains(extension)) {
            throw new UnsupportedFileTypeException("Unsupported file type: ." + extension
                    + ". Supported types: " + String.join(", ", documentTranslationConfig.getSupportedExtensions()));
        }

        if (fileSize <= 0) {
            throw new InvalidDocumentException("File is empty.");
        }
        final long maxFileSize = documentTranslationConfig.getMaxFileSize();
        if (fileSize > maxFileSize) {
            throw new FileTooLargeException(String.format("File is too large: %s. Maximum allowed size is %s.",
                    FileUtils.byteCountToDisplaySize(fileSize), FileUtils.byteCountToDisplaySize(maxFileSize)));
        }

        log.trace("File '{}' passed all validation checks.", fileName);
        return extension;
    }
}
