package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

/**
 * Raised when an upload or an intermediate artifact cannot be read from or written to local storage.
 */
public class ArtifactStorageException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 2611789304450726963L;

    public ArtifactStorageException(String message) {
        super(message);
    }

    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
