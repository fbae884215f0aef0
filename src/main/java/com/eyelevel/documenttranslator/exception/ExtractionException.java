package com.eyelevel.documenttranslator.exception;

import java.io.Serial;

public class ExtractionException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = -7284466911862419017L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
