package com.eyelevel.documenttranslator.exception.json;

import com.eyelevel.documenttranslator.exception.DocumentTranslationException;

import java.io.Serial;

/**
 * A stage artifact or provider payload could not be read or written as JSON.
 */
public class JsonParsingException extends DocumentTranslationException {
    @Serial
    private static final long serialVersionUID = 7093318840627112294L;

    public JsonParsingException(String message) {
        super(message);
    }

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
