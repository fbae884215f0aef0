package com.eyelevel.documenttranslator.common.json;

import com.eyelevel.documenttranslator.exception.json.JsonParsingException;

/**
 * Writes pipeline artifacts, queue messages and provider payloads as JSON text.
 */
public interface JsonSerializer {

    /**
     * @throws JsonParsingException if the value cannot be written.
     */
    String serialize(Object value);
}
