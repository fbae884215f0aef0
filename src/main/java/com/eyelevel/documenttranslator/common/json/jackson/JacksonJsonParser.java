package com.eyelevel.documenttranslator.common.json.jackson;

import com.eyelevel.documenttranslator.common.json.JsonParser;
import com.eyelevel.documenttranslator.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON string into " + valueType.getSimpleName());
        }
        return parseObject(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON to object of type: {}", valueType.getName());
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error parsing JSON to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }

    @Override
    public <T> List<T> parseList(String json, Class<T> elementType) {
        log.debug("Parsing JSON array of element type: {}", elementType.getName());
        CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return objectMapper.readValue(json, listType);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error parsing JSON array of element type: {}", elementType.getName(), e);
            throw new JsonParsingException("Error parsing JSON array of " + elementType.getSimpleName(), e);
        }
    }
}
