package com.eyelevel.documenttranslator.common.json.jackson;

import com.eyelevel.documenttranslator.common.json.JsonSerializer;
import com.eyelevel.documenttranslator.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public String serialize(Object value) {
        if (value == null) {
            throw new JsonParsingException("Cannot serialize a null value");
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            log.trace("Serialized {} to {} chars of JSON", value.getClass().getSimpleName(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Error serializing " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }
}
