package com.eyelevel.documenttranslator.common.json;

import com.eyelevel.documenttranslator.exception.json.JsonParsingException;

import java.util.List;

/**
 * Defines the contract for parsing JSON data into Java objects. Used for pipeline artifacts and
 * translation provider responses.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON array into a list whose elements are of the specified type.
     *
     * @throws JsonParsingException if the input is not a JSON array of compatible elements.
     */
    <T> List<T> parseList(String json, Class<T> elementType);
}
