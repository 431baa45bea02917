package com.vireo.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson mapper and the JSON helpers used by requests and responses.
 */
public final class JsonUtil {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    private static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private JsonUtil() {
    }

    /**
     * Converts an object to a JSON string.
     *
     * @param obj the object to convert
     * @return the JSON string
     * @throws JsonProcessingException if the conversion fails
     */
    public static String toJson(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsString(obj);
    }

    /**
     * Parses a JSON string into an object of the specified type.
     *
     * @param json the JSON string
     * @param clazz the class of the object
     * @param <T> the type of the object
     * @return the parsed object
     * @throws IOException if the parsing fails
     */
    public static <T> T fromJson(String json, Class<T> clazz) throws IOException {
        return mapper.readValue(json, clazz);
    }

    /**
     * Parses a JSON object into an insertion-ordered map.
     *
     * @param json the JSON string
     * @return the parsed map
     * @throws IOException if the input is not a JSON object
     */
    public static Map<String, Object> fromJsonMap(String json) throws IOException {
        return mapper.readValue(json, MAP_TYPE);
    }

    /**
     * Parses a JSON string into a JsonNode.
     *
     * @param json the JSON string
     * @return the parsed JsonNode
     * @throws IOException if the parsing fails
     */
    public static JsonNode parseJson(String json) throws IOException {
        return mapper.readTree(json);
    }

    /**
     * Cheap structural check: the trimmed text starts and ends like a JSON
     * object or array. Used to sniff bodies sent without a content type.
     *
     * @param text the text to check
     * @return true if the text looks like JSON
     */
    public static boolean looksLikeJson(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.length() < 2) {
            return false;
        }
        char first = trimmed.charAt(0);
        char last = trimmed.charAt(trimmed.length() - 1);
        return (first == '{' && last == '}') || (first == '[' && last == ']');
    }

    /**
     * Gets the ObjectMapper instance.
     *
     * @return the ObjectMapper instance
     */
    public static ObjectMapper getMapper() {
        return mapper;
    }
}
