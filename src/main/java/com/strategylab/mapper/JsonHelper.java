package com.strategylab.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of the JSON text columns of the batch tables (variable detail, base
 * strategy, assignments, summary, per-run variables and metrics). Used from the
 * MapStruct mappers.
 *
 * <p>Null and blank input map to null (or an empty list). A stored value that no
 * longer parses is a corrupt row and fails with {@link IllegalStateException}.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonHelper() {}

    public static String toJson(Object value) {
        return value == null ? null : write(OBJECT_MAPPER.writer(), value, value.getClass().getSimpleName());
    }

    /** Writes with the declared type, so elements of polymorphic lists keep their type id. */
    public static <T> String toJson(T value, TypeReference<T> type) {
        return value == null ? null : write(OBJECT_MAPPER.writerFor(type), value, type.getType().getTypeName());
    }

    public static <T> T fromJson(String json, Class<T> type) {
        return read(json, OBJECT_MAPPER.readerFor(type), type.getSimpleName());
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        return read(json, OBJECT_MAPPER.readerFor(type), type.getType().getTypeName());
    }

    public static <T> List<T> fromJsonList(String json, Class<T> elementType) {
        List<T> list = read(json, OBJECT_MAPPER.readerForListOf(elementType), "List<" + elementType.getSimpleName() + ">");
        return list != null ? list : List.of();
    }

    private static String write(ObjectWriter writer, Object value, String what) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot write {} as JSON", what, e);
            throw new IllegalStateException("Cannot write " + what + " as JSON", e);
        }
    }

    private static <T> T read(String json, ObjectReader reader, String what) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return reader.readValue(json);
        } catch (JsonProcessingException e) {
            log.error("Stored JSON is not a valid {} ({} chars)", what, json.length(), e);
            throw new IllegalStateException("Stored JSON is not a valid " + what, e);
        }
    }
}
