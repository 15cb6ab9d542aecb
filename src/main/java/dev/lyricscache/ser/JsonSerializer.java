package dev.lyricscache.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.lyricscache.core.CacheStoreException;

import java.io.IOException;
import java.util.Objects;

public class JsonSerializer<T> implements Serializer<T> {
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonSerializer(Class<T> type) {
        this(type, defaultMapper());
    }

    public JsonSerializer(Class<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /**
     * Mapper shared by the stores: unknown fields are tolerated so older readers can open rows
     * written by newer code.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    @Override
    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Failed to write " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CacheStoreException("Empty value where " + type.getSimpleName() + " JSON was expected");
        }
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CacheStoreException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
    }
}
