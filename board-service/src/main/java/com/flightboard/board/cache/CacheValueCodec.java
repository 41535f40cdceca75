package com.flightboard.board.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON form of cached values. A value that cannot be written or read is treated as
 * uncacheable rather than as an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheValueCodec {

    private final ObjectMapper objectMapper;

    public Optional<String> encode(String key, Object value) {
        try {
            return Optional.of(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize cache value for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public <T> Optional<T> decode(String key, String json, JavaType type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cache value for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public JavaType typeOf(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }
}
