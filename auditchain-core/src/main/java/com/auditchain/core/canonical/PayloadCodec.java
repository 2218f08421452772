package com.auditchain.core.canonical;

import com.auditchain.core.exception.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text form of entry payloads as persisted.
 * <p>
 * Decimals are read back as {@link java.math.BigDecimal} so no precision is lost between
 * append and verification. {@link #normalize(Map)} gives the exact value a payload will
 * have after a storage round trip; the append engine hashes that value.
 */
public final class PayloadCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private PayloadCodec() {}

    public static String write(Map<String, Object> payload) {
        try {
            return MAPPER.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Payload cannot be written as JSON", e);
        }
    }

    public static Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Stored payload is not valid JSON", e);
        }
    }

    /**
     * Copy of {@code payload} in which every nested map and list is copied and unmodifiable,
     * so a caller keeping a reference to the original cannot change what gets hashed.
     * Leaf values are shared; JSON-shaped leaves are immutable.
     */
    public static Map<String, Object> immutableCopy(Map<String, Object> payload) {
        if (payload == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, immutableValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(immutableValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Rejects payloads the canonical encoder cannot represent, then returns the
     * payload as it will read back from storage.
     */
    public static Map<String, Object> normalize(Map<String, Object> payload) {
        CanonicalEncoder.encodeValue(payload == null ? Map.of() : payload);
        return read(write(payload));
    }
}
