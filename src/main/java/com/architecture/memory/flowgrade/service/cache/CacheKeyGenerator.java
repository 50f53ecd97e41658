package com.architecture.memory.flowgrade.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives deterministic cache keys: SHA-256 over the call type and content parts
 * joined with "||", rendered as 64 lowercase hex characters.
 *
 * Structured parts must go through {@link #canonicalJson(Object)} first so that
 * equal structures always hash the same regardless of map or property order.
 */
@Component
public class CacheKeyGenerator {

    static final String SEPARATOR = "||";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String generate(String callType, String... contentParts) {
        return generate(callType, List.of(contentParts));
    }

    public String generate(String callType, List<String> contentParts) {
        String combined = callType + SEPARATOR + String.join(SEPARATOR, contentParts);
        return sha256(combined);
    }

    /**
     * Serialize a structure with sorted keys. JsonNode trees are re-read through a sorted
     * map view since ObjectNode keeps insertion order.
     */
    public String canonicalJson(Object value) {
        try {
            Object tree = canonicalMapper.convertValue(value, Object.class);
            return canonicalMapper.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Cannot serialize cache key part: " + e.getMessage(), e);
        }
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
