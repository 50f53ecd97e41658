package com.architecture.memory.flowgrade.service.analysis;

import com.architecture.memory.flowgrade.service.cache.AiResponseCacheService;
import com.architecture.memory.flowgrade.service.cache.CacheKeyGenerator;
import com.architecture.memory.flowgrade.service.llm.LlmJsonParser;
import com.architecture.memory.flowgrade.service.llm.ParseResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aware path for free-form JSON results (problem analysis, comparisons).
 * An undecodable reply becomes an error object flagged with {@code parse_failed} and is not cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonResultPipeline {

    private final AiResponseCacheService cacheService;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final LlmJsonParser jsonParser;

    public JsonNode getOrCompute(String callType, List<String> contentParts, Supplier<String> compute) {
        String contentHash = cacheKeyGenerator.generate(callType, contentParts);

        Optional<ObjectNode> cached = cacheService.get(callType, contentHash, ObjectNode.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        String reply = compute.get();
        ParseResult<JsonNode> parsed = jsonParser.parseTree(reply);
        if (!parsed.isOk()) {
            log.warn("[Inference] Unparsable {} reply: {}", callType, parsed.getFailureReason());
            ObjectNode error = JsonNodeFactory.instance.objectNode();
            error.put("error", "Could not parse model response: " + parsed.getFailureReason());
            error.put("parse_failed", true);
            return error;
        }

        cacheService.set(callType, contentHash, parsed.getValue());
        return parsed.getValue();
    }
}
