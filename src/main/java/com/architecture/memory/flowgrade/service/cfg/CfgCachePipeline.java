package com.architecture.memory.flowgrade.service.cfg;

import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.architecture.memory.flowgrade.service.cache.AiResponseCacheService;
import com.architecture.memory.flowgrade.service.cache.CacheKeyGenerator;
import com.architecture.memory.flowgrade.service.llm.LlmJsonParser;
import com.architecture.memory.flowgrade.service.llm.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aware path from canonical input to a {@link ControlFlowGraph}.
 *
 * Flow:
 * 1. Derive the key from the call type and the canonical content parts
 * 2. On a hit, validate and assemble the stored record; the model is not called
 * 3. On a miss, call the model, decode, validate and assemble
 * 4. Store the validated record (never the raw reply) under the same key
 *
 * A cached entry that no longer decodes as a graph record is a miss and gets recomputed.
 * Undecodable replies yield the fallback graph and are not cached. Transport failures and
 * structural errors propagate and are not cached either. Two concurrent misses on the same
 * key both call the model; the later store wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CfgCachePipeline {

    static final String DEFAULT_FALLBACK_LABEL = "Error parsing response";

    private final AiResponseCacheService cacheService;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final CfgRecordValidator validator;
    private final CfgAssembler assembler;
    private final LlmJsonParser jsonParser;

    public ControlFlowGraph getOrCompute(String callType, List<String> contentParts, Supplier<String> compute) {
        return getOrCompute(callType, contentParts, compute, DEFAULT_FALLBACK_LABEL);
    }

    /**
     * @param compute       produces the raw model reply; may throw {@code InferenceTransportException}
     * @param fallbackLabel label of the PROCESS node in the fallback graph
     * @throws com.architecture.memory.flowgrade.exception.CfgStructureException if the record
     *         (fresh or cached) has edges pointing at unknown nodes
     */
    public ControlFlowGraph getOrCompute(String callType, List<String> contentParts,
                                         Supplier<String> compute, String fallbackLabel) {
        String contentHash = cacheKeyGenerator.generate(callType, contentParts);

        Optional<CfgRecord> cached = cacheService.get(callType, contentHash, CfgRecord.class);
        if (cached.isPresent()) {
            return assembler.toEntity(validator.validate(cached.get()));
        }

        String reply = compute.get();
        ParseResult<CfgRecord> parsed = jsonParser.parse(reply, CfgRecord.class);
        if (!parsed.isOk()) {
            log.warn("[CFG] Unparsable {} reply ({}), returning fallback graph. Reply: {}",
                    callType, parsed.getFailureReason(), truncate(reply));
            return assembler.fallbackGraph(fallbackLabel);
        }

        CfgRecord validated = validator.validate(parsed.getValue());
        ControlFlowGraph graph = assembler.toEntity(validated);

        cacheService.set(callType, contentHash, validated);
        log.info("[CFG] Built {} graph with {} nodes and {} edges",
                callType, graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
