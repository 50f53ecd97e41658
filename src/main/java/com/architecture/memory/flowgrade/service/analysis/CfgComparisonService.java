package com.architecture.memory.flowgrade.service.analysis;

import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.dto.cfg.StructuralMetrics;
import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.architecture.memory.flowgrade.service.cache.CacheCallTypes;
import com.architecture.memory.flowgrade.service.cache.CacheKeyGenerator;
import com.architecture.memory.flowgrade.service.cfg.CfgAssembler;
import com.architecture.memory.flowgrade.service.llm.AnalysisPrompts;
import com.architecture.memory.flowgrade.service.llm.InferenceClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which of two solutions is better from their control-flow graphs and the problem analysis.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CfgComparisonService {

    private final JsonResultPipeline pipeline;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final CfgAssembler assembler;
    private final InferenceClient inferenceClient;

    private final ObjectMapper prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * The cache key covers both graphs and the analysis, each serialized with sorted keys.
     * Swapping the two graphs is a different comparison and gets its own entry.
     */
    public JsonNode compareCfgs(ControlFlowGraph cfg1, ControlFlowGraph cfg2, JsonNode problemAnalysis) {
        CfgRecord record1 = assembler.toRecord(cfg1);
        CfgRecord record2 = assembler.toRecord(cfg2);
        JsonNode analysis = problemAnalysis != null && !problemAnalysis.isNull()
                ? problemAnalysis
                : JsonNodeFactory.instance.objectNode();

        Map<String, StructuralMetrics> metrics = new LinkedHashMap<>();
        metrics.put("cfg1", StructuralMetrics.of(cfg1));
        metrics.put("cfg2", StructuralMetrics.of(cfg2));

        log.info("[Analysis] Comparing solutions: {} vs {} nodes, complexity {} vs {}",
                cfg1.getNodes().size(), cfg2.getNodes().size(), cfg1.getComplexity(), cfg2.getComplexity());

        List<String> contentParts = List.of(
                cacheKeyGenerator.canonicalJson(record1),
                cacheKeyGenerator.canonicalJson(record2),
                cacheKeyGenerator.canonicalJson(analysis));

        return pipeline.getOrCompute(
                CacheCallTypes.COMPARE_CFGS,
                contentParts,
                () -> inferenceClient.invoke(buildPrompt(record1, record2, analysis, metrics)));
    }

    private String buildPrompt(CfgRecord record1, CfgRecord record2, JsonNode analysis,
                               Map<String, StructuralMetrics> metrics) {
        try {
            return AnalysisPrompts.COMPARE_CFGS
                    + "\n\nProblem Analysis:\n" + prettyMapper.writeValueAsString(analysis)
                    + "\n\nSolution 1 CFG:\n" + prettyMapper.writeValueAsString(record1)
                    + "\n\nSolution 2 CFG:\n" + prettyMapper.writeValueAsString(record2)
                    + "\n\nStructural Metrics:\n" + prettyMapper.writeValueAsString(metrics)
                    + "\n\nCompare these solutions and determine which is better.";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize comparison prompt", e);
        }
    }
}
