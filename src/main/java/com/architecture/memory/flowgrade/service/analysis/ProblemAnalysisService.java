package com.architecture.memory.flowgrade.service.analysis;

import com.architecture.memory.flowgrade.service.cache.CacheCallTypes;
import com.architecture.memory.flowgrade.service.llm.AnalysisPrompts;
import com.architecture.memory.flowgrade.service.llm.InferenceClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Extracts requirements and the expected solution shape from a problem statement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProblemAnalysisService {

    private final JsonResultPipeline pipeline;
    private final InferenceClient inferenceClient;

    public JsonNode analyzeProblem(String problemStatement) {
        if (problemStatement == null || problemStatement.isBlank()) {
            throw new IllegalArgumentException("Problem statement is empty");
        }
        log.info("[Analysis] Analyzing problem statement ({} chars)", problemStatement.length());

        return pipeline.getOrCompute(
                CacheCallTypes.ANALYZE_PROBLEM,
                List.of(problemStatement),
                () -> inferenceClient.invoke(
                        AnalysisPrompts.ANALYZE_PROBLEM + "\n\nProblem Statement:\n" + problemStatement));
    }
}
