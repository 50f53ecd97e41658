package com.architecture.memory.flowgrade.service.cfg;

import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.architecture.memory.flowgrade.service.cache.CacheCallTypes;
import com.architecture.memory.flowgrade.service.cache.CodeNormalizer;
import com.architecture.memory.flowgrade.service.llm.AnalysisPrompts;
import com.architecture.memory.flowgrade.service.llm.ImageAttachment;
import com.architecture.memory.flowgrade.service.llm.InferenceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns pseudocode or flowchart images into control-flow graphs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CfgGenerationService {

    private final CfgCachePipeline pipeline;
    private final CodeNormalizer codeNormalizer;
    private final InferenceClient inferenceClient;

    /**
     * Pseudocode is normalized before hashing, so comment, semicolon, whitespace and case
     * differences hit the same cache entry. The model still sees the original text.
     */
    public ControlFlowGraph pseudocodeToCfg(String pseudocode) {
        if (pseudocode == null || pseudocode.isBlank()) {
            throw new IllegalArgumentException("Pseudocode is empty");
        }
        log.info("[CFG] Converting pseudocode ({} chars)", pseudocode.length());

        return pipeline.getOrCompute(
                CacheCallTypes.PSEUDOCODE_TO_CFG,
                List.of(codeNormalizer.normalize(pseudocode)),
                () -> inferenceClient.invoke(AnalysisPrompts.PSEUDOCODE_TO_CFG + "\n\nPseudocode:\n" + pseudocode),
                "Error parsing pseudocode");
    }

    /**
     * The image string is hashed exactly as supplied.
     */
    public ControlFlowGraph flowchartToCfg(String base64Image) {
        ImageAttachment image = ImageAttachment.fromBase64(base64Image);
        log.info("[CFG] Converting flowchart image ({})", image.getMimeType());

        return pipeline.getOrCompute(
                CacheCallTypes.FLOWCHART_TO_CFG,
                List.of(base64Image),
                () -> inferenceClient.invoke(AnalysisPrompts.FLOWCHART_TO_CFG, image),
                "Error parsing flowchart");
    }
}
