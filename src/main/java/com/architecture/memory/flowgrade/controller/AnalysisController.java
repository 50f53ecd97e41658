package com.architecture.memory.flowgrade.controller;

import com.architecture.memory.flowgrade.dto.analysis.CompareCfgsRequest;
import com.architecture.memory.flowgrade.dto.analysis.FlowchartRequest;
import com.architecture.memory.flowgrade.dto.analysis.ProblemAnalysisRequest;
import com.architecture.memory.flowgrade.dto.analysis.PseudocodeRequest;
import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.architecture.memory.flowgrade.service.analysis.CfgComparisonService;
import com.architecture.memory.flowgrade.service.analysis.ProblemAnalysisService;
import com.architecture.memory.flowgrade.service.cfg.CfgAssembler;
import com.architecture.memory.flowgrade.service.cfg.CfgGenerationService;
import com.architecture.memory.flowgrade.service.cfg.CfgRecordValidator;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoints for graph extraction, problem analysis and solution comparison.
 * Graphs go out in the same snake_case record form that is cached.
 */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final CfgGenerationService cfgGenerationService;
    private final ProblemAnalysisService problemAnalysisService;
    private final CfgComparisonService cfgComparisonService;
    private final CfgRecordValidator validator;
    private final CfgAssembler assembler;

    @PostMapping("/cfg/pseudocode")
    public ResponseEntity<CfgRecord> pseudocodeToCfg(@Valid @RequestBody PseudocodeRequest request) {
        ControlFlowGraph graph = cfgGenerationService.pseudocodeToCfg(request.getPseudocode());
        return ResponseEntity.ok(assembler.toRecord(graph));
    }

    @PostMapping("/cfg/flowchart")
    public ResponseEntity<CfgRecord> flowchartToCfg(@Valid @RequestBody FlowchartRequest request) {
        ControlFlowGraph graph = cfgGenerationService.flowchartToCfg(request.getImage());
        return ResponseEntity.ok(assembler.toRecord(graph));
    }

    @PostMapping("/problem")
    public ResponseEntity<JsonNode> analyzeProblem(@Valid @RequestBody ProblemAnalysisRequest request) {
        return ResponseEntity.ok(problemAnalysisService.analyzeProblem(request.getProblemStatement()));
    }

    /**
     * Client-supplied graphs go through the same repair and consistency checks as model output.
     */
    @PostMapping("/compare")
    public ResponseEntity<JsonNode> compareCfgs(@Valid @RequestBody CompareCfgsRequest request) {
        log.info("Comparing two submitted control flow graphs");
        ControlFlowGraph cfg1 = assembler.toEntity(validator.validate(request.getCfg1()));
        ControlFlowGraph cfg2 = assembler.toEntity(validator.validate(request.getCfg2()));
        return ResponseEntity.ok(cfgComparisonService.compareCfgs(cfg1, cfg2, request.getProblemAnalysis()));
    }
}
