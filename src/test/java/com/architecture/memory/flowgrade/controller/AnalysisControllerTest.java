package com.architecture.memory.flowgrade.controller;

import com.architecture.memory.flowgrade.dto.analysis.CompareCfgsRequest;
import com.architecture.memory.flowgrade.dto.cfg.CfgEdgeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgNodeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.exception.GlobalExceptionHandler;
import com.architecture.memory.flowgrade.exception.InferenceTransportException;
import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.architecture.memory.flowgrade.service.analysis.CfgComparisonService;
import com.architecture.memory.flowgrade.service.analysis.ProblemAnalysisService;
import com.architecture.memory.flowgrade.service.cfg.CfgAssembler;
import com.architecture.memory.flowgrade.service.cfg.CfgGenerationService;
import com.architecture.memory.flowgrade.service.cfg.CfgRecordValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private CfgGenerationService cfgGenerationService;

    @Mock
    private ProblemAnalysisService problemAnalysisService;

    @Mock
    private CfgComparisonService cfgComparisonService;

    private final CfgAssembler assembler = new CfgAssembler();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AnalysisController controller = new AnalysisController(cfgGenerationService, problemAnalysisService,
                cfgComparisonService, new CfgRecordValidator(), assembler);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void pseudocodeReturnsGraphInSnakeCase() throws Exception {
        ControlFlowGraph graph = assembler.fallbackGraph("sum = a + b");
        when(cfgGenerationService.pseudocodeToCfg("sum = a + b")).thenReturn(graph);

        mockMvc.perform(post("/api/analysis/cfg/pseudocode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pseudocode\": \"sum = a + b\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].type").value("START"))
                .andExpect(jsonPath("$.nodes[0].next_nodes[0]").value("node2"))
                .andExpect(jsonPath("$.nodes[1].label").value("sum = a + b"))
                .andExpect(jsonPath("$.num_paths").value(1))
                .andExpect(jsonPath("$.nesting_depth").value(0));
    }

    @Test
    void blankPseudocodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis/cfg/pseudocode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pseudocode\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(cfgGenerationService);
    }

    @Test
    void invalidImageIsBadRequest() throws Exception {
        when(cfgGenerationService.flowchartToCfg(anyString()))
                .thenThrow(new IllegalArgumentException("Image payload is not valid base64"));

        mockMvc.perform(post("/api/analysis/cfg/flowchart")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\": \"%%%\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Image payload is not valid base64"));
    }

    @Test
    void modelOutageIsBadGateway() throws Exception {
        when(problemAnalysisService.analyzeProblem(anyString()))
                .thenThrow(new InferenceTransportException("Inference call failed: timeout", null));

        mockMvc.perform(post("/api/analysis/problem")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problemStatement\": \"Reverse a linked list\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Bad Gateway"));
    }

    @Test
    void problemAnalysisIsPassedThrough() throws Exception {
        when(problemAnalysisService.analyzeProblem("Reverse a linked list"))
                .thenReturn(JsonNodeFactory.instance.objectNode().put("problem_type", "linked lists"));

        mockMvc.perform(post("/api/analysis/problem")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problemStatement\": \"Reverse a linked list\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.problem_type").value("linked lists"));
    }

    @Test
    void compareRepairsSubmittedGraphs() throws Exception {
        when(cfgComparisonService.compareCfgs(any(), any(), any()))
                .thenReturn(JsonNodeFactory.instance.objectNode().put("better_solution", 2));
        CompareCfgsRequest request = CompareCfgsRequest.builder()
                .cfg1(CfgRecord.builder().nodes(List.of(new CfgNodeRecord())).build())
                .cfg2(new CfgRecord())
                .build();

        mockMvc.perform(post("/api/analysis/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.better_solution").value(2));
    }

    @Test
    void compareWithDanglingEdgeIsUnprocessable() throws Exception {
        CompareCfgsRequest request = CompareCfgsRequest.builder()
                .cfg1(CfgRecord.builder()
                        .nodes(List.of(CfgNodeRecord.builder().id("a").build()))
                        .edges(List.of(CfgEdgeRecord.builder().from("a").to("b").build()))
                        .build())
                .cfg2(new CfgRecord())
                .build();

        mockMvc.perform(post("/api/analysis/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.nodeIds[0]").value("b"));

        verifyNoInteractions(cfgComparisonService);
    }

    @Test
    void compareWithoutSecondGraphIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cfg1\": {\"nodes\": []}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cfg2: cfg2 is required"));
    }
}
