package com.architecture.memory.flowgrade.dto.analysis;

import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two graphs in wire form plus the analysis of the problem they solve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareCfgsRequest {

    @NotNull(message = "cfg1 is required")
    private CfgRecord cfg1;

    @NotNull(message = "cfg2 is required")
    private CfgRecord cfg2;

    private JsonNode problemAnalysis;
}
