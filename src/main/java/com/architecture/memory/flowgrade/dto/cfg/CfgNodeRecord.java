package com.architecture.memory.flowgrade.dto.cfg;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CfgNodeRecord {

    private String id;

    private String type;        // START, END, PROCESS, DECISION, LOOP, FUNCTION_CALL, RETURN

    private String label;

    @JsonProperty("next_nodes")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> nextNodeIds;

    private String condition;   // DECISION nodes only; null means "not a decision"
}
