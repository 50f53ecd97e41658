package com.architecture.memory.flowgrade.dto.analysis;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowchartRequest {

    // Raw base64 or data URL
    @NotBlank(message = "Image is required")
    private String image;
}
