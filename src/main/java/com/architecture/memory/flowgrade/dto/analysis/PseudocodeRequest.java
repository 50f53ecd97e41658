package com.architecture.memory.flowgrade.dto.analysis;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PseudocodeRequest {

    @NotBlank(message = "Pseudocode is required")
    private String pseudocode;
}
