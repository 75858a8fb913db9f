package com.scriptohio.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContextResource {
    @NotBlank
    private String id;
    private ResourceKind kind;
    private String focusArea;
    private String content;
}
