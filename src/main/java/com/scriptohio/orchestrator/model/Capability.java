package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Capability {
    private String name;
    private String description;
    private PermissionLevel requiredPermission;

    @Builder.Default
    private List<String> requiredTools = new ArrayList<>();

    @Builder.Default
    private List<String> dataAccess = new ArrayList<>();

    private long estimatedExecutionMillis;

    // false when an optional dependency (model file, API key) is missing
    @Builder.Default
    private boolean available = true;
}
