package com.scriptohio.orchestrator.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    public static final String UNSPECIFIED = "unspecified";
    public static final String USER_ID = "user_id";
    public static final String ROLE = "role";
    public static final String PERMISSION = "permission";

    @NotBlank
    private String requestId;

    // null, blank or "unspecified" means auto-route
    private String agentType;

    private String action;

    private String query;

    @NotNull
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @NotNull
    @Builder.Default
    private Map<String, Object> userContext = new HashMap<>();

    @PositiveOrZero
    private long timestamp;

    // higher = more urgent; reported back in response metadata and logs
    private int priority;

    @Builder.Default
    private List<@Valid @NotNull SubTask> subtasks = new ArrayList<>();

    @Builder.Default
    private List<@Valid @NotNull ContextResource> context = new ArrayList<>();

    public String getUserId() {
        Object userId = userContext == null ? null : userContext.get(USER_ID);
        return userId == null ? null : userId.toString();
    }

    public boolean isAutoRouted() {
        return agentType == null || agentType.isBlank() || UNSPECIFIED.equalsIgnoreCase(agentType);
    }
}
