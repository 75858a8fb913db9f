package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.AgentRequest;
import com.scriptohio.orchestrator.model.PermissionLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class RoleDetector {

    public static final String ANALYST = "analyst";
    public static final String DATA_SCIENTIST = "data_scientist";
    public static final String PRODUCTION = "production";

    static final Set<String> KNOWN_ROLES = Set.of(ANALYST, DATA_SCIENTIST, PRODUCTION);

    private static final List<String> LEARNING_WORDS = List.of("learn", "tutorial", "explain");
    private static final List<String> PRODUCTION_WORDS = List.of("predict", "production", "api", "deploy");
    private static final List<String> MODELING_WORDS = List.of("feature", "model", "optimize", "advanced");

    private static final Map<String, PermissionLevel> ROLE_PERMISSIONS = Map.of(
        ANALYST, PermissionLevel.READ_EXECUTE_WRITE,
        DATA_SCIENTIST, PermissionLevel.READ_EXECUTE_WRITE,
        PRODUCTION, PermissionLevel.READ_EXECUTE
    );

    public String detectRole(Map<String, Object> userContext, String query) {
        Object declared = userContext == null ? null : userContext.get(AgentRequest.ROLE);
        if (declared != null) {
            String role = declared.toString().trim().toLowerCase(Locale.ROOT);
            if (KNOWN_ROLES.contains(role)) {
                return role;
            }
        }

        String text = query == null ? "" : query.toLowerCase(Locale.ROOT);
        if (containsAny(text, LEARNING_WORDS)) {
            return ANALYST;
        }
        if (containsAny(text, PRODUCTION_WORDS)) {
            return PRODUCTION;
        }
        if (containsAny(text, MODELING_WORDS)) {
            return DATA_SCIENTIST;
        }
        return ANALYST;
    }

    // an explicit permission in the user context wins; an unparseable one counts as missing
    public PermissionLevel permissionFor(String role, Map<String, Object> userContext) {
        if (userContext != null && userContext.containsKey(AgentRequest.PERMISSION)) {
            PermissionLevel explicit = PermissionLevel.parse(userContext.get(AgentRequest.PERMISSION));
            if (explicit != null) {
                return explicit;
            }
        }
        return ROLE_PERMISSIONS.getOrDefault(role, PermissionLevel.READ_ONLY);
    }

    static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
