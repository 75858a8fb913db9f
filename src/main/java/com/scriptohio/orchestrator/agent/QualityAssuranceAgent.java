package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.ReviewDecision;
import com.scriptohio.orchestrator.model.ReviewVerdict;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class QualityAssuranceAgent extends AbstractAnalyticsAgent {

    static final double MIN_CONFIDENCE = 0.5;

    public QualityAssuranceAgent(String agentId) {
        super(AgentDescriptor.builder()
            .agentType(AgentTypes.QUALITY_ASSURANCE)
            .agentId(agentId)
            .name("Quality Assurance")
            .permissionLevel(PermissionLevel.READ_EXECUTE)
            .capabilities(List.of(
                capability(AgentTypes.PEER_REVIEW, "Approve, revise or reject another agent's result",
                    PermissionLevel.READ_EXECUTE, 100, List.of()),
                capability("validate_result", "Sanity checks on a result payload",
                    PermissionLevel.READ_EXECUTE, 100, List.of())))
            .expertiseDomains(List.of("validation", "quality"))
            .build());
        on(AgentTypes.PEER_REVIEW, this::review);
        on("validate_result", this::validate);
    }

    private AgentResult review(Map<String, Object> parameters, AgentInvocation invocation) {
        Object payload = parameters.get("payload");
        String problem = findProblem(payload);
        ReviewDecision decision;
        if (problem != null) {
            decision = ReviewDecision.of(getDescriptor().getAgentId(), ReviewVerdict.REJECT, problem);
        } else if (lowConfidence(payload)) {
            decision = ReviewDecision.of(getDescriptor().getAgentId(), ReviewVerdict.REVISE,
                "confidence below " + MIN_CONFIDENCE);
        } else {
            decision = ReviewDecision.of(getDescriptor().getAgentId(), ReviewVerdict.APPROVE, "ok");
        }
        return AgentResult.of(decision);
    }

    private AgentResult validate(Map<String, Object> parameters, AgentInvocation invocation) {
        Object payload = parameters.get("payload");
        String problem = findProblem(payload);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("valid", problem == null);
        report.put("issue", problem);
        return AgentResult.of(report, 1.0);
    }

    static String findProblem(Object payload) {
        if (payload == null) {
            return "empty result";
        }
        if (payload instanceof Collection<?> rows && rows.isEmpty()) {
            return "empty result";
        }
        if (payload instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return "empty result";
            }
            if (map.get("error") != null) {
                return "result carries an error: " + map.get("error");
            }
            Object probability = map.get("win_probability");
            if (probability instanceof Number p && (p.doubleValue() < 0 || p.doubleValue() > 1)) {
                return "probability out of range: " + p;
            }
        }
        return null;
    }

    private static boolean lowConfidence(Object payload) {
        return payload instanceof Map<?, ?> map
            && map.get("confidence") instanceof Number c
            && c.doubleValue() < MIN_CONFIDENCE;
    }
}
