package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.ReviewDecision;
import com.scriptohio.orchestrator.model.ReviewVerdict;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.scriptohio.orchestrator.agent.AgentInvocations.invocation;
import static org.junit.jupiter.api.Assertions.*;

class QualityAssuranceAgentTest {

    private final QualityAssuranceAgent agent = new QualityAssuranceAgent("quality-assurance-1");

    private ReviewDecision review(Object payload) throws Exception {
        Map<String, Object> message = new HashMap<>();
        message.put("payload", payload);
        return (ReviewDecision) agent.execute(AgentTypes.PEER_REVIEW, message, invocation()).getPayload();
    }

    @Test
    void shouldApproveSoundResult() throws Exception {
        ReviewDecision decision = review(Map.of("win_probability", 0.64, "confidence", 0.8));

        assertEquals(ReviewVerdict.APPROVE, decision.getVerdict());
        assertEquals("quality-assurance-1", decision.getReviewerId());
    }

    @Test
    void shouldRejectBrokenResults() throws Exception {
        assertEquals(ReviewVerdict.REJECT, review(Map.of("win_probability", 1.4)).getVerdict());
        assertEquals(ReviewVerdict.REJECT, review(Map.of("error", "model offline")).getVerdict());
        assertEquals(ReviewVerdict.REJECT, review(List.of()).getVerdict());
        assertEquals(ReviewVerdict.REJECT, review(null).getVerdict());
    }

    @Test
    void shouldAskForRevisionOnLowConfidence() throws Exception {
        assertEquals(ReviewVerdict.REVISE, review(Map.of("prediction", 3.0, "confidence", 0.3)).getVerdict());
    }

    @Test
    void shouldValidateResult() throws Exception {
        AgentResult result = agent.execute("validate_result", Map.of("payload", Map.of("win_probability", -0.1)),
            invocation());

        @SuppressWarnings("unchecked")
        Map<String, Object> report = (Map<String, Object>) result.getPayload();
        assertEquals(false, report.get("valid"));
        assertTrue(report.get("issue").toString().startsWith("probability out of range"));
    }
}
