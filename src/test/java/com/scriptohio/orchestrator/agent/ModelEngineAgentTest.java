package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.client.Prediction;
import com.scriptohio.orchestrator.client.PredictionClient;
import com.scriptohio.orchestrator.model.Capability;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.scriptohio.orchestrator.agent.AgentInvocations.invocation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelEngineAgentTest {

    @Mock
    private PredictionClient predictionClient;

    @Test
    void shouldPredictMarginFromFeatures() throws Exception {
        when(predictionClient.isModelAvailable(anyString())).thenReturn(true);
        when(predictionClient.predict(eq(ModelEngineAgent.MARGIN_MODEL), aryEq(new double[] {1.0, 2.5})))
            .thenReturn(new Prediction(ModelEngineAgent.MARGIN_MODEL, 6.5, null));
        ModelEngineAgent agent = new ModelEngineAgent("model-engine-1", predictionClient);

        AgentResult result = agent.execute("predict_outcome", Map.of("features", List.of(1, 2.5)), invocation());

        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) result.getPayload();
        assertEquals(6.5, payload.get("prediction"));
        assertEquals(ModelEngineAgent.MARGIN_MODEL, payload.get("model_id"));
        assertEquals(0.6, result.getConfidence());
        assertFalse(result.isRequestsPeerReview());
    }

    @Test
    void shouldAskForReviewOfWinProbability() throws Exception {
        when(predictionClient.isModelAvailable(anyString())).thenReturn(true);
        when(predictionClient.predict(eq(ModelEngineAgent.WIN_PROBABILITY_MODEL), any(double[].class)))
            .thenReturn(new Prediction(ModelEngineAgent.WIN_PROBABILITY_MODEL, 0.64, 0.82));
        ModelEngineAgent agent = new ModelEngineAgent("model-engine-1", predictionClient);

        AgentResult result = agent.execute("predict_win_probability", Map.of("features", List.of(0.3)), invocation());

        assertEquals(0.82, result.getConfidence());
        assertTrue(result.isRequestsPeerReview());
    }

    @Test
    void shouldRejectMissingOrNonNumericFeatures() {
        when(predictionClient.isModelAvailable(anyString())).thenReturn(true);
        ModelEngineAgent agent = new ModelEngineAgent("model-engine-1", predictionClient);

        assertThrows(IllegalArgumentException.class, () -> agent.execute("predict_outcome", Map.of(), invocation()));
        assertThrows(IllegalArgumentException.class,
            () -> agent.execute("predict_outcome", Map.of("features", List.of(1, "fast")), invocation()));
    }

    @Test
    void shouldMarkCapabilityUnavailableWhenModelMissing() {
        when(predictionClient.isModelAvailable(ModelEngineAgent.MARGIN_MODEL)).thenReturn(true);
        when(predictionClient.isModelAvailable(ModelEngineAgent.WIN_PROBABILITY_MODEL))
            .thenThrow(new IllegalStateException("pickle truncated"));

        ModelEngineAgent agent = new ModelEngineAgent("model-engine-1", predictionClient);

        assertTrue(agent.getDescriptor().findCapability("predict_outcome").map(Capability::isAvailable).orElseThrow());
        assertFalse(agent.getDescriptor().findCapability("predict_win_probability")
            .map(Capability::isAvailable).orElseThrow());
    }

    @Test
    void shouldExposeNothingUsableWithoutClient() {
        ModelEngineAgent agent = new ModelEngineAgent("model-engine-1", null);

        assertTrue(agent.getDescriptor().getCapabilities().stream().noneMatch(Capability::isAvailable));
    }
}
