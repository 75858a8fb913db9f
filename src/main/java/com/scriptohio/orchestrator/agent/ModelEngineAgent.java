package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.client.Prediction;
import com.scriptohio.orchestrator.client.PredictionClient;
import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.Capability;
import com.scriptohio.orchestrator.model.PermissionLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ModelEngineAgent extends AbstractAnalyticsAgent {

    public static final String MARGIN_MODEL = "ridge_model_2025";
    public static final String WIN_PROBABILITY_MODEL = "xgb_home_win_model_2025";

    private final PredictionClient predictionClient;

    public ModelEngineAgent(String agentId, PredictionClient predictionClient) {
        super(AgentDescriptor.builder()
            .agentType(AgentTypes.MODEL_ENGINE)
            .agentId(agentId)
            .name("Model Execution Engine")
            .permissionLevel(PermissionLevel.READ_EXECUTE)
            .capabilities(List.of(
                modelCapability("predict_outcome", "Predicted home scoring margin",
                    MARGIN_MODEL, predictionClient),
                modelCapability("predict_win_probability", "Home win probability",
                    WIN_PROBABILITY_MODEL, predictionClient)))
            .expertiseDomains(List.of("predictive_modeling", "game_outcomes", "win_probability"))
            .build());
        this.predictionClient = predictionClient;
        on("predict_outcome", (parameters, invocation) -> predict(MARGIN_MODEL, parameters, false));
        on("predict_win_probability", (parameters, invocation) -> predict(WIN_PROBABILITY_MODEL, parameters, true));
    }

    private AgentResult predict(String modelId, Map<String, Object> parameters, boolean review) throws Exception {
        double[] features = features(parameters.get("features"));
        Prediction prediction = predictionClient.predict(modelId, features);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_id", modelId);
        payload.put("prediction", prediction.getValue());
        payload.put("confidence", prediction.getConfidence());
        return AgentResult.builder()
            .payload(payload)
            .confidence(prediction.getConfidence() == null ? 0.6 : prediction.getConfidence())
            .requestsPeerReview(review)
            .build();
    }

    private static double[] features(Object raw) {
        if (!(raw instanceof Collection<?> values) || values.isEmpty()) {
            throw new IllegalArgumentException("Parameter 'features' must be a non-empty list of numbers");
        }
        double[] vector = new double[values.size()];
        int i = 0;
        for (Object value : values) {
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException("Feature " + i + " is not numeric: " + value);
            }
            vector[i++] = number.doubleValue();
        }
        return vector;
    }

    private static Capability modelCapability(String name, String description, String modelId,
                                              PredictionClient client) {
        Capability capability = capability(name, description, PermissionLevel.READ_EXECUTE, 500,
            List.of("models/" + modelId));
        capability.setRequiredTools(List.of(modelId));
        capability.setAvailable(isLoadable(client, modelId));
        return capability;
    }

    private static boolean isLoadable(PredictionClient client, String modelId) {
        if (client == null) {
            return false;
        }
        try {
            return client.isModelAvailable(modelId);
        } catch (RuntimeException e) {
            log.warn("Model {} could not be checked, marking capability unavailable: {}", modelId, e.getMessage());
            return false;
        }
    }
}
