package com.scriptohio.orchestrator.agent;

public final class AgentTypes {
    public static final String LEARNING_NAVIGATOR = "learning_navigator";
    public static final String INSIGHT_GENERATOR = "insight_generator";
    public static final String MODEL_ENGINE = "model_engine";
    public static final String SPORTS_DATA = "sports_data";
    public static final String QUALITY_ASSURANCE = "quality_assurance";

    public static final String PEER_REVIEW = "peer_review";

    private AgentTypes() {
    }
}
