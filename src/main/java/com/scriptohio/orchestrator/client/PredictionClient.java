package com.scriptohio.orchestrator.client;

// no implementation ships; model capabilities are flagged unavailable without one
public interface PredictionClient {

    boolean isModelAvailable(String modelId);

    Prediction predict(String modelId, double[] features) throws PredictionException;
}
