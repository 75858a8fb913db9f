package com.scriptohio.orchestrator.client;

public class PredictionException extends Exception {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
