package com.scriptohio.orchestrator.agent;

public class AgentUnavailableException extends Exception {

    public AgentUnavailableException(String message) {
        super(message);
    }

    public AgentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
