package com.scriptohio.orchestrator.client;

import lombok.Getter;

@Getter
public class DataSourceException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        UNAUTHORIZED,
        NOT_FOUND,
        TRANSPORT
    }

    private final Kind kind;

    public DataSourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DataSourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
