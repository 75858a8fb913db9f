package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.ErrorKind;
import lombok.Getter;

@Getter
public class RoutingException extends RuntimeException {

    private final ErrorKind kind;

    public RoutingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
