package com.astroplatform.common.exception;

public class AstroEngineException extends RuntimeException {
    private final String component;

    public AstroEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AstroEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
