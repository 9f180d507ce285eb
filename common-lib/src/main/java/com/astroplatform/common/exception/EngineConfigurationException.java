package com.astroplatform.common.exception;

/**
 * Invalid engine configuration (orb table, scoring weights, thresholds, tracked bodies).
 * Thrown while the engine is being wired, never during snapshot computation.
 */
public class EngineConfigurationException extends AstroEngineException {

    public EngineConfigurationException(String component, String message) {
        super(component, message);
    }
}
