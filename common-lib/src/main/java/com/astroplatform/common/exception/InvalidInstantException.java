package com.astroplatform.common.exception;

/**
 * Raised when the requested instant is missing, malformed or outside the range the
 * ephemeris provider supports. No snapshot is produced for such an instant.
 */
public class InvalidInstantException extends AstroEngineException {

    public InvalidInstantException(String message) {
        super("SnapshotAssembler", message);
    }

    public InvalidInstantException(String message, Throwable cause) {
        super("SnapshotAssembler", message, cause);
    }
}
