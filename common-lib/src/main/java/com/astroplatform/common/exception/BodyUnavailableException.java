package com.astroplatform.common.exception;

import com.astroplatform.common.model.CelestialBody;

/**
 * Raised by an {@link com.astroplatform.common.ephemeris.EphemerisProvider} that cannot
 * resolve a single body. The assembler absorbs it into a
 * {@link com.astroplatform.common.model.BodyFailure}; it never aborts a snapshot.
 */
public class BodyUnavailableException extends AstroEngineException {

    private final CelestialBody body;

    public BodyUnavailableException(CelestialBody body, String message) {
        super("EphemerisProvider", body.displayName() + ": " + message);
        this.body = body;
    }

    public BodyUnavailableException(CelestialBody body, String message, Throwable cause) {
        super("EphemerisProvider", body.displayName() + ": " + message, cause);
        this.body = body;
    }

    public CelestialBody getBody() {
        return body;
    }
}
