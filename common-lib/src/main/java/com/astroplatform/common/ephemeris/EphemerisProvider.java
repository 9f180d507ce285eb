package com.astroplatform.common.ephemeris;

import com.astroplatform.common.exception.BodyUnavailableException;
import com.astroplatform.common.model.CelestialBody;

import java.time.Instant;

/**
 * Strategy interface: an analytic in-process ephemeris, or a fixed table for tests and replays.
 *
 * <p>Implementations are not required to be thread-safe. Callers computing snapshots
 * concurrently obtain one provider per worker from an {@link EphemerisProviderFactory}.
 */
public interface EphemerisProvider {

    /**
     * @throws BodyUnavailableException when this body cannot be resolved at {@code instant};
     *                                  other bodies may still succeed
     */
    EphemerisReading position(Instant instant, CelestialBody body);

    /** Whether {@code instant} lies inside the range this provider can compute. */
    default boolean supports(Instant instant) {
        return true;
    }
}
