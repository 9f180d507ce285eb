package com.astroplatform.common.ephemeris;

import com.astroplatform.common.exception.BodyUnavailableException;
import com.astroplatform.common.model.CelestialBody;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic provider returning the same reading for a body at every instant.
 *
 * <p>Bodies without a reading, or listed as failing, raise {@link BodyUnavailableException}.
 * Immutable and therefore safe to share.
 */
public final class FixedEphemerisProvider implements EphemerisProvider {

    private final Map<CelestialBody, EphemerisReading> readings;
    private final Set<CelestialBody> failing;

    private FixedEphemerisProvider(Map<CelestialBody, EphemerisReading> readings, Set<CelestialBody> failing) {
        this.readings = Collections.unmodifiableMap(readings);
        this.failing = Collections.unmodifiableSet(failing);
    }

    public static FixedEphemerisProvider of(Map<CelestialBody, EphemerisReading> readings) {
        return new FixedEphemerisProvider(copy(readings), EnumSet.noneOf(CelestialBody.class));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A copy of this provider that additionally fails for {@code body}. */
    public FixedEphemerisProvider failing(CelestialBody body) {
        Set<CelestialBody> f = EnumSet.noneOf(CelestialBody.class);
        f.addAll(failing);
        f.add(body);
        return new FixedEphemerisProvider(copy(readings), f);
    }

    @Override
    public EphemerisReading position(Instant instant, CelestialBody body) {
        if (failing.contains(body)) {
            throw new BodyUnavailableException(body, "configured to fail");
        }
        EphemerisReading reading = readings.get(body);
        if (reading == null) {
            throw new BodyUnavailableException(body, "no fixed reading");
        }
        return reading;
    }

    private static Map<CelestialBody, EphemerisReading> copy(Map<CelestialBody, EphemerisReading> source) {
        Map<CelestialBody, EphemerisReading> m = new EnumMap<>(CelestialBody.class);
        m.putAll(source);
        return m;
    }

    public static final class Builder {
        private final Map<CelestialBody, EphemerisReading> readings = new EnumMap<>(CelestialBody.class);
        private final Set<CelestialBody> failing = EnumSet.noneOf(CelestialBody.class);

        private Builder() {}

        public Builder body(CelestialBody body, double longitude, double speed) {
            readings.put(body, new EphemerisReading(longitude, speed));
            return this;
        }

        public Builder failing(CelestialBody body) {
            failing.add(body);
            return this;
        }

        public FixedEphemerisProvider build() {
            Set<CelestialBody> f = EnumSet.noneOf(CelestialBody.class);
            f.addAll(failing);
            return new FixedEphemerisProvider(copy(readings), f);
        }
    }
}
