package com.astroplatform.common.model;

import com.astroplatform.common.angle.AngleMath;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One celestial body at one instant. Computed fresh per instant, never merged across instants.
 *
 * <p>Use {@link #of(CelestialBody, double, double)} to build from raw provider output;
 * the canonical constructor checks that the derived fields agree with the longitude.
 */
public record BodyPosition(
    @JsonProperty("body")         CelestialBody body,
    @JsonProperty("longitude")    double longitude,
    @JsonProperty("speed")        double speed,
    @JsonProperty("sign")         ZodiacSign sign,
    @JsonProperty("degreeInSign") double degreeInSign,
    @JsonProperty("placement")    Placement placement
) {
    public BodyPosition {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        if (!(longitude >= 0.0 && longitude < 360.0)) {
            throw new IllegalArgumentException("longitude out of [0,360): " + longitude);
        }
        if (!Double.isFinite(speed)) {
            throw new IllegalArgumentException("speed must be finite: " + speed);
        }
        if (sign != ZodiacSign.fromLongitude(longitude)) {
            throw new IllegalArgumentException("sign " + sign + " does not match longitude " + longitude);
        }
    }

    public static BodyPosition of(CelestialBody body, double rawLongitude, double speed) {
        double longitude = AngleMath.normalize(rawLongitude);
        ZodiacSign sign = ZodiacSign.fromLongitude(longitude);
        // floor(lon / 30) can round up just below a cusp
        double degreeInSign = Math.max(0.0, longitude - sign.ordinal() * ZodiacSign.SIGN_WIDTH);
        return new BodyPosition(body, longitude, speed, sign, degreeInSign,
                                Placement.fromDegreeInSign(degreeInSign));
    }

    @JsonIgnore
    public boolean isRetrograde() {
        return speed < 0.0;
    }
}
