package com.astroplatform.snapshot.provider;

import com.astroplatform.common.angle.AngleMath;
import com.astroplatform.common.ephemeris.EphemerisProvider;
import com.astroplatform.common.ephemeris.EphemerisReading;
import com.astroplatform.common.exception.BodyUnavailableException;
import com.astroplatform.common.model.CelestialBody;

import java.time.Instant;

/**
 * In-process analytic ephemeris: geocentric ecliptic longitudes, mean equinox of date.
 *
 * <p><strong>Method:</strong>
 * <ul>
 *   <li>Planets and the Sun: heliocentric positions from {@link OrbitalElements}, minus the
 *       Earth–Moon barycentre, converted to longitude and precessed from J2000 to date.</li>
 *   <li>Moon: {@link LunarSeries}.</li>
 *   <li>Speed: central difference over ±{@value #HALF_STEP_DAYS} day, wrap-corrected.</li>
 * </ul>
 *
 * <p>Agrees with published ephemerides to within a fraction of a degree for 1800–2050,
 * the validity range of the elements. {@link #supports(Instant)} rejects anything outside it.
 * Geometric positions only: no light-time, aberration or nutation.
 *
 * <p>Stateless; a single instance may be shared.
 */
public class KeplerianEphemerisProvider implements EphemerisProvider {

    static final Instant RANGE_START = Instant.parse("1800-01-01T00:00:00Z");
    static final Instant RANGE_END   = Instant.parse("2050-12-31T23:59:59Z");

    private static final double HALF_STEP_DAYS = 0.5;
    // general precession in longitude, degrees per Julian century
    private static final double PRECESSION_PER_CENTURY = 1.396971;

    @Override
    public EphemerisReading position(Instant instant, CelestialBody body) {
        double jd = JulianDay.fromInstant(instant);
        double longitude = longitudeAt(body, jd);
        double before    = longitudeAt(body, jd - HALF_STEP_DAYS);
        double after     = longitudeAt(body, jd + HALF_STEP_DAYS);

        // wrap-corrected difference in (-180, 180]
        double change = AngleMath.normalize(after - before + AngleMath.HALF_CIRCLE) - AngleMath.HALF_CIRCLE;
        double speed = change / (2.0 * HALF_STEP_DAYS);

        if (!Double.isFinite(longitude) || !Double.isFinite(speed)) {
            throw new BodyUnavailableException(body, "non-finite position at jd=" + jd);
        }
        return new EphemerisReading(AngleMath.normalize(longitude), speed);
    }

    @Override
    public boolean supports(Instant instant) {
        return instant != null && !instant.isBefore(RANGE_START) && !instant.isAfter(RANGE_END);
    }

    double longitudeAt(CelestialBody body, double jd) {
        double t = JulianDay.centuriesSinceJ2000(jd);
        if (body == CelestialBody.MOON) {
            return LunarSeries.longitude(t);
        }

        double[] earth = OrbitalElements.EARTH_MOON_BARYCENTER.heliocentric(t);
        double x;
        double y;
        if (body == CelestialBody.SUN) {
            x = -earth[0];
            y = -earth[1];
        } else {
            double[] planet = elementsFor(body).heliocentric(t);
            x = planet[0] - earth[0];
            y = planet[1] - earth[1];
        }
        double j2000Longitude = Math.toDegrees(Math.atan2(y, x));
        return j2000Longitude + PRECESSION_PER_CENTURY * t;
    }

    private static OrbitalElements elementsFor(CelestialBody body) {
        return switch (body) {
            case MERCURY -> OrbitalElements.MERCURY;
            case VENUS   -> OrbitalElements.VENUS;
            case MARS    -> OrbitalElements.MARS;
            case JUPITER -> OrbitalElements.JUPITER;
            case SATURN  -> OrbitalElements.SATURN;
            case URANUS  -> OrbitalElements.URANUS;
            case NEPTUNE -> OrbitalElements.NEPTUNE;
            case PLUTO   -> OrbitalElements.PLUTO;
            case SUN, MOON -> throw new BodyUnavailableException(body, "no Keplerian elements for " + body);
        };
    }
}
