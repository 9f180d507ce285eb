package com.astroplatform.snapshot.provider;

import java.time.Instant;

/**
 * Time-scale helpers for the analytic ephemeris.
 *
 * <p>UTC is used directly as the dynamical time scale. The difference (about a minute in
 * this era) shifts the Moon by well under a tenth of a degree.
 */
final class JulianDay {

    static final double UNIX_EPOCH_JD = 2440587.5;
    static final double J2000_JD      = 2451545.0;
    static final double DAYS_PER_CENTURY = 36525.0;
    static final double SECONDS_PER_DAY  = 86400.0;

    private JulianDay() {}

    static double fromInstant(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
        return seconds / SECONDS_PER_DAY + UNIX_EPOCH_JD;
    }

    /** Julian centuries since J2000.0. */
    static double centuriesSinceJ2000(double jd) {
        return (jd - J2000_JD) / DAYS_PER_CENTURY;
    }
}
