package com.astroplatform.snapshot.provider;

/**
 * Geocentric ecliptic longitude of the Moon from the largest periodic terms of the
 * ELP-2000/82 series (Meeus, Astronomical Algorithms, ch. 47). Accurate to a few
 * hundredths of a degree; referred to the mean equinox of date.
 */
final class LunarSeries {

    // {D, M, M', F, coefficient in degrees}
    private static final double[][] TERMS = {
        { 0,  0,  1,  0,  6.288774 },
        { 2,  0, -1,  0,  1.274027 },
        { 2,  0,  0,  0,  0.658314 },
        { 0,  0,  2,  0,  0.213618 },
        { 0,  1,  0,  0, -0.185116 },
        { 0,  0,  0,  2, -0.114332 },
        { 2,  0, -2,  0,  0.058793 },
        { 2, -1, -1,  0,  0.057066 },
        { 2,  0,  1,  0,  0.053322 },
        { 2, -1,  0,  0,  0.045758 },
        { 0,  1, -1,  0, -0.040923 },
        { 1,  0,  0,  0, -0.034720 },
        { 0,  1,  1,  0, -0.030383 },
        { 2,  0,  0, -2,  0.015327 },
        { 0,  0,  1,  2, -0.012528 },
        { 0,  0,  1, -2,  0.010980 },
        { 4,  0, -1,  0,  0.010675 },
        { 0,  0,  3,  0,  0.010034 },
        { 4,  0, -2,  0,  0.008548 },
        { 2,  1, -1,  0, -0.007888 },
        { 2,  1,  0,  0, -0.006766 },
        { 1,  0, -1,  0, -0.005163 },
        { 1,  1,  0,  0,  0.004987 },
        { 2, -1,  1,  0,  0.004036 },
        { 2,  0,  2,  0,  0.003994 },
        { 4,  0,  0,  0,  0.003861 },
        { 2,  0, -3,  0,  0.003665 },
        { 0,  1, -2,  0, -0.002689 },
        { 2,  0, -1,  2, -0.002602 },
        { 2, -1, -2,  0,  0.002390 },
        { 1,  0,  1,  0, -0.002348 },
        { 2, -2,  0,  0,  0.002236 },
    };

    private LunarSeries() {}

    /**
     * @param t Julian centuries since J2000.0
     * @return longitude in degrees, not normalized
     */
    static double longitude(double t) {
        double meanLongitude  = 218.3164477 + 481267.88123421 * t;
        double elongation     = 297.8501921 + 445267.1114034 * t;
        double sunAnomaly     = 357.5291092 + 35999.0502909 * t;
        double moonAnomaly    = 134.9633964 + 477198.8675055 * t;
        double latitudeArg    = 93.2720950 + 483202.0175233 * t;
        // decreasing eccentricity of Earth's orbit scales terms that contain M
        double eccentricity   = 1.0 - 0.002516 * t - 0.0000074 * t * t;

        double sum = 0.0;
        for (double[] term : TERMS) {
            double arg = term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly + term[3] * latitudeArg;
            double coefficient = term[4];
            int m = (int) Math.abs(term[1]);
            if (m == 1) coefficient *= eccentricity;
            else if (m == 2) coefficient *= eccentricity * eccentricity;
            sum += coefficient * Math.sin(Math.toRadians(arg));
        }
        return meanLongitude + sum;
    }
}
