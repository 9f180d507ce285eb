package com.astroplatform.snapshot.provider;

/**
 * Approximate mean Keplerian elements, referred to the J2000 ecliptic and equinox,
 * for 1800 AD – 2050 AD. Each element is {@code value + rate × T}, T in Julian centuries
 * from J2000.0.
 *
 * <p>Source: E. M. Standish, "Keplerian Elements for Approximate Positions of the Major
 * Planets", JPL Solar System Dynamics, Table 1.
 */
enum OrbitalElements {

    //                     a (au)       e            I (deg)       L (deg)         ϖ (deg)        Ω (deg)
    MERCURY(   0.38709927, 0.20563593,  7.00497902, 252.25032350,  77.45779628,  48.33076593,
               0.00000037, 0.00001906, -0.00594749, 149472.67411175, 0.16047689, -0.12534081),
    VENUS(     0.72333566, 0.00677672,  3.39467605, 181.97909950, 131.60246718,  76.67984255,
               0.00000390, -0.00004107, -0.00078890, 58517.81538729, 0.00268329, -0.27769418),
    EARTH_MOON_BARYCENTER(
               1.00000261, 0.01671123, -0.00001531, 100.46457166, 102.93768193,   0.0,
               0.00000562, -0.00004392, -0.01294668, 35999.37244981, 0.32327364,  0.0),
    MARS(      1.52371034, 0.09339410,  1.84969142,  -4.55343205, -23.94362959,  49.55953891,
               0.00001847, 0.00007882, -0.00813131, 19140.30268499, 0.44441088, -0.29257343),
    JUPITER(   5.20288700, 0.04838624,  1.30439695,  34.39644051,  14.72847983, 100.47390909,
              -0.00011607, -0.00013253, -0.00183714, 3034.74612775, 0.21252668,  0.20469106),
    SATURN(    9.53667594, 0.05386179,  2.48599187,  49.95424423,  92.59887831, 113.66242448,
              -0.00125060, -0.00050991, 0.00193609, 1222.49362201, -0.41897216, -0.28867794),
    URANUS(   19.18916464, 0.04725744,  0.77263783, 313.23810451, 170.95427630,  74.01692503,
              -0.00196176, -0.00004397, -0.00242939, 428.48202785, 0.40805281,  0.04240589),
    NEPTUNE(  30.06992276, 0.00859048,  1.77004347, -55.12002969,  44.96476227, 131.78422574,
               0.00026291, 0.00005105, 0.00035372, 218.45945325, -0.32241464, -0.00508664),
    PLUTO(    39.48211675, 0.24882730, 17.14001206, 238.92903833, 224.06891629, 110.30393684,
              -0.00031596, 0.00005170, 0.00004818, 145.20780515, -0.04062942, -0.01183482);

    private static final double KEPLER_TOLERANCE = 1e-12;
    private static final int KEPLER_MAX_ITERATIONS = 30;

    private final double a0, e0, i0, l0, w0, n0;
    private final double aRate, eRate, iRate, lRate, wRate, nRate;

    OrbitalElements(double a0, double e0, double i0, double l0, double w0, double n0,
                    double aRate, double eRate, double iRate, double lRate, double wRate, double nRate) {
        this.a0 = a0;
        this.e0 = e0;
        this.i0 = i0;
        this.l0 = l0;
        this.w0 = w0;
        this.n0 = n0;
        this.aRate = aRate;
        this.eRate = eRate;
        this.iRate = iRate;
        this.lRate = lRate;
        this.wRate = wRate;
        this.nRate = nRate;
    }

    /**
     * Heliocentric ecliptic rectangular coordinates (au) in the J2000 frame.
     *
     * @param t Julian centuries since J2000.0
     * @return {@code {x, y, z}}
     */
    double[] heliocentric(double t) {
        double a         = a0 + aRate * t;
        double e         = e0 + eRate * t;
        double incl      = Math.toRadians(i0 + iRate * t);
        double meanLon   = l0 + lRate * t;
        double periLon   = w0 + wRate * t;
        double node      = n0 + nRate * t;

        double argPeri   = Math.toRadians(periLon - node);
        double meanAnom  = Math.toRadians(wrap180(meanLon - periLon));
        double nodeRad   = Math.toRadians(node);

        double ecc = solveKepler(meanAnom, e);
        double xOrb = a * (Math.cos(ecc) - e);
        double yOrb = a * Math.sqrt(1.0 - e * e) * Math.sin(ecc);

        double cw = Math.cos(argPeri), sw = Math.sin(argPeri);
        double cn = Math.cos(nodeRad), sn = Math.sin(nodeRad);
        double ci = Math.cos(incl),    si = Math.sin(incl);

        double x = (cw * cn - sw * sn * ci) * xOrb + (-sw * cn - cw * sn * ci) * yOrb;
        double y = (cw * sn + sw * cn * ci) * xOrb + (-sw * sn + cw * cn * ci) * yOrb;
        double z = (sw * si) * xOrb + (cw * si) * yOrb;
        return new double[] { x, y, z };
    }

    /** Newton iteration on {@code E − e·sin E = M}, radians. */
    static double solveKepler(double meanAnomaly, double e) {
        double ecc = e < 0.8 ? meanAnomaly : Math.PI;
        for (int i = 0; i < KEPLER_MAX_ITERATIONS; i++) {
            double delta = (ecc - e * Math.sin(ecc) - meanAnomaly) / (1.0 - e * Math.cos(ecc));
            ecc -= delta;
            if (Math.abs(delta) < KEPLER_TOLERANCE) {
                break;
            }
        }
        return ecc;
    }

    private static double wrap180(double degrees) {
        double d = degrees % 360.0;
        if (d > 180.0) d -= 360.0;
        if (d < -180.0) d += 360.0;
        return d;
    }
}
