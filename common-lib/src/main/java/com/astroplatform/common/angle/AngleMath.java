package com.astroplatform.common.angle;

/**
 * Angle primitives shared by every engine component.
 *
 * <p>All angles are ecliptic degrees. Pure static functions: no state, no logging.
 */
public final class AngleMath {

    public static final double FULL_CIRCLE = 360.0;
    public static final double HALF_CIRCLE = 180.0;

    private AngleMath() {}

    /**
     * Maps any finite angle into {@code [0, 360)}.
     *
     * <p>Large magnitudes are first reduced with {@code %} so the add/subtract loop runs at
     * most a couple of times; the loop then handles negatives and the {@code -0.0}/360.0
     * rounding edge so the result is never 360.0.
     *
     * @throws IllegalArgumentException for NaN or infinite input
     */
    public static double normalize(double angle) {
        if (!Double.isFinite(angle)) {
            throw new IllegalArgumentException("angle must be finite: " + angle);
        }
        double a = angle % FULL_CIRCLE;
        while (a < 0.0) {
            a += FULL_CIRCLE;
        }
        while (a >= FULL_CIRCLE) {
            a -= FULL_CIRCLE;
        }
        // collapse -0.0
        return a == 0.0 ? 0.0 : a;
    }

    /**
     * Shortest angular distance between two longitudes, in {@code [0, 180]}. Symmetric.
     */
    public static double angularDistance(double a, double b) {
        double d = Math.abs(normalize(a) - normalize(b));
        return Math.min(d, FULL_CIRCLE - d);
    }

    /**
     * Tests whether two longitudes form {@code targetAngle} within {@code orb}.
     *
     * <p>For targets above zero the reflected angle {@code 360 − target} is also tested
     * and the smaller delta kept. A zero target (conjunction) has no reflection to test.
     */
    public static OrbMatch orbMatch(double a, double b, double targetAngle, double orb) {
        double actual = angularDistance(a, b);
        double delta = Math.abs(actual - targetAngle);
        if (targetAngle > 0.0) {
            double reflected = Math.abs(actual - (FULL_CIRCLE - targetAngle));
            delta = Math.min(delta, reflected);
        }
        return new OrbMatch(delta <= orb, delta);
    }
}
