package com.astroplatform.common.lunar;

import com.astroplatform.common.angle.AngleMath;
import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.LunarPhaseName;

/**
 * Classifies the Sun–Moon angle into one of eight 45° phases.
 *
 * <p>Buckets are half-open and start at 0°: new [0,45), waxing crescent [45,90), …,
 * waning crescent [315,360). The lower edge is inclusive, so 45.0 is a waxing crescent.
 *
 * <p>No logging. No side-effects.
 */
public final class LunarPhaseClassifier {

    private static final double BUCKET_WIDTH = 45.0;

    private static final LunarPhaseName[] BUCKETS = LunarPhaseName.values();

    private LunarPhaseClassifier() {}

    /** {@code normalize(moonLongitude − sunLongitude)}. */
    public static double phaseAngle(double sunLongitude, double moonLongitude) {
        return AngleMath.normalize(moonLongitude - sunLongitude);
    }

    public static LunarPhaseName classify(double phaseAngle) {
        int index = (int) Math.floor(AngleMath.normalize(phaseAngle) / BUCKET_WIDTH);
        return BUCKETS[Math.min(index, BUCKETS.length - 1)];
    }

    /** Approximate illuminated fraction of the disc in percent: 0 at new, 100 at full. */
    public static double illuminationPercent(double phaseAngle) {
        return (1.0 - Math.abs(AngleMath.HALF_CIRCLE - AngleMath.normalize(phaseAngle)) / AngleMath.HALF_CIRCLE) * 100.0;
    }

    public static LunarPhase compute(double sunLongitude, double moonLongitude) {
        double angle = phaseAngle(sunLongitude, moonLongitude);
        return new LunarPhase(angle, classify(angle), illuminationPercent(angle));
    }
}
