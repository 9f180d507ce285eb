package com.astroplatform.common.direction;

import com.astroplatform.common.angle.AngleMath;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.model.AspectDirection;

/**
 * Decides whether an aspect between two moving bodies is applying, separating or stationary.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code relativeSpeed = speedA − speedB}; below {@code stationaryEpsilon} → STATIONARY.</li>
 *   <li>Project both bodies one unit of time forward ({@code lon + speed}).</li>
 *   <li>Compare the distance to the aspect angle now and after the step:
 *       shrinking → APPLYING, growing → SEPARATING, unchanged → STATIONARY.</li>
 * </ol>
 *
 * <p>This is a one-step finite difference. Speeds must be expressed in the same time unit as
 * the step, which is the provider's unit (degrees per day).
 *
 * <p>Stateless and thread-safe.
 */
public final class DirectionClassifier {

    /** Relative speed (°/day) below which the pair is treated as stationary. */
    public static final double DEFAULT_STATIONARY_EPSILON = 0.01;

    private final double stationaryEpsilon;

    public DirectionClassifier() {
        this(DEFAULT_STATIONARY_EPSILON);
    }

    public DirectionClassifier(double stationaryEpsilon) {
        if (!(stationaryEpsilon >= 0.0) || Double.isInfinite(stationaryEpsilon)) {
            throw new EngineConfigurationException("DirectionClassifier",
                "stationaryEpsilon must be a finite value >= 0, got " + stationaryEpsilon);
        }
        this.stationaryEpsilon = stationaryEpsilon;
    }

    public AspectDirection classify(double longitudeA, double speedA,
                                    double longitudeB, double speedB,
                                    double aspectAngle) {
        double relativeSpeed = speedA - speedB;
        if (Math.abs(relativeSpeed) < stationaryEpsilon) {
            return AspectDirection.STATIONARY;
        }

        double currentSeparation = AngleMath.angularDistance(longitudeA, longitudeB);
        double futureSeparation  = AngleMath.angularDistance(longitudeA + speedA, longitudeB + speedB);

        double currentDistToAspect = Math.abs(currentSeparation - aspectAngle);
        double futureDistToAspect  = Math.abs(futureSeparation - aspectAngle);

        if (futureDistToAspect < currentDistToAspect) return AspectDirection.APPLYING;
        if (futureDistToAspect > currentDistToAspect) return AspectDirection.SEPARATING;
        return AspectDirection.STATIONARY;
    }

    public double stationaryEpsilon() {
        return stationaryEpsilon;
    }
}
