package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A detected angular relationship between two bodies at one instant.
 *
 * <p>{@code bodyA} always precedes {@code bodyB} in {@link CelestialBody} declaration order;
 * {@link #of} swaps the pair when needed so that (Moon, Sun) and (Sun, Moon) produce the
 * same record.
 *
 * @param actualSeparation shortest angular distance between the bodies, in [0, 180]
 * @param orbDelta         distance from the exact aspect angle, wraparound-corrected
 * @param exactness        {@code 1 − orbDelta / orb}: 1.0 when exact, 0.0 at the orb limit
 */
public record AspectRecord(
    @JsonProperty("bodyA")            CelestialBody bodyA,
    @JsonProperty("bodyB")            CelestialBody bodyB,
    @JsonProperty("aspectType")       AspectType aspectType,
    @JsonProperty("actualSeparation") double actualSeparation,
    @JsonProperty("orbDelta")         double orbDelta,
    @JsonProperty("withinOrb")        boolean withinOrb,
    @JsonProperty("exact")            boolean exact,
    @JsonProperty("exactness")        double exactness,
    @JsonProperty("direction")        AspectDirection direction
) {
    public AspectRecord {
        if (bodyA == null || bodyB == null || aspectType == null || direction == null) {
            throw new IllegalArgumentException("aspect fields must not be null");
        }
        if (bodyA == bodyB) {
            throw new IllegalArgumentException("aspect requires two distinct bodies, got " + bodyA);
        }
        if (bodyA.ordinal() > bodyB.ordinal()) {
            throw new IllegalArgumentException("bodies not in canonical order: " + bodyA + ", " + bodyB);
        }
        if (orbDelta < 0.0) {
            throw new IllegalArgumentException("orbDelta must be >= 0: " + orbDelta);
        }
    }

    public static AspectRecord of(CelestialBody first, CelestialBody second, AspectType aspectType,
                                  double actualSeparation, double orbDelta, boolean withinOrb,
                                  boolean exact, double exactness, AspectDirection direction) {
        boolean swap = first.ordinal() > second.ordinal();
        return new AspectRecord(
            swap ? second : first,
            swap ? first : second,
            aspectType, actualSeparation, orbDelta, withinOrb, exact, exactness, direction);
    }

    public boolean involves(CelestialBody body) {
        return bodyA == body || bodyB == body;
    }

    /** {@code "<BodyA> <aspectType> <BodyB>"}, e.g. {@code "Sun opposition Moon"}. */
    public String describe() {
        return bodyA.displayName() + " " + aspectType.label() + " " + bodyB.displayName();
    }
}
