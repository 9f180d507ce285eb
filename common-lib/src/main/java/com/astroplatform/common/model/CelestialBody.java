package com.astroplatform.common.model;

/**
 * Bodies tracked by the engine, in canonical order.
 *
 * <p>Declaration order is significant: {@link AspectRecord} orders its pair by
 * {@link #ordinal()} so that a relation between two bodies has a single representation.
 */
public enum CelestialBody {
    SUN("Sun"),
    MOON("Moon"),
    MERCURY("Mercury"),
    VENUS("Venus"),
    MARS("Mars"),
    JUPITER("Jupiter"),
    SATURN("Saturn"),
    URANUS("Uranus"),
    NEPTUNE("Neptune"),
    PLUTO("Pluto");

    private final String displayName;

    CelestialBody(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
