package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The five canonical aspects, in the order the detector tests them.
 *
 * <p>{@link #polarity()} is the sign of the aspect's score contribution:
 * trine, sextile and conjunction lean bullish (+1), square and opposition bearish (−1).
 */
public enum AspectType {
    @JsonProperty("conjunction") CONJUNCTION("conjunction", 0.0, 8.0, AspectNature.NEUTRAL, +1),
    @JsonProperty("sextile")     SEXTILE("sextile", 60.0, 6.0, AspectNature.HARMONIOUS, +1),
    @JsonProperty("square")      SQUARE("square", 90.0, 8.0, AspectNature.HARD, -1),
    @JsonProperty("trine")       TRINE("trine", 120.0, 8.0, AspectNature.HARMONIOUS, +1),
    @JsonProperty("opposition")  OPPOSITION("opposition", 180.0, 8.0, AspectNature.HARD, -1);

    private final String label;
    private final double angle;
    private final double defaultOrb;
    private final AspectNature nature;
    private final int polarity;

    AspectType(String label, double angle, double defaultOrb, AspectNature nature, int polarity) {
        this.label = label;
        this.angle = angle;
        this.defaultOrb = defaultOrb;
        this.nature = nature;
        this.polarity = polarity;
    }

    /** Lower-case name used in event strings and persisted JSON. */
    public String label() {
        return label;
    }

    public double angle() {
        return angle;
    }

    public double defaultOrb() {
        return defaultOrb;
    }

    public AspectNature nature() {
        return nature;
    }

    public int polarity() {
        return polarity;
    }
}
