package com.astroplatform.common.angle;

/**
 * Result of testing two longitudes against a target aspect angle.
 *
 * @param withinOrb {@code true} iff {@code delta <= orb}
 * @param delta     distance in degrees from the exact target angle, always {@code >= 0}
 */
public record OrbMatch(boolean withinOrb, double delta) {}
