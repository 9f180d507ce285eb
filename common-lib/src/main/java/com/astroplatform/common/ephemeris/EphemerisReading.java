package com.astroplatform.common.ephemeris;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw provider output for one body at one instant.
 *
 * @param longitude geocentric ecliptic longitude in degrees; any finite value, the engine normalizes it
 * @param speed     longitudinal speed in degrees per day, negative when retrograde
 */
public record EphemerisReading(
    @JsonProperty("longitude") double longitude,
    @JsonProperty("speed")     double speed
) {}
