package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Error marker for a body the ephemeris provider could not resolve. */
public record BodyFailure(
    @JsonProperty("body")   CelestialBody body,
    @JsonProperty("reason") String reason
) {}
