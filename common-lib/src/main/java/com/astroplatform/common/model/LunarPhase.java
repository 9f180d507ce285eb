package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param phaseAngle          {@code normalize(moon − sun)}, in [0, 360)
 * @param illuminationPercent approximate lit fraction of the disc, 0 at new and 100 at full
 */
public record LunarPhase(
    @JsonProperty("phaseAngle")          double phaseAngle,
    @JsonProperty("phaseName")           LunarPhaseName phaseName,
    @JsonProperty("illuminationPercent") double illuminationPercent
) {
    public LunarPhase {
        if (!(phaseAngle >= 0.0 && phaseAngle < 360.0)) {
            throw new IllegalArgumentException("phaseAngle out of [0,360): " + phaseAngle);
        }
        if (phaseName == null) {
            throw new IllegalArgumentException("phaseName must not be null");
        }
    }
}
