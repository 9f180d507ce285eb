package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Eight named phases, each a 45° bucket of the Sun–Moon phase angle starting at 0°.
 */
public enum LunarPhaseName {
    @JsonProperty("new")             NEW("New Moon"),
    @JsonProperty("waxing_crescent") WAXING_CRESCENT("Waxing Crescent"),
    @JsonProperty("first_quarter")   FIRST_QUARTER("First Quarter"),
    @JsonProperty("waxing_gibbous")  WAXING_GIBBOUS("Waxing Gibbous"),
    @JsonProperty("full")            FULL("Full Moon"),
    @JsonProperty("waning_gibbous")  WANING_GIBBOUS("Waning Gibbous"),
    @JsonProperty("last_quarter")    LAST_QUARTER("Last Quarter"),
    @JsonProperty("waning_crescent") WANING_CRESCENT("Waning Crescent");

    private final String displayName;

    LunarPhaseName(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Lower-case snake name, identical to the JSON value. */
    public String code() {
        return name().toLowerCase();
    }

    /** New and full moons raise the day's volatility. */
    public boolean isVolatile() {
        return this == NEW || this == FULL;
    }
}
