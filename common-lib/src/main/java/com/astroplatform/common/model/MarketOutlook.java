package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MarketOutlook {
    @JsonProperty("bullish")  BULLISH,
    @JsonProperty("bearish")  BEARISH,
    @JsonProperty("neutral")  NEUTRAL,
    @JsonProperty("volatile") VOLATILE;

    public String code() {
        return name().toLowerCase();
    }
}
