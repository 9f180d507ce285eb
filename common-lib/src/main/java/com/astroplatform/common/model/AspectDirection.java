package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Whether an aspect is moving toward exactness, away from it, or neither. */
public enum AspectDirection {
    @JsonProperty("applying")   APPLYING,
    @JsonProperty("separating") SEPARATING,
    @JsonProperty("stationary") STATIONARY
}
