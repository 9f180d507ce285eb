package com.astroplatform.common.model;

/** Traditional character of an aspect, used for the hard/harmonious balance. */
public enum AspectNature {
    HARMONIOUS,
    HARD,
    NEUTRAL
}
